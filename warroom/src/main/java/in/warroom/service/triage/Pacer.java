package in.warroom.service.triage;

import java.time.Duration;

/**
 * Paces the triage script. Runs on the orchestrator's own thread only.
 */
@FunctionalInterface
public interface Pacer {

    /**
     * Sleep for (a scaled and capped version of) the scripted pause.
     */
    void pause(Duration scripted) throws InterruptedException;

    /**
     * A pacer that never sleeps.
     */
    static Pacer none() {
        return scripted -> {};
    }
}
