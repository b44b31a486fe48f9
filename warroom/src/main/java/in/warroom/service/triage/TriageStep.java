package in.warroom.service.triage;

import java.time.Duration;

/**
 * Fixed order of the triage script, with the scripted "thinking" pause that
 * follows each step before the next speaker.
 */
public enum TriageStep {
    OPEN(2_000),
    REQUEST_ASSESSMENT(4_000),
    ASSESSMENT(2_000),
    REQUEST_DEPLOYS(3_000),
    DEPLOYS(2_000),
    PAST_INCIDENTS(2_000),
    ROUTE(4_000),
    DOMAIN_ANALYSIS(3_000),
    DOMAIN_CONFIRM(2_000),
    REQUEST_FIX(4_000),
    INSPECT(3_000),

    // Only when the incident carries a patch
    SHOW_DIFF(2_000),
    APPLY(3_000),
    BUILD(1_000),
    APPROVAL(1_500),
    DEPLOY(2_000),
    CONFIRM(3_000),

    CLOSE(2_000),
    REPORT(0);

    /**
     * Pause before the opening message so viewers who just pressed start can attach.
     */
    public static final Duration LEAD_IN = Duration.ofSeconds(3);

    private final Duration pause;

    TriageStep(long pauseMillis) {
        this.pause = Duration.ofMillis(pauseMillis);
    }

    public Duration pause() {
        return pause;
    }
}
