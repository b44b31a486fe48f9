package in.warroom.service.triage;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sleeps for the scripted pause multiplied by a scale factor, never longer than a cap.
 * Keeps a whole run short enough for idle-connection limits of hosted platforms.
 */
public final class ScaledPacer implements Pacer {

    private final double scale;
    private final Duration cap;

    public ScaledPacer(double scale, Duration cap) {
        if (scale < 0) {
            throw new IllegalArgumentException("scale must not be negative: " + scale);
        }
        this.scale = scale;
        this.cap = cap;
    }

    @Override
    public void pause(Duration scripted) throws InterruptedException {
        long millis = effectiveMillis(scripted);
        if (millis > 0) {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
    }

    long effectiveMillis(Duration scripted) {
        long scaled = Math.round(scripted.toMillis() * scale);
        return Math.max(0, Math.min(scaled, cap.toMillis()));
    }
}
