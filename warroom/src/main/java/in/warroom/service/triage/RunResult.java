package in.warroom.service.triage;

import java.util.Locale;

/**
 * How a triage run ended.
 */
public enum RunResult {
    COMPLETED,   // report published
    REJECTED,    // deployment rejected at the approval gate, script cut short
    FAILED;      // unexpected error, nothing further published

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
