package in.warroom.service.session;

/**
 * Thrown when a triage run is requested while another one is still active.
 * Recoverable: the caller may retry once the current run has ended.
 */
public class AlreadyRunningException extends RuntimeException {

    public AlreadyRunningException() {
        super("already running");
    }
}
