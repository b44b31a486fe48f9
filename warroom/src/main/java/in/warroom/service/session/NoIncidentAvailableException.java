package in.warroom.service.session;

/**
 * Thrown when the incident provider cannot supply an incident, so no run is admitted.
 */
public class NoIncidentAvailableException extends RuntimeException {

    public NoIncidentAvailableException(String message) {
        super(message);
    }

    public NoIncidentAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
