package in.warroom.service.approval;

/**
 * Thrown when the approval gate is driven out of order (opened while pending,
 * reset while pending, awaited while idle). Indicates a programming error.
 */
public class GateMisuseException extends IllegalStateException {

    public GateMisuseException(String message) {
        super(message);
    }
}
