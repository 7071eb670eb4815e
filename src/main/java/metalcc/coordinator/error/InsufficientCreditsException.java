package metalcc.coordinator.error;

public class InsufficientCreditsException extends ControlPlaneException {

    private final long required;
    private final long available;

    public InsufficientCreditsException(long required, long available) {
        super("insufficient credits: need " + required + ", have " + available);
        this.required = required;
        this.available = available;
    }

    public long required() {
        return required;
    }

    public long available() {
        return available;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INSUFFICIENT_CREDITS;
    }
}
