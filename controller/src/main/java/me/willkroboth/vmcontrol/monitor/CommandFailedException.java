package me.willkroboth.vmcontrol.monitor;

/**
 * The peer answered with an {@code error} object. The class and description are kept exactly as received.
 */
public class CommandFailedException extends ProtocolException {
    private final String errorClass;
    private final String description;

    public CommandFailedException(String command, String errorClass, String description) {
        super(command + " failed: " + errorClass + " - " + description);
        this.errorClass = errorClass;
        this.description = description;
    }

    public String getErrorClass() {
        return errorClass;
    }

    public String getDescription() {
        return description;
    }
}
