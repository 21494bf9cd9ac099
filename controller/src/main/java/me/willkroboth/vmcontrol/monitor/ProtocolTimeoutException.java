package me.willkroboth.vmcontrol.monitor;

import java.time.Duration;

public class ProtocolTimeoutException extends ProtocolException {
    public ProtocolTimeoutException(String command, Duration timeout) {
        super("No response to " + command + " within " + timeout.toMillis() + "ms");
    }

    public ProtocolTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
