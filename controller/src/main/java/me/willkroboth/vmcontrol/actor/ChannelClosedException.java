package me.willkroboth.vmcontrol.actor;

public class ChannelClosedException extends IllegalStateException {
    public ChannelClosedException(String message) {
        super(message);
    }
}
