package me.willkroboth.vmcontrol.actor;

import java.time.Duration;

/**
 * The orchestrator's side of an actor: the sending end of its commands and the receiving end of its events.
 */
public final class VmActorHandle {
    private final String vmName;
    private final Channel<VmCommand> commands;
    private final Channel<VmEvent> events;

    public VmActorHandle(String vmName, Channel<VmCommand> commands, Channel<VmEvent> events) {
        this.vmName = vmName;
        this.commands = commands;
        this.events = events;
    }

    public String vmName() {
        return vmName;
    }

    /**
     * Queues a command without waiting for the actor.
     *
     * @return False if the actor's command queue is full
     * @throws ChannelClosedException If the actor no longer accepts commands
     */
    public boolean send(VmCommand command) {
        return commands.offer(command);
    }

    /**
     * @return The next event, or null once the actor has stopped and every event was consumed
     */
    public VmEvent nextEvent() throws InterruptedException {
        return events.receive();
    }

    /**
     * @return The next event, or null if none arrived within {@code timeout} or the actor has stopped
     */
    public VmEvent pollEvent(Duration timeout) throws InterruptedException {
        return events.poll(timeout);
    }

    public boolean eventsExhausted() {
        return events.isClosed() && events.size() == 0;
    }

    // Stops the actor once it has worked through what is already queued
    public void closeCommands() {
        commands.close();
    }

    public boolean acceptsCommands() {
        return !commands.isClosed();
    }

    @Override
    public String toString() {
        return "VmActorHandle[" + vmName + "]";
    }
}
