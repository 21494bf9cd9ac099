package me.willkroboth.vmcontrol.actor;

import java.time.Duration;

/**
 * Tells a {@link VmActor} when the software inside its guest is ready.
 */
@FunctionalInterface
public interface AgentSignal {
    /**
     * @return True once the guest side is reachable, false if {@code timeout} elapsed first
     */
    boolean awaitConnected(String vmName, Duration timeout) throws InterruptedException;
}
