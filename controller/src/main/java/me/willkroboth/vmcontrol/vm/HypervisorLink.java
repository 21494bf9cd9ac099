package me.willkroboth.vmcontrol.vm;

import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgent;

import java.util.List;
import java.util.Optional;

/**
 * Everything the control plane needs from the hypervisor.
 */
public interface HypervisorLink extends AutoCloseable {
    List<DomainHandle> listActive() throws HypervisorException;

    /**
     * @return The domain called {@code name}, or empty if the hypervisor does not know it
     */
    Optional<DomainHandle> lookup(String name) throws HypervisorException;

    MonitorEndpoint monitorEndpoint(DomainHandle domain) throws HypervisorException;

    /**
     * @return A channel to the domain's QEMU guest agent, or empty if this link cannot reach guest agents
     */
    default Optional<GuestAgent> guestAgent(DomainHandle domain) throws HypervisorException {
        return Optional.empty();
    }

    @Override
    void close() throws HypervisorException;
}
