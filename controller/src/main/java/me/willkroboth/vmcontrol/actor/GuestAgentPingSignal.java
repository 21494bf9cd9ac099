package me.willkroboth.vmcontrol.actor;

import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.vm.DomainHandle;
import me.willkroboth.vmcontrol.vm.HypervisorException;
import me.willkroboth.vmcontrol.vm.HypervisorLink;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgent;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Considers a guest connected once its QEMU guest agent answers {@code guest-ping}.
 */
public class GuestAgentPingSignal implements AgentSignal {
    private static final Logger log = LoggerFactory.getLogger(GuestAgentPingSignal.class);

    private final HypervisorLink link;
    private final Duration pollInterval;

    public GuestAgentPingSignal(HypervisorLink link, Duration pollInterval) {
        this.link = link;
        this.pollInterval = pollInterval;
    }

    @Override
    public boolean awaitConnected(String vmName, Duration timeout) throws InterruptedException {
        log.info("Waiting up to {}s for the guest agent of {}", timeout.toSeconds(), vmName);
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (ping(vmName)) {
                log.info("Guest agent of {} is up", vmName);
                return true;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            Thread.sleep(Math.min(pollInterval.toMillis(), Math.max(1, remaining / 1_000_000)));
        }
    }

    private boolean ping(String vmName) {
        try {
            Optional<DomainHandle> domain = link.lookup(vmName);
            if (domain.isEmpty()) return false;

            Optional<GuestAgent> agent = link.guestAgent(domain.get());
            if (agent.isEmpty()) return false;

            return GuestAgentCommand.ping().run(agent.get(), false);
        } catch (HypervisorException | ProtocolException exception) {
            log.debug("Guest agent of {} not ready yet", vmName, exception);
            return false;
        }
    }
}
