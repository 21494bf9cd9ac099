package me.willkroboth.vmcontrol.vm;

import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory hypervisor. Monitor endpoints point at paths that do not exist, so it is used together with a fake
 * session factory.
 */
public class FakeHypervisorLink implements HypervisorLink {
    private final Map<String, DomainHandle> domains = new LinkedHashMap<>();
    private final Map<String, GuestAgent> guestAgents = new LinkedHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private volatile boolean closed = false;

    public synchronized FakeHypervisorLink addRunning(String name) {
        domains.put(name, new DomainHandle(name, "uuid-" + name, domains.size() + 1, true));
        return this;
    }

    public synchronized FakeHypervisorLink addStopped(String name) {
        domains.put(name, new DomainHandle(name, "uuid-" + name, -1, false));
        return this;
    }

    public synchronized FakeHypervisorLink withGuestAgent(String name, GuestAgent agent) {
        guestAgents.put(name, agent);
        return this;
    }

    public int lookups() {
        return lookups.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized List<DomainHandle> listActive() {
        List<DomainHandle> active = new ArrayList<>();
        for (DomainHandle domain : domains.values()) {
            if (domain.active()) active.add(domain);
        }
        return active;
    }

    @Override
    public synchronized Optional<DomainHandle> lookup(String name) {
        lookups.incrementAndGet();
        return Optional.ofNullable(domains.get(name));
    }

    @Override
    public MonitorEndpoint monitorEndpoint(DomainHandle domain) throws HypervisorException {
        if (!domain.active()) throw new HypervisorException("Domain " + domain.name() + " is not running");
        return new MonitorEndpoint(Path.of("/nonexistent", domain.name() + ".sock"));
    }

    @Override
    public synchronized Optional<GuestAgent> guestAgent(DomainHandle domain) {
        return Optional.ofNullable(guestAgents.get(domain.name()));
    }

    @Override
    public void close() {
        closed = true;
    }
}
