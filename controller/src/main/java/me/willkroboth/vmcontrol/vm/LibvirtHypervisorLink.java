package me.willkroboth.vmcontrol.vm;

import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgent;
import org.libvirt.Connect;
import org.libvirt.Domain;
import org.libvirt.Error.ErrorNumber;
import org.libvirt.LibvirtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class LibvirtHypervisorLink implements HypervisorLink {
    private static final Logger log = LoggerFactory.getLogger(LibvirtHypervisorLink.class);

    // libvirt shortens long domain names when it names the per-domain directory
    private static final int SHORT_NAME_LENGTH = 20;

    private final Connect connect;
    private final Path monitorSocketDirectory;
    private final int guestAgentTimeoutSeconds;

    public LibvirtHypervisorLink(Connect connect, Path monitorSocketDirectory, int guestAgentTimeoutSeconds) {
        this.connect = connect;
        this.monitorSocketDirectory = monitorSocketDirectory;
        this.guestAgentTimeoutSeconds = guestAgentTimeoutSeconds;
    }

    public static LibvirtHypervisorLink connect(String uri, Path monitorSocketDirectory, int guestAgentTimeoutSeconds) throws HypervisorException {
        log.info("Connecting to libvirt at {}", uri);
        try {
            Connect connect = new Connect(uri);
            // Set the error callback to nop https://libvirt.org/errors.html
            //  The default callback prints every error to the console, they are reported through exceptions anyway
            connect.setConnectionErrorCallback((userData, error) -> {
            });
            return new LibvirtHypervisorLink(connect, monitorSocketDirectory, guestAgentTimeoutSeconds);
        } catch (LibvirtException exception) {
            throw new HypervisorException("Could not connect to " + uri, exception);
        }
    }

    @Override
    public List<DomainHandle> listActive() throws HypervisorException {
        try {
            List<DomainHandle> domains = new ArrayList<>();
            for (int id : connect.listDomains()) {
                domains.add(describe(connect.domainLookupByID(id)));
            }
            log.info("Found {} active domains", domains.size());
            return domains;
        } catch (LibvirtException exception) {
            throw new HypervisorException("Could not list active domains", exception);
        }
    }

    @Override
    public Optional<DomainHandle> lookup(String name) throws HypervisorException {
        try {
            return Optional.of(describe(connect.domainLookupByName(name)));
        } catch (LibvirtException exception) {
            if (exception.getError().getCode() == ErrorNumber.VIR_ERR_NO_DOMAIN) {
                return Optional.empty();
            }
            throw new HypervisorException("Could not look up domain " + name, exception);
        }
    }

    @Override
    public MonitorEndpoint monitorEndpoint(DomainHandle domain) throws HypervisorException {
        // Only have a monitor if running
        if (!domain.active()) {
            throw new HypervisorException("Domain " + domain.name() + " is not running, so it has no monitor");
        }

        // Default libvirt layout: <qemu state dir>/domain-<id>-<short name>/monitor.sock
        String shortName = domain.name().length() > SHORT_NAME_LENGTH
            ? domain.name().substring(0, SHORT_NAME_LENGTH)
            : domain.name();
        Path socket = monitorSocketDirectory
            .resolve("domain-" + domain.id() + "-" + shortName)
            .resolve("monitor.sock");

        if (!Files.exists(socket)) {
            throw new HypervisorException("Monitor socket for " + domain.name() + " not found at " + socket);
        }
        log.debug("Monitor socket for {}: {}", domain.name(), socket);
        return new MonitorEndpoint(socket);
    }

    @Override
    public Optional<GuestAgent> guestAgent(DomainHandle domain) throws HypervisorException {
        try {
            return Optional.of(new LibvirtGuestAgent(connect.domainLookupByUUIDString(domain.uuid()), guestAgentTimeoutSeconds));
        } catch (LibvirtException exception) {
            throw new HypervisorException("Could not reach domain " + domain.name(), exception);
        }
    }

    private static DomainHandle describe(Domain domain) throws LibvirtException {
        return new DomainHandle(domain.getName(), domain.getUUIDString(), domain.getID(), domain.isActive() == 1);
    }

    @Override
    public void close() throws HypervisorException {
        try {
            connect.close();
        } catch (LibvirtException exception) {
            throw new HypervisorException("Could not close libvirt connection", exception);
        }
    }
}
