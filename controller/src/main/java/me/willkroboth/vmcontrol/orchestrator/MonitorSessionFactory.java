package me.willkroboth.vmcontrol.orchestrator;

import me.willkroboth.vmcontrol.monitor.DisconnectedException;
import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.monitor.MonitorSession;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.monitor.QmpMonitorSession;
import me.willkroboth.vmcontrol.monitor.UnixSocketMonitorChannel;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens a negotiated monitor session for a VM the orchestrator is about to drive.
 */
@FunctionalInterface
public interface MonitorSessionFactory {
    MonitorSession open(MonitorEndpoint endpoint) throws ProtocolException;

    // QMP over the Unix socket libvirt creates for every running domain
    static MonitorSessionFactory unixSocket(Duration commandTimeout) {
        return endpoint -> {
            UnixSocketMonitorChannel channel;
            try {
                channel = UnixSocketMonitorChannel.open(endpoint);
            } catch (IOException exception) {
                throw new DisconnectedException("Could not connect to monitor at " + endpoint.path(), exception);
            }
            return QmpMonitorSession.connect(channel, commandTimeout);
        };
    }
}
