package me.willkroboth.vmcontrol.vm.guestagent;

import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.monitor.ProtocolParseException;
import me.willkroboth.vmcontrol.monitor.ProtocolTimeoutException;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Higher level guest operations built from {@link GuestAgentCommand}s.
 */
public class GuestAgentClient {
    private static final Logger log = LoggerFactory.getLogger(GuestAgentClient.class);

    private final GuestAgent agent;
    private final Duration pollInterval;
    private final Duration timeout;

    public GuestAgentClient(GuestAgent agent, Duration pollInterval, Duration timeout) {
        this.agent = agent;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    public boolean isAvailable() throws ProtocolException {
        return GuestAgentCommand.ping().run(agent, false);
    }

    public GuestOsInfo osInfo() throws ProtocolException {
        return GuestAgentCommand.getOsInfo().run(agent, true);
    }

    // Shell commands: https://www.0xf8.org/2022/01/executing-arbitrary-commands-in-your-libvirt-qemu-virtual-machine-through-qemu-guest-agent/
    public GuestExecStatus executeShell(String command) throws ProtocolException, InterruptedException {
        GuestOsInfo osInfo = null;
        try {
            osInfo = osInfo();
        } catch (ProtocolException exception) {
            // Older agents do not implement guest-get-osinfo, assume a unix-like guest
            log.debug("Could not determine guest OS, defaulting to /bin/sh", exception);
        }

        String[] invocation = osInfo != null && osInfo.isWindows()
            ? new String[]{"C:\\Windows\\System32\\cmd.exe", "/c", command}
            : new String[]{"/bin/sh", "-c", command};

        String[] arguments = new String[invocation.length - 1];
        System.arraycopy(invocation, 1, arguments, 0, arguments.length);

        int pid = GuestAgentCommand.executeCommand(invocation[0], arguments, null, null, true).run(agent, true);
        return waitForProcessFinish(pid);
    }

    public GuestExecStatus waitForProcessFinish(int pid) throws ProtocolException, InterruptedException {
        GuestAgentCommand<GuestExecStatus> getStatus = GuestAgentCommand.getExecutionStatus(pid);
        long deadline = System.nanoTime() + timeout.toNanos();

        GuestExecStatus status;
        while (true) {
            // Polling only logs at debug level (log = false)
            status = getStatus.run(agent, false);
            if (status.exited()) break;

            if (System.nanoTime() >= deadline) {
                throw new ProtocolTimeoutException("guest-exec-status for pid " + pid, timeout);
            }
            Thread.sleep(pollInterval.toMillis());
        }

        log.debug("Guest process {} exited with {}", pid, status.exitCodeOr(-1));
        return status;
    }

    // File IO
    public String readFile(String path) throws ProtocolException {
        log.info("Reading guest file {}", path);
        int fileHandle = GuestAgentCommand.openFile(path, FileOpenMode.READ).run(agent, true);
        try (InputStream content = GuestAgentCommand.readFile(fileHandle).run(agent, false)) {
            return IOUtils.toString(content, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            // Only in-memory streams are involved, so this means the bytes were not valid
            throw new ProtocolParseException("Could not decode " + path, exception);
        } finally {
            GuestAgentCommand.closeFile(fileHandle).run(agent, false);
        }
    }

    public void writeFile(String path, String content) throws ProtocolException {
        log.info("Writing guest file {} ({} characters)", path, content.length());
        int fileHandle = GuestAgentCommand.openFile(path, FileOpenMode.WRITE).run(agent, true);
        try {
            GuestAgentCommand.writeFile(fileHandle, content.getBytes(StandardCharsets.UTF_8)).run(agent, false);
        } finally {
            GuestAgentCommand.closeFile(fileHandle).run(agent, false);
        }
    }
}
