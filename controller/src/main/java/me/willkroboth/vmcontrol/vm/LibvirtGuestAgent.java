package me.willkroboth.vmcontrol.vm;

import com.google.gson.JsonObject;
import me.willkroboth.vmcontrol.monitor.CommandFailedException;
import me.willkroboth.vmcontrol.monitor.DisconnectedException;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.monitor.ProtocolTimeoutException;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgent;
import org.libvirt.Domain;
import org.libvirt.Error.ErrorNumber;
import org.libvirt.LibvirtException;

/**
 * Reaches the guest agent through libvirt, which owns the agent's virtio-serial channel.
 */
public class LibvirtGuestAgent implements GuestAgent {
    private final Domain domain;
    private final int timeoutSeconds;

    public LibvirtGuestAgent(Domain domain, int timeoutSeconds) {
        this.domain = domain;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String execute(JsonObject request) throws ProtocolException {
        String command = request.get("execute").getAsString();
        try {
            // https://libvirt.org/html/libvirt-libvirt-qemu.html#virDomainQemuAgentCommand
            return domain.qemuAgentCommand(request.toString(), timeoutSeconds, 0);
        } catch (LibvirtException exception) {
            ErrorNumber errorNumber = exception.getError().getCode();
            if (errorNumber == ErrorNumber.VIR_ERR_AGENT_UNRESPONSIVE ||
                errorNumber == ErrorNumber.VIR_ERR_OPERATION_INVALID) {
                throw new DisconnectedException("Guest agent is not connected (" + command + ")", exception);
            }
            if (errorNumber == ErrorNumber.VIR_ERR_OPERATION_TIMEOUT) {
                throw new ProtocolTimeoutException("Guest agent did not answer " + command, exception);
            }
            // libvirt reports errors returned by the agent itself this way too
            throw new CommandFailedException(command, errorNumber.name(), exception.getError().getMessage());
        }
    }
}
