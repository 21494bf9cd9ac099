package me.willkroboth.vmcontrol.vm.guestagent;

import com.google.gson.JsonObject;
import me.willkroboth.vmcontrol.monitor.ProtocolException;

/**
 * Raw access to a QEMU guest agent running inside one VM.
 */
@FunctionalInterface
public interface GuestAgent {
    /**
     * @param request The full {@code {"execute": ..., "arguments": ...}} request
     * @return The raw JSON response
     */
    String execute(JsonObject request) throws ProtocolException;
}
