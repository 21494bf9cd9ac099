package me.willkroboth.vmcontrol.vm.guestagent;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import me.willkroboth.vmcontrol.monitor.DisconnectedException;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;

/**
 * A guest agent operation that produces a {@code T}. Most are a single {@link AgentRequest}, some chain several.
 * <p>
 * Command reference: https://qemu-project.gitlab.io/qemu/interop/qemu-ga-ref.html
 */
@FunctionalInterface
public interface GuestAgentCommand<T> {
    /**
     * @param verbose Whether the exchange is logged at info rather than debug
     */
    T run(GuestAgent agent, boolean verbose) throws ProtocolException;

    // Base64 text in a file read or write; a multiple of 4 so splitting never breaks a quantum
    int TRANSFER_CHUNK = 1 << 17;

    private static String stringOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) return null;
        return element.getAsString();
    }

    private static Integer intOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) return null;
        return element.getAsInt();
    }

    // guest-ping
    static GuestAgentCommand<Boolean> ping() {
        AgentRequest<Void> request = new AgentRequest<>("guest-ping", AgentRequest.NO_RESULT);

        return (agent, verbose) -> {
            try {
                request.run(agent, verbose);
                return true;
            } catch (DisconnectedException notConnected) {
                return false;
            }
        };
    }

    // guest-get-osinfo
    static GuestAgentCommand<GuestOsInfo> getOsInfo() {
        return new AgentRequest<>("guest-get-osinfo", result -> {
            JsonObject info = result.getAsJsonObject();
            return new GuestOsInfo(
                stringOrNull(info, "id"),
                stringOrNull(info, "name"),
                stringOrNull(info, "pretty-name"),
                stringOrNull(info, "version"),
                stringOrNull(info, "kernel-release"),
                stringOrNull(info, "machine")
            );
        });
    }

    // guest-exec
    static GuestAgentCommand<Integer> executeCommand(String path, String[] arg, String[] env, String inputData, boolean captureOutput) {
        return new AgentRequest<>("guest-exec", result -> result.getAsJsonObject().get("pid").getAsInt())
            .require("path", path)
            .optional("arg", arg)
            .optional("env", env)
            .optional("input-data", Base64Payload.encodeText(inputData))
            .flag("capture-output", captureOutput);
    }

    // guest-exec-status; exit details are only reported once the process is gone
    static GuestAgentCommand<GuestExecStatus> getExecutionStatus(int pid) {
        return new AgentRequest<>("guest-exec-status", result -> {
            JsonObject status = result.getAsJsonObject();
            if (!status.get("exited").getAsBoolean()) {
                return new GuestExecStatus(false, null, null, null, null);
            }
            return new GuestExecStatus(
                true,
                intOrNull(status, "exitcode"),
                intOrNull(status, "signal"),
                Base64Payload.decodeText(stringOrNull(status, "out-data")),
                Base64Payload.decodeText(stringOrNull(status, "err-data"))
            );
        }).require("pid", pid);
    }

    // guest-file-open
    static GuestAgentCommand<Integer> openFile(String path, FileOpenMode openMode) {
        AgentRequest<Integer> request = new AgentRequest<>("guest-file-open", JsonElement::getAsInt)
            .require("path", path);
        if (openMode != null) request.require("mode", openMode);
        return request;
    }

    // guest-file-close
    static GuestAgentCommand<Void> closeFile(int fileHandle) {
        return new AgentRequest<>("guest-file-close", AgentRequest.NO_RESULT)
            .require("handle", fileHandle);
    }

    // guest-file-read, repeated until the agent reports end of file
    static GuestAgentCommand<InputStream> readFile(int fileHandle) {
        AgentRequest<GuestFileRead> readChunk = new AgentRequest<>("guest-file-read", result -> {
            JsonObject chunk = result.getAsJsonObject();
            return new GuestFileRead(
                chunk.get("count").getAsInt(),
                Base64Payload.decode(chunk.get("buf-b64").getAsString()),
                chunk.get("eof").getAsBoolean()
            );
        }).require("handle", fileHandle)
            .require("count", TRANSFER_CHUNK);

        return (agent, verbose) -> {
            ByteArrayOutputStream content = new ByteArrayOutputStream();
            int chunks = 0;
            while (true) {
                GuestFileRead chunk = readChunk.run(agent, verbose);
                content.write(chunk.bytes(), 0, chunk.bytes().length);
                chunks++;
                if (chunk.eof()) break;
            }
            LoggerFactory.getLogger(GuestAgentCommand.class)
                .debug("Read handle {} in {} chunk(s), {} bytes", fileHandle, chunks, content.size());
            return new ByteArrayInputStream(content.toByteArray());
        };
    }

    // guest-file-write; large payloads go over several requests since libvirt caps the string it forwards
    static GuestAgentCommand<Void> writeFile(int fileHandle, byte[] bytes) {
        String encoded = Base64Payload.encode(bytes);

        return (agent, verbose) -> {
            int offset = 0;
            do {
                int end = Math.min(offset + TRANSFER_CHUNK, encoded.length());
                new AgentRequest<>("guest-file-write", AgentRequest.NO_RESULT)
                    .require("handle", fileHandle)
                    .require("buf-b64", encoded.substring(offset, end))
                    .run(agent, verbose);
                offset = end;
            } while (offset < encoded.length());

            if (encoded.length() > TRANSFER_CHUNK) {
                LoggerFactory.getLogger(GuestAgentCommand.class)
                    .debug("Wrote handle {} in {} segments", fileHandle, (encoded.length() + TRANSFER_CHUNK - 1) / TRANSFER_CHUNK);
            }
            return null;
        };
    }
}
