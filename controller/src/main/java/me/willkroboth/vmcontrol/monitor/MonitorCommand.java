package me.willkroboth.vmcontrol.monitor;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;

@FunctionalInterface
public interface MonitorCommand<T> {
    T run(MonitorSession session) throws ProtocolException;

    // Helper methods
    private static JsonObject qcode(String code) {
        JsonObject key = new JsonObject();
        key.addProperty("type", "qcode");
        key.addProperty("data", code);
        return key;
    }

    // Command builders
    // `qmp_capabilities` https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-control.qmp_capabilities
    static MonitorCommand<Void> capabilities() {
        return new MonitorRequest<>("qmp_capabilities", MonitorRequest.NO_RESULT);
    }

    // KEYBOARD
    // `send-key` https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-ui.send-key
    //  Every key in one request is pressed together, then all are released
    static MonitorCommand<Void> sendKeys(List<String> codes, Integer holdTimeMillis) {
        JsonArray keys = new JsonArray();
        for (String code : codes) {
            keys.add(qcode(code));
        }

        return new MonitorRequest<>("send-key", MonitorRequest.NO_RESULT)
            .require("keys", keys)
            .optional("hold-time", holdTimeMillis);
    }

    static MonitorCommand<Void> sendKey(String code) {
        return sendKeys(List.of(code), null);
    }

    // `input-send-event` https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-ui.input-send-event
    //  Unlike send-key this only presses or only releases, so modifiers can be held across another key
    static MonitorCommand<Void> keyEvent(String code, boolean down) {
        JsonObject data = new JsonObject();
        data.add("key", qcode(code));
        data.addProperty("down", down);

        JsonObject event = new JsonObject();
        event.addProperty("type", "key");
        event.add("data", data);

        JsonArray events = new JsonArray();
        events.add(event);

        return new MonitorRequest<>("input-send-event", MonitorRequest.NO_RESULT)
            .require("events", events);
    }

    // STATUS
    // `query-status` https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-run-state.query-status
    static MonitorCommand<VmStatus> queryStatus() {
        return new MonitorRequest<>("query-status", result -> {
            JsonObject response = result.getAsJsonObject();
            return new VmStatus(
                response.get("status").getAsString(),
                response.get("running").getAsBoolean()
            );
        });
    }

    // `query-version` https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-control.query-version
    static MonitorCommand<String> queryVersion() {
        return new MonitorRequest<>("query-version", result -> {
            JsonObject qemu = result.getAsJsonObject().getAsJsonObject("qemu");
            return qemu.get("major").getAsInt() + "." + qemu.get("minor").getAsInt() + "." + qemu.get("micro").getAsInt();
        });
    }

    static MonitorCommand<JsonElement> raw(String command, JsonObject arguments) {
        return session -> session.execute(command, arguments);
    }
}
