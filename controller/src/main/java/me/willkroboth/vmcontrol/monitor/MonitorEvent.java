package me.willkroboth.vmcontrol.monitor;

import com.google.gson.JsonObject;

// https://www.qemu.org/docs/master/interop/qmp-spec.html#asynchronous-events
public record MonitorEvent(String event, JsonObject data, long timestampSeconds, long timestampMicroseconds) {
}
