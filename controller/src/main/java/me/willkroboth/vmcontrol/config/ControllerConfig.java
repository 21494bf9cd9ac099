package me.willkroboth.vmcontrol.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.willkroboth.vmcontrol.keymapping.KeyboardLayout;

import java.io.Reader;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings shared by the orchestrator and every actor it starts.
 *
 * @param holdTimeMillis How long {@code send-key} holds each key, or null for QEMU's default
 */
public record ControllerConfig(
    String libvirtUri,
    Path monitorSocketDirectory,
    KeyboardLayout keyboardLayout,
    Duration keyDebounce,
    Integer holdTimeMillis,
    Duration commandTimeout,
    Duration guestAgentTimeout,
    Duration execPollInterval,
    int commandQueueCapacity,
    Duration batchTestTimeout
) {
    public static final String DEFAULT_LIBVIRT_URI = "qemu:///system";
    public static final Path DEFAULT_MONITOR_SOCKET_DIRECTORY = Path.of("/var/lib/libvirt/qemu");

    public ControllerConfig {
        if (libvirtUri == null || libvirtUri.isBlank()) throw new IllegalArgumentException("libvirtUri must be given");
        if (monitorSocketDirectory == null) throw new IllegalArgumentException("monitorSocketDirectory must be given");
        if (keyboardLayout == null) throw new IllegalArgumentException("keyboardLayout must be given");
        requireNotNegative("keyDebounce", keyDebounce);
        if (holdTimeMillis != null && holdTimeMillis < 0) {
            throw new IllegalArgumentException("holdTimeMillis must not be negative, got " + holdTimeMillis);
        }
        requirePositive("commandTimeout", commandTimeout);
        requirePositive("guestAgentTimeout", guestAgentTimeout);
        requirePositive("execPollInterval", execPollInterval);
        if (commandQueueCapacity <= 0) {
            throw new IllegalArgumentException("commandQueueCapacity must be positive, got " + commandQueueCapacity);
        }
        requirePositive("batchTestTimeout", batchTestTimeout);
    }

    public static ControllerConfig defaults() {
        return new ControllerConfig(
            DEFAULT_LIBVIRT_URI,
            DEFAULT_MONITOR_SOCKET_DIRECTORY,
            KeyboardLayout.EN_US,
            Duration.ofMillis(50),
            null,
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofMillis(500),
            256,
            Duration.ofSeconds(60)
        );
    }

    /**
     * Reads a JSON object of overrides. Missing keys keep their default and unknown keys are ignored.
     *
     * @throws IllegalArgumentException If the document is not a JSON object or a value is invalid
     */
    public static ControllerConfig fromJson(Reader reader) {
        JsonObject json;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) throw new IllegalArgumentException("Configuration must be a JSON object");
            json = parsed.getAsJsonObject();
        } catch (JsonParseException exception) {
            throw new IllegalArgumentException("Configuration is not valid JSON", exception);
        }

        ControllerConfig config = defaults();
        try {
            if (json.has("libvirtUri")) config = config.withLibvirtUri(json.get("libvirtUri").getAsString());
            if (json.has("monitorSocketDirectory")) {
                config = config.withMonitorSocketDirectory(Path.of(json.get("monitorSocketDirectory").getAsString()));
            }
            if (json.has("keyboardLayout")) {
                String layoutName = json.get("keyboardLayout").getAsString();
                config = config.withKeyboardLayout(KeyboardLayout.fromString(layoutName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown keyboard layout " + layoutName)));
            }
            if (json.has("keyDebounceMillis")) config = config.withKeyDebounce(Duration.ofMillis(json.get("keyDebounceMillis").getAsLong()));
            if (json.has("holdTimeMillis")) {
                JsonElement holdTime = json.get("holdTimeMillis");
                config = config.withHoldTimeMillis(holdTime.isJsonNull() ? null : holdTime.getAsInt());
            }
            if (json.has("commandTimeoutMillis")) config = config.withCommandTimeout(Duration.ofMillis(json.get("commandTimeoutMillis").getAsLong()));
            if (json.has("guestAgentTimeoutSeconds")) config = config.withGuestAgentTimeout(Duration.ofSeconds(json.get("guestAgentTimeoutSeconds").getAsLong()));
            if (json.has("execPollIntervalMillis")) config = config.withExecPollInterval(Duration.ofMillis(json.get("execPollIntervalMillis").getAsLong()));
            if (json.has("commandQueueCapacity")) config = config.withCommandQueueCapacity(json.get("commandQueueCapacity").getAsInt());
            if (json.has("batchTestTimeoutSeconds")) config = config.withBatchTestTimeout(Duration.ofSeconds(json.get("batchTestTimeoutSeconds").getAsLong()));
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException exception) {
            // Gson reports values of the wrong JSON type this way
            throw new IllegalArgumentException("Invalid configuration value: " + exception.getMessage(), exception);
        }
        return config;
    }

    // Copies with one setting changed
    public ControllerConfig withLibvirtUri(String libvirtUri) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withMonitorSocketDirectory(Path monitorSocketDirectory) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withKeyboardLayout(KeyboardLayout keyboardLayout) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withKeyDebounce(Duration keyDebounce) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withHoldTimeMillis(Integer holdTimeMillis) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withCommandTimeout(Duration commandTimeout) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withGuestAgentTimeout(Duration guestAgentTimeout) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withExecPollInterval(Duration execPollInterval) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withCommandQueueCapacity(int commandQueueCapacity) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    public ControllerConfig withBatchTestTimeout(Duration batchTestTimeout) {
        return new ControllerConfig(libvirtUri, monitorSocketDirectory, keyboardLayout, keyDebounce, holdTimeMillis,
            commandTimeout, guestAgentTimeout, execPollInterval, commandQueueCapacity, batchTestTimeout);
    }

    private static void requireNotNegative(String name, Duration value) {
        if (value == null || value.isNegative()) throw new IllegalArgumentException(name + " must not be negative, got " + value);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
}
