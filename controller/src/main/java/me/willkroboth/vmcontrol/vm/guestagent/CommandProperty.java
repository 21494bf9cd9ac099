package me.willkroboth.vmcontrol.vm.guestagent;

import com.google.gson.JsonObject;

// A value that knows how to write itself into a command's arguments
@FunctionalInterface
public interface CommandProperty {
    void addToArguments(JsonObject arguments, String property);
}
