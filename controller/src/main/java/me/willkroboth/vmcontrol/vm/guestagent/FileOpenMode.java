package me.willkroboth.vmcontrol.vm.guestagent;

import com.google.gson.JsonObject;

// Modes are passed straight to fopen in the guest, always binary so content is not translated
public enum FileOpenMode implements CommandProperty {
    READ("rb"),
    WRITE("wb"),
    APPEND("ab");

    private final String fopenMode;

    FileOpenMode(String fopenMode) {
        this.fopenMode = fopenMode;
    }

    public String fopenMode() {
        return fopenMode;
    }

    @Override
    public void addToArguments(JsonObject arguments, String property) {
        arguments.addProperty(property, fopenMode);
    }
}
