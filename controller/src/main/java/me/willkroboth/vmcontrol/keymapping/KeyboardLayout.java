package me.willkroboth.vmcontrol.keymapping;

import java.util.Locale;
import java.util.Optional;

public enum KeyboardLayout {
    EN_US("en-US"),
    EN_GB("en-GB"),
    // Chinese keyboards use the US physical layout
    ZH_CN("zh-CN");

    private final String tag;

    KeyboardLayout(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<KeyboardLayout> fromString(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "en-us":
            case "us":
                return Optional.of(EN_US);
            case "en-gb":
            case "uk":
                return Optional.of(EN_GB);
            case "zh-cn":
            case "cn":
                return Optional.of(ZH_CN);
            default:
                return Optional.empty();
        }
    }
}
