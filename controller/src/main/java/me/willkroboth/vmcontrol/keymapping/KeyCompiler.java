package me.willkroboth.vmcontrol.keymapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns text into the key operations that type it. Compilation only reads the {@link KeyMapping}, so one compiler
 * can be shared between any number of actors.
 */
public class KeyCompiler {
    private static final Map<String, String> NAMED_KEYS = Map.ofEntries(
        Map.entry("enter", "ret"),
        Map.entry("return", "ret"),
        Map.entry("space", "spc"),
        Map.entry("tab", "tab"),
        Map.entry("backspace", "backspace"),
        Map.entry("delete", "delete"),
        Map.entry("escape", "esc"),
        Map.entry("esc", "esc"),
        Map.entry("shift", "shift"),
        Map.entry("ctrl", "ctrl"),
        Map.entry("control", "ctrl"),
        Map.entry("alt", "alt"),
        Map.entry("meta", "meta_l"),
        Map.entry("super", "meta_l"),
        Map.entry("win", "meta_l"),
        Map.entry("up", "up"),
        Map.entry("down", "down"),
        Map.entry("left", "left"),
        Map.entry("right", "right"),
        Map.entry("home", "home"),
        Map.entry("end", "end"),
        Map.entry("pageup", "pgup"),
        Map.entry("pagedown", "pgdn"),
        Map.entry("insert", "insert"),
        Map.entry("f1", "f1"),
        Map.entry("f2", "f2"),
        Map.entry("f3", "f3"),
        Map.entry("f4", "f4"),
        Map.entry("f5", "f5"),
        Map.entry("f6", "f6"),
        Map.entry("f7", "f7"),
        Map.entry("f8", "f8"),
        Map.entry("f9", "f9"),
        Map.entry("f10", "f10"),
        Map.entry("f11", "f11"),
        Map.entry("f12", "f12")
    );

    private final KeyMapping mapping;

    public KeyCompiler(KeyboardLayout layout) {
        this(KeyMapping.forLayout(layout));
    }

    public KeyCompiler(KeyMapping mapping) {
        this.mapping = mapping;
    }

    public KeyboardLayout layout() {
        return mapping.layout();
    }

    /**
     * @return The operations for every character of {@code text}, in order
     * @throws UnsupportedCharacterException For the first character the layout cannot type. Nothing is returned
     *                                       for the characters before it.
     */
    public List<KeyOp> compile(String text) throws UnsupportedCharacterException {
        List<KeyOp> operations = new ArrayList<>();

        int index = 0;
        while (index < text.length()) {
            int codePoint = text.codePointAt(index);
            operations.addAll(compileChar(codePoint));
            index += Character.charCount(codePoint);
        }

        return Collections.unmodifiableList(operations);
    }

    public List<KeyOp> compileChar(int codePoint) throws UnsupportedCharacterException {
        return mapping.lookup(codePoint)
            .orElseThrow(() -> new UnsupportedCharacterException(codePoint, mapping.layout()));
    }

    /**
     * Resolves a human key name such as {@code Enter} or {@code PageUp} to its key code.
     *
     * @return The key code, or empty if the name is not known
     */
    public static Optional<String> mapNamedKey(String name) {
        return Optional.ofNullable(NAMED_KEYS.get(name.toLowerCase(Locale.ROOT)));
    }
}
