package me.willkroboth.vmcontrol.keymapping;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table from characters to the key operations that type them on one layout.
 * <p>
 * Every sequence releases each modifier it presses, so sequences can be concatenated freely.
 */
public final class KeyMapping {
    static final String SHIFT = "shift";

    private final KeyboardLayout layout;
    private final Map<Integer, List<KeyOp>> table;

    private KeyMapping(KeyboardLayout layout, Map<Integer, List<KeyOp>> table) {
        this.layout = layout;
        this.table = Map.copyOf(table);
    }

    public static KeyMapping forLayout(KeyboardLayout layout) {
        Map<Integer, List<KeyOp>> table = new HashMap<>();
        addUsLayout(table);
        if (layout == KeyboardLayout.EN_GB) addGbOverrides(table);

        return new KeyMapping(layout, table);
    }

    public KeyboardLayout layout() {
        return layout;
    }

    public Optional<List<KeyOp>> lookup(int codePoint) {
        return Optional.ofNullable(table.get(codePoint));
    }

    public int size() {
        return table.size();
    }

    // Layouts
    // Key names are QEMU qcodes: https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#enum-QMP-ui.QKeyCode
    private static void addUsLayout(Map<Integer, List<KeyOp>> table) {
        for (char c = 'a'; c <= 'z'; c++) {
            table.put((int) c, tap(String.valueOf(c)));
        }
        for (char c = 'A'; c <= 'Z'; c++) {
            table.put((int) c, shifted(String.valueOf(Character.toLowerCase(c))));
        }
        for (char c = '0'; c <= '9'; c++) {
            table.put((int) c, tap(String.valueOf(c)));
        }

        direct(table, ' ', "spc");
        direct(table, '\n', "ret");
        direct(table, '\t', "tab");
        direct(table, '.', "dot");
        direct(table, ',', "comma");
        direct(table, '/', "slash");
        direct(table, ';', "semicolon");
        direct(table, '\'', "apostrophe");
        direct(table, '[', "bracket_left");
        direct(table, ']', "bracket_right");
        direct(table, '\\', "backslash");
        direct(table, '-', "minus");
        direct(table, '=', "equal");
        direct(table, '`', "grave_accent");

        shift(table, '!', "1");
        shift(table, '@', "2");
        shift(table, '#', "3");
        shift(table, '$', "4");
        shift(table, '%', "5");
        shift(table, '^', "6");
        shift(table, '&', "7");
        shift(table, '*', "8");
        shift(table, '(', "9");
        shift(table, ')', "0");
        shift(table, '_', "minus");
        shift(table, '+', "equal");
        shift(table, '~', "grave_accent");
        shift(table, '{', "bracket_left");
        shift(table, '}', "bracket_right");
        shift(table, '|', "backslash");
        shift(table, ':', "semicolon");
        shift(table, '"', "apostrophe");
        shift(table, '<', "comma");
        shift(table, '>', "dot");
        shift(table, '?', "slash");
    }

    // The UK layout moves a handful of symbols and has an extra key (qcode `less`) next to left shift
    private static void addGbOverrides(Map<Integer, List<KeyOp>> table) {
        shift(table, '"', "2");
        shift(table, '@', "apostrophe");
        shift(table, '£', "3");
        direct(table, '#', "backslash");
        shift(table, '~', "backslash");
        direct(table, '\\', "less");
        shift(table, '|', "less");
        shift(table, '¬', "grave_accent");
    }

    // Helper methods
    private static List<KeyOp> tap(String code) {
        return List.of(KeyOp.press(code), KeyOp.release(code));
    }

    private static List<KeyOp> shifted(String code) {
        return List.of(KeyOp.press(SHIFT), KeyOp.press(code), KeyOp.release(code), KeyOp.release(SHIFT));
    }

    private static void direct(Map<Integer, List<KeyOp>> table, char character, String code) {
        table.put((int) character, tap(code));
    }

    private static void shift(Map<Integer, List<KeyOp>> table, char character, String code) {
        table.put((int) character, shifted(code));
    }
}
