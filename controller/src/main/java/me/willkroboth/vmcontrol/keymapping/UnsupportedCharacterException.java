package me.willkroboth.vmcontrol.keymapping;

public class UnsupportedCharacterException extends Exception {
    private final int codePoint;

    public UnsupportedCharacterException(int codePoint, KeyboardLayout layout) {
        super(String.format("Character '%s' (U+%04X) cannot be typed on the %s layout",
            new String(Character.toChars(codePoint)), codePoint, layout.getTag()));
        this.codePoint = codePoint;
    }

    public int getCodePoint() {
        return codePoint;
    }
}
