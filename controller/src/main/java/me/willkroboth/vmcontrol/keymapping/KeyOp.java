package me.willkroboth.vmcontrol.keymapping;

/**
 * Pressing or releasing one physical key.
 *
 * @param code    QEMU key code (qcode), such as {@code a}, {@code shift} or {@code ret}
 * @param pressed True to press, false to release
 */
public record KeyOp(String code, boolean pressed) {
    public static KeyOp press(String code) {
        return new KeyOp(code, true);
    }

    public static KeyOp release(String code) {
        return new KeyOp(code, false);
    }
}
