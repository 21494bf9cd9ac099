package me.willkroboth.vmcontrol.vm.guestagent;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

// The guest agent moves every byte payload as base64 text
final class Base64Payload {
    private Base64Payload() {
    }

    static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    static String encodeText(String text) {
        if (text == null) return null;
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] decode(String encoded) {
        return Base64.getDecoder().decode(encoded);
    }

    static String decodeText(String encoded) {
        if (encoded == null) return null;
        return new String(decode(encoded), StandardCharsets.UTF_8);
    }
}
