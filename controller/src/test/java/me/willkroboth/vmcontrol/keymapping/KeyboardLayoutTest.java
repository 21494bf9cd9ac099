package me.willkroboth.vmcontrol.keymapping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyboardLayoutTest {

    @Test
    void fromString_TagsAndAliases_Resolve() {
        assertThat(KeyboardLayout.fromString("en-US")).contains(KeyboardLayout.EN_US);
        assertThat(KeyboardLayout.fromString("us")).contains(KeyboardLayout.EN_US);
        assertThat(KeyboardLayout.fromString("EN-GB")).contains(KeyboardLayout.EN_GB);
        assertThat(KeyboardLayout.fromString("uk")).contains(KeyboardLayout.EN_GB);
        assertThat(KeyboardLayout.fromString("zh-cn")).contains(KeyboardLayout.ZH_CN);
    }

    @Test
    void fromString_UnknownLayout_ReturnsEmpty() {
        assertThat(KeyboardLayout.fromString("de-DE")).isEmpty();
    }

    @Test
    void forLayout_GbTable_HasExtraSymbols() {
        KeyMapping us = KeyMapping.forLayout(KeyboardLayout.EN_US);
        KeyMapping gb = KeyMapping.forLayout(KeyboardLayout.EN_GB);

        assertThat(gb.size()).isEqualTo(us.size() + 2);
        assertThat(gb.lookup('¬')).isPresent();
        assertThat(us.lookup('¬')).isEmpty();
    }
}
