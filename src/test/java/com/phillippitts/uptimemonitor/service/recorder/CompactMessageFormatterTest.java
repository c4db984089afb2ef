package com.phillippitts.uptimemonitor.service.recorder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompactMessageFormatterTest {

    @Test
    void appendsPing() {
        assertThat(CompactMessageFormatter.format("200 - OK", 123L, 255)).isEqualTo("200 - OK (123ms)");
    }

    @Test
    void omitsPingWhenUnknown() {
        assertThat(CompactMessageFormatter.format("Connection refused", null, 255)).isEqualTo("Connection refused");
    }

    @Test
    void collapsesMultiLineMessages() {
        assertThat(CompactMessageFormatter.format("first\r\nsecond", null, 255)).doesNotContain("\n", "\r");
    }

    @Test
    void truncatesMessageButKeepsPingSuffix() {
        String result = CompactMessageFormatter.format("x".repeat(500), 42L, 50);

        assertThat(result).hasSizeLessThanOrEqualTo(50).endsWith(" (42ms)");
    }

    @Test
    void handlesMissingMessage() {
        assertThat(CompactMessageFormatter.format(null, 7L, 255)).isEqualTo("(7ms)");
        assertThat(CompactMessageFormatter.format(null, null, 255)).isEmpty();
    }
}
