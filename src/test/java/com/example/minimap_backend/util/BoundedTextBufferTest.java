package com.example.minimap_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedTextBufferTest {

    @Test
    void keepsShortOutputVerbatim() {
        BoundedTextBuffer buf = new BoundedTextBuffer(100);
        buf.appendLine("first");
        buf.appendLine("second");

        assertThat(buf.toString()).isEqualTo("first\nsecond");
        assertThat(buf.isTruncated()).isFalse();
    }

    @Test
    void keepsTheTailWhenOverLimit() {
        BoundedTextBuffer buf = new BoundedTextBuffer(20);
        for (int i = 0; i < 50; i++) {
            buf.appendLine("line-" + i);
        }

        assertThat(buf.isTruncated()).isTrue();
        assertThat(buf.toString()).startsWith(BoundedTextBuffer.TRUNCATION_MARKER).endsWith("line-49");
        assertThat(buf.toString().length()).isLessThanOrEqualTo(20 + BoundedTextBuffer.TRUNCATION_MARKER.length());
    }

    @Test
    void blankUntilSomethingVisibleIsWritten() {
        BoundedTextBuffer buf = new BoundedTextBuffer(10);
        assertThat(buf.isBlank()).isTrue();
        buf.appendLine("  ");
        assertThat(buf.isBlank()).isTrue();
        buf.appendLine("x");
        assertThat(buf.isBlank()).isFalse();
    }
}
