package ru.xodavit.deadsimple.framework.guava;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BytesTest
{
    private static final byte[] CRLF = {'\r', '\n'};

    @Test
    void finds_first_occurrence() {
        assertThat(Bytes.indexOf("a\r\nb\r\n".getBytes(), CRLF)).isEqualTo(1);
    }

    @Test
    void respects_bounds() {
        final var data = "a\r\nb\r\n".getBytes();
        assertThat(Bytes.indexOf(data, CRLF, 2, data.length)).isEqualTo(4);
        assertThat(Bytes.indexOf(data, CRLF, 0, 2)).isEqualTo(-1);
    }

    @Test
    void missing_target() {
        assertThat(Bytes.indexOf("abc".getBytes(), CRLF)).isEqualTo(-1);
        assertThat(Bytes.indexOf(new byte[0], CRLF)).isEqualTo(-1);
    }
}
