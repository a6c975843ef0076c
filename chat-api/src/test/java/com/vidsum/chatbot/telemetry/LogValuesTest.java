package com.vidsum.chatbot.telemetry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogValuesTest {

    @Test
    void flattensLineBreaksSoUserTextCannotForgeLogLines() {
        assertThat(LogValues.abbreviate("first\r\nINFO fake entry", 100)).isEqualTo("first INFO fake entry");
    }

    @Test
    void truncatesWithEllipsis() {
        assertThat(LogValues.abbreviate("abcdefghij", 8)).isEqualTo("abcde...");
        assertThat(LogValues.abbreviate(null, 8)).isEmpty();
    }
}
