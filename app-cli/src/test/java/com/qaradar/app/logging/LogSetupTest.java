package com.qaradar.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void level_names_accept_jul_and_slf4j_spellings() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("DEBUG")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("warn")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("ERROR")).isEqualTo(Level.SEVERE);
        assertThat(LogSetup.levelOf("bogus")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void line_formatter_is_single_line_with_stack_when_thrown() {
        LogSetup.LineFormatter f = new LogSetup.LineFormatter();
        LogRecord r = new LogRecord(Level.INFO, "hello {0}");
        r.setParameters(new Object[]{"world"});
        r.setLoggerName("com.qaradar.Test");

        String line = f.format(r);
        assertThat(line).contains("[INFO]").contains("com.qaradar.Test - hello world");
        assertThat(line.trim()).doesNotContain("\n");

        r.setThrown(new IllegalStateException("boom"));
        assertThat(f.format(r)).contains("java.lang.IllegalStateException: boom");
    }
}
