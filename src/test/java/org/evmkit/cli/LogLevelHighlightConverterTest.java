package org.evmkit.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private String render(Level level) {
        ILoggingEvent event = mock(ILoggingEvent.class);
        when(event.getLevel()).thenReturn(level);
        return converter.transform(event, "LEVEL");
    }

    @Test
    void testColorsByLevel() {
        assertThat(render(Level.ERROR)).isEqualTo(LogLevelHighlightConverter.ANSI_RED + "LEVEL" + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(render(Level.WARN)).startsWith(LogLevelHighlightConverter.ANSI_YELLOW);
        assertThat(render(Level.INFO)).startsWith(LogLevelHighlightConverter.ANSI_BLUE);
        assertThat(render(Level.DEBUG)).isEqualTo("LEVEL");
    }
}
