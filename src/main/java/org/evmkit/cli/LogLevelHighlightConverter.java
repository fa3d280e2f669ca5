package org.evmkit.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level column of console output.
 *
 * <p>ERROR is red, WARN yellow, INFO blue. DEBUG and TRACE keep the terminal default.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        switch (event.getLevel().toInt()) {
            case Level.ERROR_INT:
                return ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT:
                return ANSI_YELLOW + in + ANSI_RESET;
            case Level.INFO_INT:
                return ANSI_BLUE + in + ANSI_RESET;
            default:
                return in;
        }
    }
}
