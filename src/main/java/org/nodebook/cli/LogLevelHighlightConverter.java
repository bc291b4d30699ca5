package org.nodebook.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the log level of console output. Compile diagnostics surface as WARN and
 * store failures as ERROR, so those two stand out; DEBUG stage summaries are dimmed.
 * Setting the {@code NO_COLOR} environment variable turns coloring off.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = enabled ? colorOf(event.getLevel()) : null;
        return color == null ? in : color + in + RESET;
    }

    /**
     * @return The ANSI escape for a level, or null to leave it uncolored.
     */
    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> "\u001B[1;31m";
            case Level.WARN_INT -> "\u001B[33m";
            case Level.INFO_INT -> "\u001B[36m";
            case Level.DEBUG_INT -> "\u001B[90m";
            default -> null;
        };
    }
}
