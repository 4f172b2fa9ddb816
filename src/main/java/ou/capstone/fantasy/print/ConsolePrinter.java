package ou.capstone.fantasy.print;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Base for the plain-text console tables.
 *
 * Provides both {@link #print(Object)} for CLI stdout and {@link #render(Object)}
 * for tests/logging.
 */
public abstract class ConsolePrinter<T> {

    protected static final int RULE_WIDTH = 80;

    /**
     * Print directly to stdout for CLI usage.
     * Delegates to {@link #render(Object)}.
     */
    public void print(final T value) {
        System.out.println(render(value));
    }

    /**
     * Renders the table as a single String, header included.
     */
    public abstract String render(T value);

    // Helper methods

    protected static String rule(final char c) {
        return String.valueOf(c).repeat(RULE_WIDTH);
    }

    protected static String pad(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        return StringUtils.rightPad(v, width);
    }

    protected static String padLeft(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        return StringUtils.leftPad(v, width);
    }

    protected static String clamp(final String text, final int maxLength) {
        if (text == null) {
            return "-";
        }
        final String normalized = StringUtils.normalizeSpace(text);
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return StringUtils.abbreviate(normalized, maxLength);
    }

    protected static String points(final double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
