package org.sml;

import java.text.MessageFormat;

/**
 * A failure to turn source text into a tree, with the place it happened.
 * The message reads {@code name:line:column: reason}.
 */
public class SmlException extends RuntimeException {
    private final String name;
    private final int pos;
    private final SpanUtils.Location location;
    private final String reason;

    SmlException(String name, int pos, SpanUtils.Location location, String reason, Throwable cause) {
        super(MessageFormat.format("{0}:{1}: {2}", name, location, reason), cause);
        this.name = name;
        this.pos = pos;
        this.location = location;
        this.reason = reason;
    }

    SmlException(String name, int pos, SpanUtils.Location location, String reason) {
        this(name, pos, location, reason, null);
    }

    // Document the error belongs to
    public String name() {
        return name;
    }

    public int pos() {
        return pos;
    }

    public SpanUtils.Location location() {
        return location;
    }

    // The message without the location prefix
    public String reason() {
        return reason;
    }
}
