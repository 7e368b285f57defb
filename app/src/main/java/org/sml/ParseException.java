package org.sml;

/**
 * The tokens do not form a valid expression.
 */
public class ParseException extends SmlException {
    ParseException(String name, int pos, SpanUtils.Location location, String reason) {
        super(name, pos, location, reason);
    }

    ParseException(String name, int pos, SpanUtils.Location location, String reason, Throwable cause) {
        super(name, pos, location, reason, cause);
    }
}
