package org.sml;

/**
 * The scanner could not split the source into tokens.
 */
public class ScanException extends SmlException {
    ScanException(String name, int pos, SpanUtils.Location location, String reason) {
        super(name, pos, location, reason);
    }
}
