package org.sml;

import java.util.Optional;

/**
 * A numeric constant. The value is stored under every representation that
 * holds it exactly: signed integer, unsigned integer (a long read as
 * unsigned), float and complex. The original text is kept for rendering.
 */
public record NumberNode(
    int pos,
    String text,
    Optional<Long> intValue,
    Optional<Long> uintValue,
    Optional<Double> floatValue,
    Optional<Complex> complexValue
) implements Node {

    private static final double TWO_TO_63 = 0x1p63;
    private static final double TWO_TO_64 = 0x1p64;

    /**
     * Classify a NUMBER or COMPLEX literal.
     *
     * @throws NumberFormatException if no representation holds the literal
     */
    static NumberNode parse(int pos, String text, TokenType type) {
        if (type == TokenType.COMPLEX) {
            return fromComplex(pos, text, Complex.parse(text));
        }

        // Imaginary constants can only be complex unless they are zero
        if (text.endsWith("i")) {
            var imag = parseFloat(text.substring(0, text.length() - 1));
            if (imag.isPresent()) {
                return fromComplex(pos, text, new Complex(0, imag.get()));
            }
        }

        // Integers first so that 0x1A and friends work
        var uintValue = parseUnsigned(text);
        var intValue = parseSigned(text);
        if (intValue.isPresent() && intValue.get() == 0) {
            // -0 is a fine unsigned zero
            uintValue = Optional.of(0L);
        }

        Optional<Double> floatValue;
        if (intValue.isPresent()) {
            floatValue = Optional.of((double) intValue.get());
        } else if (uintValue.isPresent()) {
            floatValue = Optional.of(unsignedToDouble(uintValue.get()));
        } else {
            floatValue = parseFloat(text);
            if (floatValue.isPresent()) {
                intValue = exactSigned(floatValue.get());
                uintValue = exactUnsigned(floatValue.get());
            }
        }

        if (intValue.isEmpty() && uintValue.isEmpty() && floatValue.isEmpty()) {
            throw new NumberFormatException("illegal number syntax: " + Token.quote(text));
        }
        return new NumberNode(pos, text, intValue, uintValue, floatValue, Optional.empty());
    }

    // Pulls out the other representations, they all need a zero imaginary part
    private static NumberNode fromComplex(int pos, String text, Complex value) {
        if (value.imag() != 0) {
            return new NumberNode(pos, text, Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(value));
        }
        var real = value.real();
        return new NumberNode(pos, text, exactSigned(real), exactUnsigned(real), Optional.of(real), Optional.of(value));
    }

    /*
     * Literal readers, each empty when the text doesn't fit
     */

    private static Optional<Long> parseSigned(String text) {
        var negative = text.startsWith("-");
        var body = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
        var radix = radixOf(body);
        var digits = stripPrefix(body, radix);
        if (digits.isEmpty() || !Character.isLetterOrDigit(digits.charAt(0))) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(negative ? "-" + digits : digits, radix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> parseUnsigned(String text) {
        if (text.startsWith("-") || text.startsWith("+")) {
            return Optional.empty();
        }
        var radix = radixOf(text);
        var digits = stripPrefix(text, radix);
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseUnsignedLong(digits, radix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> parseFloat(String text) {
        if (text.isEmpty() || text.indexOf('x') >= 0 || text.indexOf('X') >= 0) {
            return Optional.empty();
        }
        try {
            var value = Double.parseDouble(text);
            // out of range is an error, not an infinity
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // 0x is hex, a leading 0 is octal
    private static int radixOf(String body) {
        if (body.startsWith("0x") || body.startsWith("0X")) {
            return 16;
        }
        if (body.length() > 1 && body.startsWith("0")) {
            return 8;
        }
        return 10;
    }

    private static String stripPrefix(String body, int radix) {
        return switch (radix) {
            case 16 -> body.substring(2);
            case 8 -> body.substring(1);
            default -> body;
        };
    }

    private static Optional<Long> exactSigned(double value) {
        if (value == Math.rint(value) && value >= -TWO_TO_63 && value < TWO_TO_63) {
            return Optional.of((long) value);
        }
        return Optional.empty();
    }

    private static Optional<Long> exactUnsigned(double value) {
        if (value != Math.rint(value) || value < 0 || value >= TWO_TO_64) {
            return Optional.empty();
        }
        if (value < TWO_TO_63) {
            return Optional.of((long) value);
        }
        return Optional.of((long) (value - TWO_TO_63) + Long.MIN_VALUE);
    }

    private static double unsignedToDouble(long value) {
        if (value >= 0) {
            return (double) value;
        }
        // keep the low bit so rounding stays right
        return (double) ((value >>> 1) | (value & 1)) * 2.0;
    }

    @Override
    public NodeType type() {
        return NodeType.NUMBER;
    }

    // Everything in here is immutable, a fresh record is a full copy
    @Override
    public NumberNode copy() {
        return new NumberNode(pos, text, intValue, uintValue, floatValue, complexValue);
    }

    @Override
    public NumberNode reduce(CancellationToken cancellation) {
        cancellation.throwIfCancelled("reduce");
        return copy();
    }

    @Override
    public String toString() {
        return text;
    }
}
