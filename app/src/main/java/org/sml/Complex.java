package org.sml;

// A complex constant, as written in literals like 1+2i or 3i
public record Complex(double real, double imag) {

    // Parse "<real>+<imag>i" or "<real>-<imag>i"
    static Complex parse(String text) {
        if (!text.endsWith("i")) {
            throw new NumberFormatException("not a complex number: " + Token.quote(text));
        }
        var split = splitIndex(text);
        if (split < 0) {
            throw new NumberFormatException("not a complex number: " + Token.quote(text));
        }
        var real = Double.parseDouble(text.substring(0, split));
        var imag = Double.parseDouble(text.substring(split, text.length() - 1));
        return new Complex(real, imag);
    }

    // The sign that starts the imaginary half; exponent signs don't count
    private static int splitIndex(String text) {
        for (int i = text.length() - 2; i > 0; i--) {
            var c = text.charAt(i);
            var prev = text.charAt(i - 1);
            if ((c == '+' || c == '-') && prev != 'e' && prev != 'E') {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        var sign = imag < 0 || (imag == 0 && 1 / imag < 0) ? "" : "+";
        return "(" + real + sign + imag + "i)";
    }
}
