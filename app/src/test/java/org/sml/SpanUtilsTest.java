package org.sml;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class SpanUtilsTest {
    @Test
    void testLineIndex() {
        assertEquals(List.of(0), SpanUtils.lineIndex(""));
        assertEquals(List.of(0, 4, 5), SpanUtils.lineIndex("abc\n\nd"));
    }

    @Test
    void testLocate() {
        var text = "abc\n\nde";

        assertEquals(new SpanUtils.Location(1, 1), SpanUtils.locate(0, text));
        assertEquals(new SpanUtils.Location(1, 4), SpanUtils.locate(3, text));
        assertEquals(new SpanUtils.Location(2, 1), SpanUtils.locate(4, text));
        assertEquals(new SpanUtils.Location(3, 1), SpanUtils.locate(5, text));
        // end of input
        assertEquals(new SpanUtils.Location(3, 3), SpanUtils.locate(7, text));
    }

    @Test
    void testFormat() {
        var lineIndex = SpanUtils.lineIndex("rect 1\n  || rect 2");

        assertEquals("2:3", SpanUtils.locate(9, lineIndex).toString());
        assertEquals("1,1..2,11", SpanUtils.formatSpan(0, 17, lineIndex));
    }
}
