package org.sml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SpanUtils {
    // 1-based line and column
    public record Location(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    // Offsets at which every line starts, the first one is always 0
    public static List<Integer> lineIndex(String text) {
        var lineIndex = new ArrayList<Integer>();
        lineIndex.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineIndex.add(i + 1);
            }
        }
        return lineIndex;
    }

    public static Location locate(int offset, List<Integer> lineIndex) {
        var lineFind = Collections.binarySearch(lineIndex, offset);

        int lineIdx;
        if (lineFind >= 0) {
            lineIdx = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1) so we reverse that
            lineIdx = -(lineFind + 1) - 1;
        }

        return new Location(lineIdx + 1, offset - lineIndex.get(lineIdx) + 1);
    }

    public static Location locate(int offset, String text) {
        return locate(offset, lineIndex(text));
    }

    // Takes a span of two offsets
    public static String formatSpan(int from, int to, List<Integer> lineIndex) {
        var first = locate(from, lineIndex);
        var second = locate(to, lineIndex);
        return String.format("%d,%d..%d,%d",
            first.line(), first.column(),
            second.line(), second.column()
        );
    }
}
