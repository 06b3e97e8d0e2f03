package org.dxworks.hybridnote.detector;

import java.util.ArrayList;
import java.util.List;

/**
 * Line helpers that keep line terminators, so joining the pieces gives back the input exactly.
 */
public final class Lines {

    private Lines() {}

    /**
     * Splits text into lines, each keeping its {@code \n} or {@code \r\n}. A final line without a
     * terminator is kept as is; a trailing terminator does not start an extra empty line.
     */
    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int offset = 0;
        while (offset < text.length()) {
            int nextNewline = text.indexOf('\n', offset);
            if (nextNewline == -1) {
                lines.add(text.substring(offset));
                break;
            }
            lines.add(text.substring(offset, nextNewline + 1));
            offset = nextNewline + 1;
        }
        return lines;
    }

    public static int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return endsWithTerminator(text) ? count : count + 1;
    }

    public static boolean endsWithTerminator(String text) {
        return text != null && text.endsWith("\n");
    }

    /**
     * The line without its trailing {@code \n} / {@code \r\n}.
     */
    public static String content(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    /**
     * The trailing terminator of a line, or an empty string.
     */
    public static String terminator(String line) {
        return line.substring(content(line).length());
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    public static int countOccurrences(String text, String token) {
        int count = 0;
        int from = 0;
        while (true) {
            int at = text.indexOf(token, from);
            if (at == -1) return count;
            count++;
            from = at + token.length();
        }
    }
}
