package com.questrail.expectations.codec.impl;

import com.questrail.expectations.codec.ManifestParseException;

/**
 * Quoting and escaping rules shared by the decoder, encoder and condition
 * parser.
 */
final class ManifestText
{
    private ManifestText() {}

    /**
     * Reads a double-quoted string starting at {@code start}, appending the
     * unescaped content to {@code out}.
     *
     * @return the index just past the closing quote
     */
    static int readQuoted(String text, int start, StringBuilder out, int line) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 >= text.length()) {
                    break;
                }
                out.append(unescape(text.charAt(i + 1)));
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        throw new ManifestParseException("Unterminated string", line);
    }

    static void appendQuoted(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        out.append('"');
    }

    /**
     * A value is written bare unless reading it back bare would change it.
     */
    static boolean needsQuoting(String value) {
        return value.isEmpty()
                || !value.equals(value.strip())
                || value.startsWith("\"")
                || value.startsWith("[")
                || value.startsWith("#")
                || value.startsWith("if ")
                || value.indexOf('\n') >= 0
                || value.indexOf('\t') >= 0;
    }

    static String escapeHeading(String name) {
        StringBuilder out = new StringBuilder(name.length() + 2);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            default -> c;
        };
    }
}
