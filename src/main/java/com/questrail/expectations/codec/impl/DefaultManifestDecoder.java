package com.questrail.expectations.codec.impl;

import com.questrail.expectations.codec.ManifestBlock;
import com.questrail.expectations.codec.ManifestDecoder;
import com.questrail.expectations.codec.ManifestEntry;
import com.questrail.expectations.codec.ManifestParseException;
import com.questrail.expectations.codec.ManifestValue;
import com.questrail.expectations.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultManifestDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ManifestDecoder}.
 *
 * <p>Decoding proceeds in two steps:</p>
 * <ol>
 *   <li>Line scanning: blank and comment lines are dropped, indentation is
 *       measured, tabs are rejected.</li>
 *   <li>Block parsing: each block owns the lines at exactly its indentation
 *       until a line with less indentation closes it.</li>
 * </ol>
 *
 * <p>Within a block a line is either a heading {@code [name]} that opens a
 * child block, a simple attribute {@code key: value}, or a list attribute
 * {@code key:} whose values follow on deeper-indented lines, each either
 * {@code if <condition>: value} or a bare default value.</p>
 *
 * <p>A decoder instance holds no state between calls.</p>
 */
public final class DefaultManifestDecoder implements ManifestDecoder
{
    private record Line(int number, int indent, String text) {}

    @Override
    public ManifestBlock decode(String text) {
        Objects.requireNonNull(text, "text");
        return new Parser(scan(text)).parseRoot();
    }

    private static List<Line> scan(String text) {
        List<Line> lines = new ArrayList<>();
        String[] raw = text.split("\r?\n", -1);
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i];
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            int indent = 0;
            while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
                if (line.charAt(indent) != ' ') {
                    throw new ManifestParseException("Indentation must use spaces", i + 1);
                }
                indent++;
            }
            lines.add(new Line(i + 1, indent, line.substring(indent).stripTrailing()));
        }
        return lines;
    }

    private static final class Parser
    {
        private final List<Line> lines;
        private int pos;

        Parser(List<Line> lines) {
            this.lines = lines;
        }

        ManifestBlock parseRoot() {
            ManifestBlock root = parseBlock(null, 0, 0);
            if (pos < lines.size()) {
                throw new ManifestParseException("Unexpected indentation", lines.get(pos).number());
            }
            return root;
        }

        private ManifestBlock parseBlock(String name, int indent, int headingLine) {
            List<ManifestEntry> entries = new ArrayList<>();
            List<ManifestBlock> children = new ArrayList<>();

            while (pos < lines.size()) {
                Line line = lines.get(pos);
                if (line.indent() < indent) {
                    break;
                }
                if (line.indent() > indent) {
                    throw new ManifestParseException("Unexpected indentation", line.number());
                }

                if (line.text().startsWith("[")) {
                    String childName = parseHeading(line);
                    pos++;
                    int childIndent = pos < lines.size() && lines.get(pos).indent() > indent
                            ? lines.get(pos).indent()
                            : indent + 1;
                    children.add(parseBlock(childName, childIndent, line.number()));
                } else {
                    entries.add(parseEntry(line));
                }
            }
            return new ManifestBlock(name, entries, children, headingLine);
        }

        private String parseHeading(Line line) {
            String text = line.text();
            StringBuilder name = new StringBuilder();
            int i = 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\' && i + 1 < text.length()) {
                    name.append(text.charAt(i + 1));
                    i += 2;
                } else if (c == ']') {
                    break;
                } else {
                    name.append(c);
                    i++;
                }
            }
            if (i >= text.length()) {
                throw new ManifestParseException("Unterminated heading", line.number());
            }
            if (i != text.length() - 1) {
                throw new ManifestParseException("Unexpected text after heading", line.number());
            }
            if (name.length() == 0) {
                throw new ManifestParseException("Empty heading", line.number());
            }
            return name.toString();
        }

        private ManifestEntry parseEntry(Line line) {
            String text = line.text();
            int colon = text.indexOf(':');
            if (colon <= 0) {
                throw new ManifestParseException("Expected 'key: value'", line.number());
            }
            String key = text.substring(0, colon).strip();
            if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) {
                throw new ManifestParseException("Malformed key '" + key + "'", line.number());
            }
            pos++;

            String rest = text.substring(colon + 1).strip();
            if (!rest.isEmpty()) {
                return new ManifestEntry(key, List.of(ManifestValue.unconditional(parseValue(rest, line.number()))));
            }

            List<ManifestValue> values = new ArrayList<>();
            int valueIndent = -1;
            while (pos < lines.size() && lines.get(pos).indent() > line.indent()) {
                Line valueLine = lines.get(pos);
                if (valueIndent < 0) {
                    valueIndent = valueLine.indent();
                } else if (valueLine.indent() != valueIndent) {
                    throw new ManifestParseException("Inconsistent indentation in values of '" + key + "'",
                            valueLine.number());
                }
                values.add(parseListValue(valueLine));
                pos++;
            }
            if (values.isEmpty()) {
                throw new ManifestParseException("Attribute '" + key + "' has no value", line.number());
            }
            return new ManifestEntry(key, values);
        }

        private ManifestValue parseListValue(Line line) {
            String text = line.text();
            if (!text.startsWith("if ")) {
                return ManifestValue.unconditional(parseValue(text, line.number()));
            }

            int colon = conditionEnd(text, line.number());
            Expression condition = ConditionParser.parse(text.substring(3, colon).strip(), line.number());
            String value = text.substring(colon + 1).strip();
            if (value.isEmpty()) {
                throw new ManifestParseException("Missing value after condition", line.number());
            }
            return new ManifestValue(condition, parseValue(value, line.number()));
        }

        /**
         * Finds the colon ending an {@code if} condition, skipping quoted text.
         */
        private int conditionEnd(String text, int lineNumber) {
            int i = 3;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '"') {
                    i = ManifestText.readQuoted(text, i, new StringBuilder(), lineNumber);
                } else if (c == ':') {
                    return i;
                } else {
                    i++;
                }
            }
            throw new ManifestParseException("Missing ':' after condition", lineNumber);
        }

        private String parseValue(String raw, int lineNumber) {
            if (!raw.startsWith("\"")) {
                return raw;
            }
            StringBuilder value = new StringBuilder();
            int end = ManifestText.readQuoted(raw, 0, value, lineNumber);
            if (end != raw.length()) {
                throw new ManifestParseException("Unexpected text after quoted value", lineNumber);
            }
            return value.toString();
        }
    }
}
