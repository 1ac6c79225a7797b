package com.questrail.expectations.codec;

/**
 * Indicates that table text could not be decoded.
 *
 * <p>This typically reflects:</p>
 * <ul>
 *   <li>Inconsistent or tab indentation</li>
 *   <li>An unterminated heading or string</li>
 *   <li>A malformed condition</li>
 *   <li>Blocks nested deeper than test and subtest</li>
 * </ul>
 *
 * A line number of {@code 0} means the failure is not tied to one line.
 */
public final class ManifestParseException extends RuntimeException
{
    private final int line;

    public ManifestParseException(String message, int line) {
        super(line > 0 ? "line " + line + ": " + message : message);
        this.line = line;
    }

    public ManifestParseException(String message, int line, Throwable cause) {
        super(line > 0 ? "line " + line + ": " + message : message, cause);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
