package com.questrail.expectations.codec;

/**
 * ManifestDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for expectation tables.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating indentation and block structure</li>
 *   <li>Decoding headings, keys, values and conditions</li>
 *   <li>Constructing a {@link ManifestBlock} tree on success</li>
 * </ul>
 *
 * <p>It does not decide what a block means (file, test or subtest).</p>
 */
public interface ManifestDecoder
{
    /**
     * Decodes a complete table.
     *
     * @param text full text of one table
     * @return the root block
     * @throws ManifestParseException if the text is malformed
     */
    ManifestBlock decode(String text);
}
