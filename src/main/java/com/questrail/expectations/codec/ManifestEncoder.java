package com.questrail.expectations.codec;

/**
 * Text-level encoder for expectation tables; the inverse of
 * {@link ManifestDecoder}.
 */
public interface ManifestEncoder
{
    /**
     * Encodes a root block and everything below it.
     *
     * @param root block whose {@link ManifestBlock#name()} is {@code null}
     * @return table text, ending with a newline unless empty
     */
    String encode(ManifestBlock root);
}
