/**
 * Expectation Table Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>text layer</strong> for expectation
 * tables. It converts between table text and a syntax-level
 * {@link com.questrail.expectations.codec.ManifestBlock} tree, and nothing
 * more.</p>
 *
 * <h2>Placement</h2>
 *
 * <pre>
 *   table text
 *        → ManifestDecoder          (indentation, headings, values, conditions)
 *            → ManifestBlock        (syntax only, no identities or evidence)
 *                → ExpectationTreeBuilder
 *                    → FileNode / TestNode / SubtestNode
 * </pre>
 *
 * <p>The reverse direction goes through
 * {@link com.questrail.expectations.codec.ManifestEncoder}.</p>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Blocks carry no knowledge of tests, subtests or test identity.</li>
 *   <li>Conditions are parsed into {@link com.questrail.expectations.expr.Expression}
 *       trees but never evaluated here.</li>
 *   <li>Malformed text fails with {@link com.questrail.expectations.codec.ManifestParseException};
 *       there is no partial recovery.</li>
 * </ul>
 */
package com.questrail.expectations.codec;
