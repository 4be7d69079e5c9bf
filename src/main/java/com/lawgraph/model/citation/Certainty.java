package com.lawgraph.model.citation;

/**
 * Qualifies a resolution so the scorer can place it within its method's band.
 */
public enum Certainty {
    /** Target follows directly from the text and current position. */
    EXACT,
    /** Target recalled from recent-law memory or a local alias. */
    RECALLED,
    /** Target kept symbolic, e.g. all preceding paragraphs. */
    SYMBOLIC,
    /** Best-effort fallback into a neighbouring article. */
    DEGRADED,
    /** Nothing concrete is named, such as "other laws and regulations". */
    UNSPECIFIABLE,
    /** A law name that the dictionary does not know. */
    IDENTITY_MISS,
    /** A numeral that could not be parsed. */
    NUMERAL_FALLBACK
}
