package com.example.docassembly.service.assembly;

/**
 * What to do with a text line whose best region is a picture or a table.
 */
public enum NonTextLinePolicy {
    /** Fail the page with a {@link com.example.docassembly.exception.NonTextLineException}. */
    REJECT,
    /** Discard the line; the region is still emitted by injection. */
    DROP
}
