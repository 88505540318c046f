package com.example.docassembly.dto.document;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Variant tag of a {@link Block}.
 */
public enum BlockType {
    TEXT("TextBlock", true),
    TITLE("TitleBlock", true),
    SUBTITLE("SubTitleBlock", true),
    HEADER("HeaderBlock", true),
    FOOTER("FooterBlock", true),
    CAPTION("CaptionBlock", true),
    LIST_ELEMENT("ListElementBlock", true),
    TABLE("TableBlock", false),
    IMAGE("ImageBlock", false),
    UNDEFINED("UndefinedBlock", true);

    private final String tag;
    private final boolean textBearing;

    BlockType(String tag, boolean textBearing) {
        this.tag = tag;
        this.textBearing = textBearing;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Whether blocks of this type are built from merged text lines. The others
     * are only ever created straight from a layout region.
     */
    public boolean isTextBearing() {
        return textBearing;
    }
}
