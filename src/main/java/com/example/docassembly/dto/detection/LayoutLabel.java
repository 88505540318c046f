package com.example.docassembly.dto.detection;

import com.example.docassembly.dto.document.BlockType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Layout detector classes (DocLayNet ordering) and the block type each one
 * produces in the assembled document.
 */
public enum LayoutLabel {
    CAPTION(0, BlockType.CAPTION),
    FOOTNOTE(1, BlockType.TEXT),
    FORMULA(2, BlockType.TEXT),
    LIST_ITEM(3, BlockType.LIST_ELEMENT),
    PAGE_FOOTER(4, BlockType.FOOTER),
    PAGE_HEADER(5, BlockType.HEADER),
    PICTURE(6, BlockType.IMAGE),
    SECTION_HEADER(7, BlockType.SUBTITLE),
    TABLE(8, BlockType.TABLE),
    TEXT(9, BlockType.TEXT),
    TITLE(10, BlockType.TITLE);

    private final int code;
    private final BlockType blockType;

    LayoutLabel(int code, BlockType blockType) {
        this.code = code;
        this.blockType = blockType;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    public BlockType getBlockType() {
        return blockType;
    }

    /**
     * Regions that become blocks on their own, whether or not any text line
     * overlaps them (pictures and tables).
     */
    public boolean isStandalone() {
        return !blockType.isTextBearing();
    }

    public static LayoutLabel fromCode(int code) {
        for (LayoutLabel label : values()) {
            if (label.code == code) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown layout label code: " + code);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LayoutLabel fromJson(Object value) {
        if (value instanceof Number) {
            return fromCode(((Number) value).intValue());
        }
        if (value instanceof String) {
            String raw = ((String) value).trim();
            if (raw.matches("\\d+")) {
                return fromCode(Integer.parseInt(raw));
            }
            try {
                return valueOf(raw.toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown layout label: " + raw, e);
            }
        }
        throw new IllegalArgumentException("Unsupported layout label value: " + value);
    }
}
