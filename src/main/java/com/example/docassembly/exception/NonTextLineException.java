package com.example.docassembly.exception;

import com.example.docassembly.dto.document.BlockType;

/**
 * A text line matched a region whose block type does not carry text.
 */
public class NonTextLineException extends AssemblyException {

    private final String regionId;
    private final BlockType blockType;

    public NonTextLineException(int pageIndex, String regionId, BlockType blockType) {
        super(pageIndex, "Text line matched " + blockType.getTag() + " region " + regionId
            + " on page " + pageIndex);
        this.regionId = regionId;
        this.blockType = blockType;
    }

    public String getRegionId() {
        return regionId;
    }

    public BlockType getBlockType() {
        return blockType;
    }

    @Override
    public String getErrorCode() {
        return "non_text_line";
    }
}
