package com.example.docassembly.exception;

/**
 * The same layout region received both merged text lines and a direct
 * non-text injection.
 */
public class ConflictingBlockException extends AssemblyException {

    private final String regionId;

    public ConflictingBlockException(int pageIndex, String regionId) {
        super(pageIndex, "Layout region " + regionId + " on page " + pageIndex
            + " holds both text lines and a non-text block");
        this.regionId = regionId;
    }

    public String getRegionId() {
        return regionId;
    }

    @Override
    public String getErrorCode() {
        return "conflicting_block";
    }
}
