package com.example.docassembly.exception;

/**
 * A layout region is missing its identifier or label.
 */
public class InvalidRegionException extends AssemblyException {

    private final int regionIndex;

    public InvalidRegionException(int pageIndex, int regionIndex, String reason) {
        super(pageIndex, "Layout region " + regionIndex + " on page " + pageIndex + " " + reason);
        this.regionIndex = regionIndex;
    }

    public int getRegionIndex() {
        return regionIndex;
    }

    @Override
    public String getErrorCode() {
        return "invalid_region";
    }
}
