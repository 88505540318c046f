package com.example.docassembly.exception;

/**
 * A line, word or region box has inverted or non-finite coordinates.
 * Exactly one of {@code lineIndex} and {@code regionId} identifies the source.
 */
public class InvalidGeometryException extends AssemblyException {

    private final Integer lineIndex;
    private final String regionId;

    private InvalidGeometryException(int pageIndex, Integer lineIndex, String regionId, String message,
                                     Throwable cause) {
        super(pageIndex, message, cause);
        this.lineIndex = lineIndex;
        this.regionId = regionId;
    }

    public static InvalidGeometryException forLine(int pageIndex, int lineIndex, Throwable cause) {
        return new InvalidGeometryException(pageIndex, lineIndex, null,
            "Invalid word geometry in line " + lineIndex + " on page " + pageIndex + ": " + cause.getMessage(),
            cause);
    }

    public static InvalidGeometryException forRegion(int pageIndex, String regionId, Throwable cause) {
        return new InvalidGeometryException(pageIndex, null, regionId,
            "Invalid geometry for layout region " + regionId + " on page " + pageIndex + ": " + cause.getMessage(),
            cause);
    }

    public Integer getLineIndex() {
        return lineIndex;
    }

    public String getRegionId() {
        return regionId;
    }

    @Override
    public String getErrorCode() {
        return "invalid_geometry";
    }
}
