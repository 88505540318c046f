package com.example.docassembly.exception;

/**
 * A text line arrived without any word geometry, so it has no bounding box.
 */
public class EmptyLineGeometryException extends AssemblyException {

    private final int lineIndex;

    public EmptyLineGeometryException(int pageIndex, int lineIndex) {
        super(pageIndex, "Text line " + lineIndex + " on page " + pageIndex + " has no word geometries");
        this.lineIndex = lineIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    @Override
    public String getErrorCode() {
        return "empty_line_geometry";
    }
}
