package com.example.docassembly.exception;

/**
 * Base class for contract violations found while assembling a page.
 * None of them are recovered from locally.
 */
public abstract class AssemblyException extends RuntimeException {

    private final int pageIndex;

    protected AssemblyException(int pageIndex, String message) {
        super(message);
        this.pageIndex = pageIndex;
    }

    protected AssemblyException(int pageIndex, String message, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    /**
     * Short machine-readable code used in error responses.
     */
    public abstract String getErrorCode();
}
