package com.edge.merger.core.error;

public class DegenerateAlignmentException extends MergeException {

    public DegenerateAlignmentException(String message) {
        super(MergeErrorCode.DEGENERATE_ALIGNMENT, message);
    }

    public DegenerateAlignmentException(String message, Throwable cause) {
        super(MergeErrorCode.DEGENERATE_ALIGNMENT, message, cause);
    }
}
