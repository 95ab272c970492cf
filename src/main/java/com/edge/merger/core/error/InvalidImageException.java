package com.edge.merger.core.error;

public class InvalidImageException extends MergeException {

    private final int sourceIndex;

    public InvalidImageException(int sourceIndex, String message) {
        super(MergeErrorCode.INVALID_IMAGE, message);
        this.sourceIndex = sourceIndex;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }
}
