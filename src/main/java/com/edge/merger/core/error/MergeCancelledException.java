package com.edge.merger.core.error;

public class MergeCancelledException extends MergeException {

    public MergeCancelledException(String stage) {
        super(MergeErrorCode.CANCELLED, "Merge cancelled before stage: " + stage);
    }
}
