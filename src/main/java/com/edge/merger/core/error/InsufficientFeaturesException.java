package com.edge.merger.core.error;

public class InsufficientFeaturesException extends MergeException {

    private final int correspondences;

    public InsufficientFeaturesException(int correspondences, String message) {
        super(MergeErrorCode.INSUFFICIENT_FEATURES, message);
        this.correspondences = correspondences;
    }

    public InsufficientFeaturesException(int correspondences, String message, Throwable cause) {
        super(MergeErrorCode.INSUFFICIENT_FEATURES, message, cause);
        this.correspondences = correspondences;
    }

    public int getCorrespondences() {
        return correspondences;
    }
}
