package com.edge.merger.core.error;

import org.junit.Test;

import static org.junit.Assert.*;

public class MergeExceptionTest {

    @Test
    public void onlyAlignmentFailuresAreRecoverable() {
        for (MergeErrorCode code : MergeErrorCode.values()) {
            boolean expected = code == MergeErrorCode.INSUFFICIENT_FEATURES || code == MergeErrorCode.DEGENERATE_ALIGNMENT;
            assertEquals(code.name(), expected, code.isRecoverable());
        }
    }

    @Test
    public void subclassesCarryTheirCode() {
        assertEquals(MergeErrorCode.INVALID_IMAGE, new InvalidImageException(2, "bad").getCode());
        assertEquals(2, new InvalidImageException(2, "bad").getSourceIndex());
        assertTrue(new InsufficientFeaturesException(3, "few").isRecoverable());
        assertEquals(3, new InsufficientFeaturesException(3, "few").getCorrespondences());
        assertTrue(new DegenerateAlignmentException("flat").isRecoverable());
        assertFalse(new ResourceExceededException(10, 20, "big").isRecoverable());
        assertEquals(20, new ResourceExceededException(10, 20, "big").getHeight());
        assertEquals(MergeErrorCode.CONFIGURATION_ERROR, new ConfigurationException("x").getCode());
        MergeCancelledException cancelled = new MergeCancelledException("matching");
        assertEquals(MergeErrorCode.CANCELLED, cancelled.getCode());
        assertTrue(cancelled.getMessage().contains("matching"));
    }
}
