package com.edge.merger.core.merge;

import org.junit.Test;

import static org.junit.Assert.*;

public class FallbackPolicyTest {

    private final FallbackPolicy policy = new FallbackPolicy();

    @Test
    public void relaxedThresholdIsCapped() {
        assertEquals(0.9, policy.relax(0.7), 1e-12);
    }

    @Test
    public void relaxedThresholdScales() {
        assertEquals(0.65, policy.relax(0.5), 1e-12);
    }

    @Test
    public void neverTighterThanRequested() {
        assertEquals(0.95, policy.relax(0.95), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void factorBelowOneIsRejected() {
        new FallbackPolicy(0.8, 0.9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void capMustBeBelowOne() {
        new FallbackPolicy(1.3, 1.0);
    }
}
