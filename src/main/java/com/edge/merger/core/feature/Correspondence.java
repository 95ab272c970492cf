package com.edge.merger.core.feature;

/**
 * 一组对应点：A 中的关键点下标、B 中的关键点下标、描述子距离
 */
public class Correspondence {
    private final int queryIndex;
    private final int trainIndex;
    private final float distance;

    public Correspondence(int queryIndex, int trainIndex, float distance) {
        this.queryIndex = queryIndex;
        this.trainIndex = trainIndex;
        this.distance = distance;
    }

    /** A 中的关键点下标 */
    public int getQueryIndex() {
        return queryIndex;
    }

    /** B 中的关键点下标 */
    public int getTrainIndex() {
        return trainIndex;
    }

    public float getDistance() {
        return distance;
    }

    @Override
    public String toString() {
        return "Correspondence[" + queryIndex + "->" + trainIndex + ", d=" + distance + "]";
    }
}
