package com.edge.merger.core.feature;

import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.Point;

import java.util.List;

/**
 * 单幅图像的关键点 + 描述子，描述子第 i 行对应第 i 个关键点
 */
public class FeatureSet {

    private final MatOfKeyPoint keypoints;
    private final Mat descriptors;
    private final DetectorKind kind;
    private final int sourceIndex;
    private List<KeyPoint> keypointList;

    public FeatureSet(MatOfKeyPoint keypoints, Mat descriptors, DetectorKind kind, int sourceIndex) {
        this.keypoints = keypoints;
        this.descriptors = descriptors;
        this.kind = kind;
        this.sourceIndex = sourceIndex;
    }

    public MatOfKeyPoint getKeypoints() {
        return keypoints;
    }

    public Mat getDescriptors() {
        return descriptors;
    }

    public DetectorKind getKind() {
        return kind;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    public int size() {
        return (int) keypoints.total();
    }

    public boolean isEmpty() {
        return descriptors.empty() || keypoints.empty();
    }

    public List<KeyPoint> keypointList() {
        if (keypointList == null) {
            keypointList = keypoints.toList();
        }
        return keypointList;
    }

    public Point location(int index) {
        return keypointList().get(index).pt;
    }

    public void release() {
        keypoints.release();
        descriptors.release();
    }
}
