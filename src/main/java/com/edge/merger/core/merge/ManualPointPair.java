package com.edge.merger.core.merge;

import org.opencv.core.Point;

/**
 * 用户标注的对应点：A 图中的点与 B 图中的同名点（原始分辨率坐标）
 */
public class ManualPointPair {

    private final Point pointA;
    private final Point pointB;

    public ManualPointPair(Point pointA, Point pointB) {
        this.pointA = pointA;
        this.pointB = pointB;
    }

    public ManualPointPair(double xA, double yA, double xB, double yB) {
        this(new Point(xA, yA), new Point(xB, yB));
    }

    public Point getPointA() {
        return pointA;
    }

    public Point getPointB() {
        return pointB;
    }
}
