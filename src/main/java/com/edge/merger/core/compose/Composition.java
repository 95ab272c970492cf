package com.edge.merger.core.compose;

import com.edge.merger.core.image.RasterImage;

/**
 * 几何合成结果：合成图 + A 在画布中的偏移 + B 到画布的完整变换
 */
public class Composition {

    private final RasterImage image;
    private final int offsetX;
    private final int offsetY;
    private final double[] canvasTransformB;

    Composition(RasterImage image, int offsetX, int offsetY, double[] canvasTransformB) {
        this.image = image;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.canvasTransformB = canvasTransformB;
    }

    public RasterImage getImage() {
        return image;
    }

    public int getOffsetX() {
        return offsetX;
    }

    public int getOffsetY() {
        return offsetY;
    }

    /**
     * T·H，行主序 3x3
     */
    public double[] getCanvasTransformB() {
        return canvasTransformB.clone();
    }
}
