package com.edge.merger.core.guard;

import com.edge.merger.core.image.RasterImage;

/**
 * ResourceGuard 输出：处理后的图像 + 可选的缩放记录
 */
public class GuardedImage {

    private final RasterImage image;
    private final DownscaleRecord downscale;

    GuardedImage(RasterImage image, DownscaleRecord downscale) {
        this.image = image;
        this.downscale = downscale;
    }

    public RasterImage getImage() {
        return image;
    }

    /**
     * @return 缩放记录，原样通过时为 null
     */
    public DownscaleRecord getDownscale() {
        return downscale;
    }

    public boolean isDownscaled() {
        return downscale != null;
    }
}
