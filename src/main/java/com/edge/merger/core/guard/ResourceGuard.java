package com.edge.merger.core.guard;

import com.edge.merger.core.error.ResourceExceededException;
import com.edge.merger.core.image.RasterImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 资源守卫：在任何 CV 计算前限制输入分辨率
 * <p>
 * 长边超过 maxDimension 时等比缩放 (INTER_AREA) 使长边恰好等于上限，
 * 否则原样通过。关键点数量和匹配开销随分辨率超线性增长，这里给出确定的上界。
 */
public class ResourceGuard {
    private static final Logger logger = LoggerFactory.getLogger(ResourceGuard.class);

    public static final long DEFAULT_MAX_SOURCE_PIXELS = 100_000_000L;

    private final long maxSourcePixels;

    public ResourceGuard() {
        this(DEFAULT_MAX_SOURCE_PIXELS);
    }

    public ResourceGuard(long maxSourcePixels) {
        this.maxSourcePixels = maxSourcePixels;
    }

    /**
     * @param image        输入图像；缩放时返回新图像，输入图像保持不变由调用方释放
     * @param maxDimension 长边上限
     */
    public GuardedImage guard(RasterImage image, int maxDimension) {
        int width = image.width();
        int height = image.height();

        if (image.area() > maxSourcePixels) {
            throw new ResourceExceededException(width, height,
                    "Image #" + image.getSourceIndex() + " is " + width + "x" + height
                            + ", exceeds the limit of " + maxSourcePixels + " pixels");
        }

        int longer = Math.max(width, height);
        if (longer <= maxDimension) {
            return new GuardedImage(image, null);
        }

        double scale = (double) maxDimension / longer;
        int newWidth = width >= height ? maxDimension : (int) Math.round(width * scale);
        int newHeight = height > width ? maxDimension : (int) Math.round(height * scale);
        if (newWidth < 1 || newHeight < 1) {
            throw new ResourceExceededException(width, height,
                    "Image #" + image.getSourceIndex() + " is " + width + "x" + height
                            + ", cannot be downscaled to " + maxDimension + " without collapsing");
        }

        Mat resized = new Mat();
        Imgproc.resize(image.getPixels(), resized, new Size(newWidth, newHeight), 0, 0, Imgproc.INTER_AREA);
        logger.info("Resized image #{} from {}x{} to {}x{}", image.getSourceIndex(), width, height, newWidth, newHeight);

        DownscaleRecord record = new DownscaleRecord(image.getSourceIndex(), width, height, newWidth, newHeight);
        return new GuardedImage(new RasterImage(resized, image.getSourceIndex()), record);
    }

    public long getMaxSourcePixels() {
        return maxSourcePixels;
    }
}
