package com.edge.merger.core.image;

import com.edge.merger.core.error.InvalidImageException;
import com.edge.merger.core.error.ResourceExceededException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

import java.util.Base64;

/**
 * 图像编解码：解码 PNG / JPEG / BMP，输出 JPEG
 * 解码前检查字节上限，解码失败抛出 InvalidImage
 */
public class ImageCodec {

    public static final long DEFAULT_MAX_INPUT_BYTES = 16L * 1024 * 1024;
    private static final int JPEG_QUALITY = 95;

    private final long maxInputBytes;

    public ImageCodec() {
        this(DEFAULT_MAX_INPUT_BYTES);
    }

    public ImageCodec(long maxInputBytes) {
        this.maxInputBytes = maxInputBytes;
    }

    public RasterImage decode(byte[] data, int sourceIndex) {
        if (data == null || data.length == 0) {
            throw new InvalidImageException(sourceIndex, "Image #" + sourceIndex + " is empty");
        }
        if (data.length > maxInputBytes) {
            throw new ResourceExceededException(-1, -1,
                    "Image #" + sourceIndex + " is " + data.length + " bytes, limit is " + maxInputBytes);
        }
        MatOfByte buffer = new MatOfByte(data);
        Mat decoded = null;
        try {
            decoded = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (decoded == null || decoded.empty()) {
                throw new InvalidImageException(sourceIndex, "Image #" + sourceIndex + " could not be decoded");
            }
            return new RasterImage(decoded, sourceIndex);
        } catch (InvalidImageException e) {
            if (decoded != null) decoded.release();
            throw e;
        } finally {
            buffer.release();
        }
    }

    public byte[] encodeJpeg(RasterImage image) {
        return encode(image, ".jpg", new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, JPEG_QUALITY));
    }

    public String toBase64Jpeg(RasterImage image) {
        return Base64.getEncoder().encodeToString(encodeJpeg(image));
    }

    private byte[] encode(RasterImage image, String ext, MatOfInt params) {
        MatOfByte out = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(ext, image.getPixels(), out, params)) {
                throw new IllegalStateException("Failed to encode image as " + ext);
            }
            return out.toArray();
        } finally {
            out.release();
            params.release();
        }
    }

    public long getMaxInputBytes() {
        return maxInputBytes;
    }
}
