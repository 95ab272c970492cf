package com.edge.merger.core.error;

/**
 * 输入超过硬上限，携带超限的尺寸（字节数超限时 width/height 为 -1）
 */
public class ResourceExceededException extends MergeException {

    private final int width;
    private final int height;

    public ResourceExceededException(int width, int height, String message) {
        super(MergeErrorCode.RESOURCE_EXCEEDED, message);
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
