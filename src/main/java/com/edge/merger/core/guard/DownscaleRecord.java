package com.edge.merger.core.guard;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 有损缩放记录，随结果元数据返回，供调用方提示用户
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownscaleRecord {
    private int sourceIndex;
    private int originalWidth;
    private int originalHeight;
    private int width;
    private int height;
}
