package com.segmentengine.index;

import java.io.IOException;

/**
 * 段落盘失败，对所属构建作业是致命错误。
 */
public class IndexFlushException extends IOException {

    public IndexFlushException(String message, Throwable cause) {
        super(message, cause);
    }
}
