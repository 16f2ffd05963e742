package com.segmentengine.index;

import java.io.IOException;

/**
 * 合并无法完成（源段不再存活、缺失或损坏）。段集合保持不变，可在下次触发时重试。
 */
public class MergeFailureException extends IOException {

    public MergeFailureException(String message) {
        super(message);
    }

    public MergeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
