package com.segmentengine.index;

/**
 * 内存预算记账结果。
 */
public enum FlushDecision {
    /** 已达到预算，调用方必须先落盘再接收新文档 */
    FLUSH_REQUIRED,
    CONTINUE
}
