package com.segmentengine.index;

import java.io.IOException;

/**
 * 构建作业失败：某个 worker 出错，作业产出的全部段已被丢弃。
 */
public class IndexBuildException extends IOException {

    public IndexBuildException(String message) {
        super(message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
