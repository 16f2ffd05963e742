package com.segmentengine.index;

/**
 * 构建作业被外部取消，作业产出的段已被丢弃。
 */
public class BuildCancelledException extends IndexBuildException {

    public BuildCancelledException(String message) {
        super(message);
    }
}
