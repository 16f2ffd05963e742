package com.segmentengine.text;

import java.util.List;

/**
 * 字段文本分词器。同一实例被一个构建作业的全部 worker 共享，实现必须线程安全。
 */
@FunctionalInterface
public interface Tokenizer {

    /**
     * 将字段文本切分为带位置的词项，位置从 0 连续递增。
     */
    List<Token> tokenize(String text);
}
