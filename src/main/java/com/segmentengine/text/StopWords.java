package com.segmentengine.text;

import java.util.Locale;
import java.util.Set;

public final class StopWords {

    public static final Set<String> ENGLISH = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "be", "been",
        "has", "have", "had", "do", "does", "did", "will", "would",
        "and", "or", "but", "not", "in", "on", "at", "to", "for",
        "of", "with", "by", "from", "as", "into", "it", "its",
        "this", "that", "which", "if", "so", "no"
    );

    private StopWords() {
    }

    /**
     * 判断已小写化的词项是否为英文停用词。
     */
    public static boolean isStopWord(String normalizedTerm) {
        return normalizedTerm != null && ENGLISH.contains(normalizedTerm.toLowerCase(Locale.ROOT));
    }
}
