package com.segmentengine.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 混合文本分词器：拉丁字母与数字按非字母数字字符切词并小写化，CJK 连续片段做双字切分。
 *
 * <p>无状态，可被多个 worker 线程共享。
 */
public class MixedScriptTokenizer implements Tokenizer {

    private final boolean enableStopWords;

    public MixedScriptTokenizer(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            char current = text.charAt(cursor);
            if (isCjk(current)) {
                int runEnd = scanCjkRun(text, cursor);
                appendBigrams(text, cursor, runEnd, tokens);
                cursor = runEnd;
            } else if (isAsciiLetterOrDigit(current)) {
                int wordEnd = scanWord(text, cursor);
                appendWord(text.substring(cursor, wordEnd), tokens);
                cursor = wordEnd;
            } else {
                cursor++;
            }
        }
        return tokens;
    }

    /**
     * 单字 CJK 片段直接输出，多字片段输出相邻双字组合。
     */
    private void appendBigrams(String text, int start, int end, List<Token> tokens) {
        if (end - start == 1) {
            tokens.add(new Token(text.substring(start, end), tokens.size()));
            return;
        }
        for (int index = start; index < end - 1; index++) {
            tokens.add(new Token(text.substring(index, index + 2), tokens.size()));
        }
    }

    private void appendWord(String word, List<Token> tokens) {
        String normalized = word.toLowerCase(Locale.ROOT);
        if (normalized.length() <= 1) {
            return;
        }
        if (enableStopWords && StopWords.isStopWord(normalized)) {
            return;
        }
        tokens.add(new Token(normalized, tokens.size()));
    }

    private int scanCjkRun(String text, int start) {
        int end = start + 1;
        while (end < text.length() && isCjk(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private int scanWord(String text, int start) {
        int end = start + 1;
        while (end < text.length()) {
            if (!isAsciiLetterOrDigit(text.charAt(end))) {
                break;
            }
            end++;
        }
        return end;
    }

    private boolean isAsciiLetterOrDigit(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }

    /**
     * 判断字符是否为CJK字符。
     */
    private boolean isCjk(char ch) {
        Character.UnicodeScript script = Character.UnicodeScript.of(ch);
        return script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.HANGUL;
    }
}
