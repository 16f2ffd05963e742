package com.segmentengine.text;

public record Token(
    String term,
    int position
) {
}
