package com.example.docassembly.dto.detection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextLineTest {

    @Test
    void explicitTextWins() {
        TextLine line = TextLine.of("Total: 42", List.of(new Word("Total:", BoundingBox.of(0, 0, 5, 5))));

        assertThat(line.render()).isEqualTo("Total: 42");
    }

    @Test
    void wordsAreJoinedWithSpaces() {
        TextLine line = new TextLine(List.of(
            new Word("a", BoundingBox.of(0, 0, 1, 1)),
            new Word(null, BoundingBox.of(1, 0, 2, 1)),
            new Word("b", BoundingBox.of(2, 0, 3, 1))), null);

        assertThat(line.render()).isEqualTo("a b");
    }

    @Test
    void noWordsRendersEmpty() {
        assertThat(new TextLine(null, null).render()).isEmpty();
    }
}
