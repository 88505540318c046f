package com.example.docassembly.dto.detection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One recognized line of text. The line geometry is never sent on its own:
 * it is derived from the word geometries during assembly.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextLine {
    private List<Word> words = new ArrayList<>();
    private String text; // Optional; overrides the rendering of the words

    public static TextLine of(String text, List<Word> words) {
        return new TextLine(new ArrayList<>(words), text);
    }

    public String render() {
        if (text != null) {
            return text;
        }
        if (words == null) {
            return "";
        }
        return words.stream()
            .map(Word::getValue)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "));
    }
}
