package com.filerepo.extraction.model;

public record RecognizedText(
    String text,
    boolean lowConfidence
) {
    public RecognizedText {
        text = text == null ? "" : text.strip();
    }

    public static RecognizedText unreadable() {
        return new RecognizedText("", true);
    }

    public boolean isBlank() {
        return text.isEmpty();
    }
}
