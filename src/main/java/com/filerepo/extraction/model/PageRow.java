package com.filerepo.extraction.model;

/**
 * A page staged for replace-all. {@code vector} is null for a blank page kept only for its (empty) OCR text.
 */
public record PageRow(
    int pageId,
    float[] vector,
    String ocrText
) {
    public PageRow {
        if (pageId < 1) {
            throw new IllegalArgumentException("Page ids are 1-based, got " + pageId);
        }
        ocrText = ocrText == null ? "" : ocrText;
    }

    public static PageRow blank(int pageId, String ocrText) {
        return new PageRow(pageId, null, ocrText);
    }

    public boolean hasVector() {
        return vector != null;
    }
}
