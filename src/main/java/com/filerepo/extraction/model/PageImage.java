package com.filerepo.extraction.model;

/**
 * One rendered page of a source document.
 *
 * @param pageNumber 1-based position in the document
 * @param png        PNG-encoded raster of the page
 */
public record PageImage(
    int pageNumber,
    byte[] png
) {
    public static final String MIME_TYPE = "image/png";
}
