package com.filerepo.extraction.extractor;

import com.filerepo.extraction.model.PageImage;

import java.util.List;

public interface PageExtractor {

    /**
     * Splits a paginated document into one image per page, in page order.
     * An empty document yields an empty list.
     *
     * @throws com.filerepo.extraction.exception.UnsupportedFormatException if the bytes are not a supported paginated type
     * @throws com.filerepo.extraction.exception.CorruptDocumentException if the page count cannot be determined
     */
    List<PageImage> extractPages(byte[] documentBytes);
}
