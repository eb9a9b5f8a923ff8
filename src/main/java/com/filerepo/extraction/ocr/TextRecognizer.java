package com.filerepo.extraction.ocr;

import com.filerepo.extraction.model.PageImage;
import com.filerepo.extraction.model.RecognizedText;

public interface TextRecognizer {

    /**
     * Returns the text on a page, or empty text flagged low-confidence when nothing legible is found.
     *
     * @throws com.filerepo.extraction.exception.RecognizerUnavailableException when the OCR backend cannot be reached
     */
    RecognizedText recognize(PageImage page);
}
