package com.filerepo.extraction.ocr;

import com.filerepo.extraction.exception.RecognizerUnavailableException;
import com.filerepo.extraction.infra.RateLimiter;
import com.filerepo.extraction.model.PageImage;
import com.filerepo.extraction.model.RecognizedText;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Base64;

/**
 * OCR through a multimodal Gemini model: the rendered page goes in, a plain transcription comes out.
 */
@Slf4j
@Service
public class GeminiTextRecognizer implements TextRecognizer {

    public static final String OCR_LIMIT = "ocr_limit";
    static final String NO_TEXT_MARKER = "[NO_TEXT]";

    private static final String OCR_PROMPT = """
        Role: OCR engine.
        Task: Transcribe all readable text on this document page, in natural reading order.

        Strict Constraints:

        Output only the transcribed text. No commentary, no Markdown, no translation.

        Keep line breaks between paragraphs and table rows.

        If the page has no legible text (blank, purely graphical, or unreadable), output exactly:
        """ + NO_TEXT_MARKER;

    private final ChatModel visionModel;
    private final RateLimiter ocrLimiter;

    public GeminiTextRecognizer(ChatModel visionModel, @Qualifier("ocrLimiter") RateLimiter ocrLimiter) {
        this.visionModel = visionModel;
        this.ocrLimiter = ocrLimiter;
    }

    @Override
    @Retryable(
        retryFor = RecognizerUnavailableException.class,
        maxAttemptsExpression = "${app.indexing.retry.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${app.indexing.retry.backoff-ms:500}",
            multiplierExpression = "${app.indexing.retry.multiplier:2.0}"))
    public RecognizedText recognize(PageImage page) {
        ChatRequest request = ChatRequest.builder()
            .messages(UserMessage.from(
                TextContent.from(OCR_PROMPT),
                ImageContent.from(Base64.getEncoder().encodeToString(page.png()), PageImage.MIME_TYPE)))
            .build();

        ChatResponse response;
        try {
            response = ocrLimiter.execute(OCR_LIMIT, 1, () -> visionModel.chat(request));
        } catch (RuntimeException e) {
            log.warn("OCR call failed for page {}: {}", page.pageNumber(), e.getMessage());
            throw new RecognizerUnavailableException("OCR backend unavailable: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank() || text.strip().equals(NO_TEXT_MARKER)) {
            log.debug("Page {}: no legible text", page.pageNumber());
            return RecognizedText.unreadable();
        }
        return new RecognizedText(text, false);
    }
}
