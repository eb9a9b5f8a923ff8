package com.filerepo.extraction.embedding;

public interface Embedder {

    /**
     * Embeds text into a vector of exactly the configured number of components. Never returns a zero or empty vector.
     *
     * @throws com.filerepo.extraction.exception.EmptyInputException if the text is empty after trimming
     * @throws com.filerepo.extraction.exception.EmbedderUnavailableException when the embedding backend cannot be reached
     * @throws com.filerepo.extraction.exception.DimensionMismatchException if the backend answers with the wrong length
     */
    float[] embed(String text);
}
