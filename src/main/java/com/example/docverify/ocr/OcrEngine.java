package com.example.docverify.ocr;

/**
 * Turns a document image into unstructured text.
 */
public interface OcrEngine {

    /**
     * Recognizes the text in an image. Blocks until the text is available.
     *
     * @param imageBytes encoded image (PNG, JPEG, ...)
     * @return recognized text, lines separated by line breaks
     * @throws OcrException if the image cannot be decoded or recognition fails
     */
    String recognize(byte[] imageBytes);

    /** Whether the engine is ready to recognize text. */
    boolean isAvailable();
}
