package com.example.docverify.ocr;

/**
 * Failure of the OCR engine. Fatal for the verification request.
 */
public class OcrException extends RuntimeException {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
