package com.example.docverify.controller;

import com.example.docverify.model.VerificationRequest;
import com.example.docverify.model.VerificationResult;
import com.example.docverify.ocr.OcrEngine;
import com.example.docverify.orchestrator.VerificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * REST controller for travel document verification.
 */
@RestController
@RequestMapping("/api")
public class VerificationController {

    private static final Logger log = LoggerFactory.getLogger(VerificationController.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final VerificationOrchestrator orchestrator;
    private final OcrEngine ocrEngine;

    public VerificationController(VerificationOrchestrator orchestrator, OcrEngine ocrEngine) {
        this.orchestrator = orchestrator;
        this.ocrEngine = ocrEngine;
    }

    /**
     * Extracts the document fields from an image and checks them against the applicant's claims.
     *
     * <p>Endpoint: POST /api/verify
     * <p>Body: {@code {imageData, applicantData, eligibilityPolicy?}}, imageData as base64 or data URL
     */
    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> verify(@RequestBody VerificationRequest request) {
        if (request.imageData() == null || request.imageData().isBlank()) {
            return badRequest("Image data is required");
        }
        if (request.applicantData() == null) {
            return badRequest("Applicant data is required");
        }

        byte[] image;
        try {
            image = decodeImage(request.imageData());
        } catch (IllegalArgumentException e) {
            return badRequest("Image data is not valid base64");
        }
        if (image.length == 0) {
            return badRequest("Image data is required");
        }

        log.info("Received verification request ({} byte image, visa type '{}', {} policy)",
                image.length, request.applicantData().intendedVisaType(),
                request.eligibilityPolicy() != null ? "custom" : "default");

        try {
            VerificationResult result = orchestrator.verify(image, request.applicantData(),
                    request.eligibilityPolicy());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("Verification failed", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Verification failed",
                            "details", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Reports whether the OCR engine is usable.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ocrUp = ocrEngine.isAvailable();
        return ResponseEntity.ok(Map.of(
                "status", ocrUp ? "ok" : "degraded",
                "service", "Document-Verification",
                "ocrEngine", ocrUp ? "up" : "down"
        ));
    }

    /** Accepts plain base64 or a data URL ({@code data:image/png;base64,...}). */
    static byte[] decodeImage(String imageData) {
        int comma = imageData.indexOf(',');
        String base64 = comma >= 0 ? imageData.substring(comma + 1) : imageData;
        return Base64.getDecoder().decode(WHITESPACE.matcher(base64).replaceAll(""));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
