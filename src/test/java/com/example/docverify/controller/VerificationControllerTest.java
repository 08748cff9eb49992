package com.example.docverify.controller;

import com.example.docverify.config.VerificationConfig;
import com.example.docverify.model.ApplicantData;
import com.example.docverify.model.ValidationCheck;
import com.example.docverify.model.VerificationResult;
import com.example.docverify.ocr.OcrEngine;
import com.example.docverify.ocr.OcrException;
import com.example.docverify.orchestrator.VerificationOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static com.example.docverify.TestFixtures.validDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VerificationController.class)
@Import(VerificationConfig.class)
@DisplayName("VerificationController")
class VerificationControllerTest {

    /** base64 of "hello". */
    private static final String IMAGE_BASE64 = "aGVsbG8=";
    private static final byte[] IMAGE_BYTES = "hello".getBytes(StandardCharsets.US_ASCII);

    private static final String APPLICANT = """
            {"name": "Anna Maria Eriksson", "dateOfBirth": "1974-08-12",
             "passportNumber": "L898902C3", "nationality": "UTO", "intendedVisaType": "business"}""";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VerificationOrchestrator orchestrator;

    @MockBean
    private OcrEngine ocrEngine;

    private static String body(String imageData, String applicant) {
        return "{\"imageData\": %s, \"applicantData\": %s}".formatted(
                imageData == null ? "null" : "\"" + imageData + "\"", applicant);
    }

    private static VerificationResult result() {
        return new VerificationResult(93, validDocument(),
                List.of(ValidationCheck.pass("Document Expiry", "Document valid until 2030-04-15")),
                List.of(), List.of("Proceed with visa application - all checks passed"),
                "Document verification successful.", Instant.parse("2025-06-15T10:00:00Z"));
    }

    @Nested
    @DisplayName("POST /api/verify")
    class Verify {

        @Test
        @DisplayName("Returns the verification result")
        void verifies() throws Exception {
            when(orchestrator.verify(aryEq(IMAGE_BYTES), any(), isNull())).thenReturn(result());

            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(IMAGE_BASE64, APPLICANT)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.overallConfidence").value(93))
                    .andExpect(jsonPath("$.extractedData.documentNumber.value").value("L898902C3"))
                    .andExpect(jsonPath("$.extractedData.issueDate.confidence").value(70))
                    .andExpect(jsonPath("$.extractedData.documentNumber.empty").doesNotExist())
                    .andExpect(jsonPath("$.extractedData.documentNumber.*", hasSize(2)))
                    .andExpect(jsonPath("$.extractedData.placeOfBirth").doesNotExist())
                    .andExpect(jsonPath("$.validationChecks[0].check").value("Document Expiry"))
                    .andExpect(jsonPath("$.recommendedActions[0]")
                            .value("Proceed with visa application - all checks passed"))
                    .andExpect(jsonPath("$.verifiedAt").value("2025-06-15T10:00:00Z"));

            ArgumentCaptor<ApplicantData> applicant = ArgumentCaptor.forClass(ApplicantData.class);
            verify(orchestrator).verify(aryEq(IMAGE_BYTES), applicant.capture(), isNull());
            assertThat(applicant.getValue().intendedVisaType()).isEqualTo("business");
        }

        @Test
        @DisplayName("Accepts a data URL and defaults the visa type")
        void dataUrl() throws Exception {
            when(orchestrator.verify(any(), any(), any())).thenReturn(result());

            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("data:image/png;base64," + IMAGE_BASE64, "{\"name\": \"Anna\"}")))
                    .andExpect(status().isOk());

            ArgumentCaptor<ApplicantData> applicant = ArgumentCaptor.forClass(ApplicantData.class);
            verify(orchestrator).verify(aryEq(IMAGE_BYTES), applicant.capture(), isNull());
            assertThat(applicant.getValue().intendedVisaType()).isEqualTo(ApplicantData.DEFAULT_VISA_TYPE);
        }

        @Test
        void missingImage() throws Exception {
            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(null, APPLICANT)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Image data is required"));

            verify(orchestrator, never()).verify(any(), any(), any());
        }

        @Test
        void emptyDataUrl() throws Exception {
            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("data:image/png;base64,", APPLICANT)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Image data is required"));
        }

        @Test
        void missingApplicant() throws Exception {
            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(IMAGE_BASE64, "null")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Applicant data is required"));
        }

        @Test
        void invalidBase64() throws Exception {
            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("not*base64!", APPLICANT)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Image data is not valid base64"));
        }

        @Test
        @DisplayName("Pipeline failures become a 500 with details")
        void pipelineFailure() throws Exception {
            when(orchestrator.verify(any(), any(), any()))
                    .thenThrow(new OcrException("Unsupported or corrupt image file"));

            mockMvc.perform(post("/api/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body(IMAGE_BASE64, APPLICANT)))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("Verification failed"))
                    .andExpect(jsonPath("$.details").value("Unsupported or corrupt image file"));
        }
    }

    @Nested
    @DisplayName("GET /api/health")
    class Health {

        @Test
        void ocrUp() throws Exception {
            when(ocrEngine.isAvailable()).thenReturn(true);

            mockMvc.perform(get("/api/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ok"))
                    .andExpect(jsonPath("$.service").value("Document-Verification"))
                    .andExpect(jsonPath("$.ocrEngine").value("up"));
        }

        @Test
        void ocrDown() throws Exception {
            when(ocrEngine.isAvailable()).thenReturn(false);

            mockMvc.perform(get("/api/health"))
                    .andExpect(jsonPath("$.status").value("degraded"))
                    .andExpect(jsonPath("$.ocrEngine").value("down"));
        }
    }

    @Test
    @DisplayName("Image decoding tolerates line-wrapped base64")
    void decodeWrapped() {
        assertThat(VerificationController.decodeImage("aGVs\nbG8=")).isEqualTo(IMAGE_BYTES);
        assertThatThrownBy(() -> VerificationController.decodeImage("%%%"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
