package com.example.docverify.ocr;

import com.example.docverify.config.VerificationProperties;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link OcrEngine} backed by Tesseract through tess4j.
 * <p>
 * Tesseract instances are not thread-safe, so each call creates and configures its own.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final VerificationProperties.Ocr settings;

    public TesseractOcrEngine(VerificationProperties.Ocr settings) {
        this.settings = settings;
    }

    @Override
    public String recognize(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new OcrException("Empty image");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new OcrException("Unable to read the document image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new OcrException("Unsupported or corrupt image file");
        }

        log.debug("Running OCR on {}x{} image (language={})", image.getWidth(), image.getHeight(),
                settings.language());
        try {
            String text = newTesseract().doOCR(image);
            log.debug("OCR completed: {} characters", text.length());
            return text;
        } catch (TesseractException e) {
            throw new OcrException("Text recognition failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(Path.of(settings.datapath()));
    }

    private ITesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(settings.datapath());
        tesseract.setLanguage(settings.language());
        tesseract.setPageSegMode(settings.pageSegMode());
        tesseract.setOcrEngineMode(settings.ocrEngineMode());
        return tesseract;
    }
}
