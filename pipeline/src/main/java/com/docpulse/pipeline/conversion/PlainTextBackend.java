package com.docpulse.pipeline.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Last-resort backend: decodes the file as UTF-8 and blanks ASCII control
 * characters. Undecodable bytes stay as U+FFFD so {@link QualityScorer} can
 * tell a binary file from text. Never throws; an unreadable file yields an
 * empty string, which the chain treats as "no text".
 */
public class PlainTextBackend implements ConversionBackend {

    private static final Logger logger = LoggerFactory.getLogger(PlainTextBackend.class);

    @Override
    public BackendType type() {
        return BackendType.PLAIN_TEXT;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String convert(Path source) {
        try {
            String raw = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
            return raw.replaceAll("[\\p{Cntrl}&&[^\\n\\t]]", " ")
                    .replaceAll("[ \\t]{2,}", " ");
        } catch (IOException e) {
            logger.warn("plain-text fallback could not read {}: {}", source, e.getMessage());
            return "";
        }
    }
}
