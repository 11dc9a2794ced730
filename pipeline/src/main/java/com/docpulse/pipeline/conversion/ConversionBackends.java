package com.docpulse.pipeline.conversion;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds backends for the closed {@link BackendType} set.
 */
public final class ConversionBackends {

    private ConversionBackends() {
    }

    public static ConversionBackend create(BackendType type) {
        switch (type) {
            case PDFBOX:
                return new PdfBoxBackend(false);
            case PDFBOX_LAYOUT:
                return new PdfBoxBackend(true);
            case PANDOC:
                return new PandocBackend();
            case PLAIN_TEXT:
                return new PlainTextBackend();
            default:
                throw new IllegalArgumentException("Unknown backend: " + type);
        }
    }

    /**
     * Every backend, in priority order.
     */
    public static List<ConversionBackend> defaultChain() {
        List<ConversionBackend> backends = new ArrayList<>();
        for (BackendType type : BackendType.values()) {
            backends.add(create(type));
        }
        return backends;
    }
}
