package com.docpulse.pipeline.conversion;

/**
 * The fixed set of conversion backends, declared in fallback priority order:
 * fast and cheap first, the plain-text last resort at the end.
 */
public enum BackendType {
    PDFBOX("pdfbox"),
    PDFBOX_LAYOUT("pdfbox-layout"),
    PANDOC("pandoc"),
    PLAIN_TEXT("plain-text");

    private final String id;

    BackendType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
