package com.docpulse.pipeline.conversion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {

    private final QualityScorer scorer = new QualityScorer();

    private static String prose(int minLength) {
        StringBuilder text = new StringBuilder();
        while (text.length() < minLength) {
            text.append("The study measures extraction quality across a corpus of papers. ");
        }
        return text.toString();
    }

    private static String structuredMarkdown() {
        return "# Resilient Extraction\n\n"
                + prose(250) + "\n\n"
                + "## Methods\n\n"
                + "- download with retries\n"
                + "- convert with fallbacks\n"
                + "- summarize with circuit breaking\n\n"
                + prose(200) + "\n\n"
                + "## Results\n\n"
                + "1. fewer failures\n"
                + "2. lower cost\n\n"
                + "```java\nint attempts = 3;\n```\n\n"
                + "| backend | score |\n"
                + "|---------|-------|\n"
                + "| pdfbox  | 0.9   |\n\n"
                + "## Discussion\n\n"
                + prose(150);
    }

    // =========================================================================
    // Thresholds
    // =========================================================================

    @Test
    @DisplayName("Text shorter than the minimum length scores zero")
    void shortText_scoresZero() {
        assertEquals(0.0, scorer.score("too short", 3));
        assertEquals(0.0, scorer.score(null, 0));
        assertEquals(0.0, scorer.score("   " + "x".repeat(QualityScorer.MIN_TEXT_LENGTH - 1) + "   ", 0));
    }

    @Test
    @DisplayName("Unstructured prose with unknown page count scores neutral 0.5")
    void plainProse_unknownPages_isNeutral() {
        double score = scorer.score(prose(1000), 0);

        assertEquals(0.5, score, 1e-9);
    }

    @Test
    @DisplayName("Well-structured markdown of the expected length scores high")
    void structuredMarkdown_scoresHigh() {
        String text = structuredMarkdown();

        double structured = scorer.score(text, 1);
        double plain = scorer.score(prose(text.length()), 1);

        assertTrue(structured > 0.85, "structured score was " + structured);
        assertTrue(structured > plain);
    }

    @Test
    @DisplayName("Text far shorter than its page count suggests is penalized")
    void tooShortForPageCount_penalized() {
        String text = prose(200);

        assertTrue(scorer.score(text, 40) < scorer.score(text, 0));
        assertEquals(0.0, scorer.lengthScore(text.length(), 40));
    }

    @Test
    @DisplayName("Scores always stay within [0, 1]")
    void scoresBounded() {
        String dense = "# h\n".repeat(500) + "```\ncode\n```\n".repeat(50) + "|---|---|\n".repeat(50);

        for (int pages : new int[]{0, 1, 5, 100}) {
            double score = scorer.score(dense, pages);
            assertTrue(score >= 0.0 && score <= 1.0, "score " + score + " for " + pages + " pages");
        }
    }

    // =========================================================================
    // Noise
    // =========================================================================

    @Test
    @DisplayName("A binary file decoded by the plain-text backend scores below the default threshold")
    void binaryDecodedAsText_scoresBelowThreshold(@TempDir Path tempDir) throws Exception {
        byte[] bytes = new byte[4000];
        new Random(42).nextBytes(bytes);
        Path file = tempDir.resolve("scan.pdf");
        Files.write(file, bytes);

        String text = new PlainTextBackend().convert(file);
        double score = scorer.score(text, 0);

        assertTrue(text.strip().length() >= QualityScorer.MIN_TEXT_LENGTH);
        assertTrue(score < 0.5, "binary text scored " + score);
        assertTrue(score < scorer.score(prose(text.length()), 0));
    }

    @Test
    @DisplayName("Replacement characters beyond the tolerated share pull the score down proportionally")
    void noisyProse_penalized() {
        StringBuilder noisy = new StringBuilder(prose(1000));
        for (int i = 0; i < noisy.length(); i += 10) {
            noisy.setCharAt(i, '\uFFFD');
        }

        double score = scorer.score(noisy.toString(), 0);

        assertEquals(0.6, scorer.cleanliness(noisy.toString()), 0.01);
        assertTrue(score < 0.5, "noisy prose scored " + score);
    }

    @Test
    @DisplayName("Line breaks and tabs are not noise; replacement and control characters are")
    void noiseShare() {
        assertEquals(0.0, scorer.noiseShare("a\nb\tc\r\n"));
        assertEquals(0.25, scorer.noiseShare("abc\uFFFD"), 1e-9);
        assertEquals(0.5, scorer.noiseShare("a\u0000"), 1e-9);
        assertEquals(1.0, scorer.cleanliness(prose(500)));
    }

    // =========================================================================
    // Components
    // =========================================================================

    @Test
    @DisplayName("Length component is neutral without a page count and full within the ideal band")
    void lengthScore() {
        assertEquals(0.5, scorer.lengthScore(5000, 0));
        assertEquals(1.0, scorer.lengthScore(1250, 1));
        assertEquals(1.0, scorer.lengthScore(10_000, 10));
    }

    @Test
    @DisplayName("Code and table components are neutral when absent and grow with count")
    void codeAndTableScores() {
        assertEquals(0.5, scorer.codeScore("no code here"));
        assertEquals(0.7, scorer.codeScore("```\na\n```\n"), 1e-9);
        assertEquals(0.5, scorer.tableScore("no tables"));
        assertEquals(0.5 + 1.0 / 3.0, scorer.tableScore("| a | b |\n|---|---|\n| 1 | 2 |\n"), 1e-9);
    }
}
