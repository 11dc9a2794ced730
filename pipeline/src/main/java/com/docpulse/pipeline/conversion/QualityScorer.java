package com.docpulse.pipeline.conversion;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic 0.0-1.0 estimate of how useful converted text is.
 *
 * <p>Weighted sum of:
 * <ul>
 *   <li>40% length against the expected length for the page count</li>
 *   <li>30% structural markers (headings, list items) per 1000 chars</li>
 *   <li>15% fenced code blocks</li>
 *   <li>15% markdown table separator rows</li>
 * </ul>
 * The sum is then scaled down by the share of noise characters (U+FFFD,
 * control characters other than line breaks and tabs, private-use and
 * unassigned code points) above {@link #TOLERATED_NOISE_SHARE}, so binary
 * data decoded as text scores near 0.0. Text shorter than
 * {@link #MIN_TEXT_LENGTH} always scores 0.0.</p>
 */
public class QualityScorer {

    public static final int MIN_TEXT_LENGTH = 50;
    static final int EXPECTED_CHARS_PER_PAGE = 1250;
    static final double TOLERATED_NOISE_SHARE = 0.02;
    private static final double NOISE_PENALTY = 5.0;

    private static final double LENGTH_WEIGHT = 0.40;
    private static final double STRUCTURE_WEIGHT = 0.30;
    private static final double CODE_WEIGHT = 0.15;
    private static final double TABLE_WEIGHT = 0.15;

    private static final double NEUTRAL = 0.5;

    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+\\.)\\s", Pattern.MULTILINE);
    private static final Pattern CODE_FENCE = Pattern.compile("^\\s*```", Pattern.MULTILINE);
    private static final Pattern TABLE_SEPARATOR = Pattern.compile(
            "^\\s*\\|?\\s*:?-{3,}:?\\s*(?:\\|\\s*:?-{3,}:?\\s*)+\\|?\\s*$", Pattern.MULTILINE);

    /**
     * @param pageCount page count of the source document, or 0 if unknown
     */
    public double score(String text, int pageCount) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
            return 0.0;
        }
        double total = LENGTH_WEIGHT * lengthScore(text.length(), pageCount)
                + STRUCTURE_WEIGHT * structureScore(text)
                + CODE_WEIGHT * codeScore(text)
                + TABLE_WEIGHT * tableScore(text);
        return Math.max(0.0, Math.min(1.0, total * cleanliness(text)));
    }

    /**
     * 1.0 up to the tolerated noise share, falling linearly to 0.0 at 22% noise.
     */
    double cleanliness(String text) {
        double excess = noiseShare(text) - TOLERATED_NOISE_SHARE;
        if (excess <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - excess * NOISE_PENALTY);
    }

    double noiseShare(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        long noise = text.codePoints().filter(QualityScorer::isNoise).count();
        return (double) noise / text.codePointCount(0, text.length());
    }

    private static boolean isNoise(int codePoint) {
        if (codePoint == '\uFFFD') {
            return true;
        }
        if (Character.isISOControl(codePoint)) {
            return codePoint != '\n' && codePoint != '\r' && codePoint != '\t';
        }
        int type = Character.getType(codePoint);
        return type == Character.PRIVATE_USE || type == Character.UNASSIGNED || type == Character.SURROGATE;
    }

    double lengthScore(int length, int pageCount) {
        if (pageCount <= 0) {
            return NEUTRAL;
        }
        double ratio = (double) length / (pageCount * (double) EXPECTED_CHARS_PER_PAGE);
        if (ratio >= 0.4 && ratio <= 1.6) {
            return 1.0;
        }
        if (ratio < 0.08) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(ratio - 1.0) / 2.0);
    }

    double structureScore(String text) {
        int markers = count(HEADING, text) + count(LIST_ITEM, text);
        double perThousand = markers / Math.max(1.0, text.length() / 1000.0);
        if (perThousand >= 5 && perThousand <= 15) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(perThousand - 10) / 20.0);
    }

    double codeScore(String text) {
        int blocks = count(CODE_FENCE, text) / 2;
        if (blocks == 0) {
            return NEUTRAL;
        }
        return Math.min(1.0, NEUTRAL + blocks / 5.0);
    }

    double tableScore(String text) {
        int tables = count(TABLE_SEPARATOR, text);
        if (tables == 0) {
            return NEUTRAL;
        }
        return Math.min(1.0, NEUTRAL + tables / 3.0);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
