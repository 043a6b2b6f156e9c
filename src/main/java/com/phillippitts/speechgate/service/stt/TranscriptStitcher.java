package com.phillippitts.speechgate.service.stt;

import com.phillippitts.speechgate.domain.TranscriptFragment;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Joins per-chunk recognizer output into one transcript and cleans up the seams.
 *
 * <p>Overlapping windows make the recognizer repeat sentence enders at chunk borders, and the
 * join introduces spaces in front of punctuation. {@link #normalize(String)} removes both and
 * is idempotent.
 */
public final class TranscriptStitcher {

    // "." is left out so that ellipses survive.
    private static final Pattern REPEATED_TERMINATOR = Pattern.compile("([。！？!?])(?:\\s*\\1)+");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([，。！？、,.!?;:；：])");

    private TranscriptStitcher() {}

    /**
     * Joins non-blank fragments in chunk order with single spaces and normalizes the result.
     *
     * @param fragments recognizer output per chunk, in chunk order
     * @return stitched text, empty if no fragment had content
     */
    public static String stitch(List<TranscriptFragment> fragments) {
        String joined = fragments.stream()
                .map(TranscriptFragment::text)
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
        return normalize(joined);
    }

    /**
     * Collapses repeated sentence terminators, squeezes whitespace and removes spaces in front of
     * punctuation.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = REPEATED_TERMINATOR.matcher(text).replaceAll("$1");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ").trim();
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        return result;
    }
}
