package com.phillippitts.speechgate.service.tts.prewarm;

/**
 * Outcome counts of one pre-warm run.
 *
 * @param synthesized pairs synthesized and stored
 * @param cached      pairs already in the cache
 * @param skipped     pairs skipped because foreground demand persisted
 * @param failed      pairs whose synthesis failed
 */
public record PrewarmReport(int synthesized, int cached, int skipped, int failed) {

    public static final PrewarmReport EMPTY = new PrewarmReport(0, 0, 0, 0);

    public int attempted() {
        return synthesized + cached + skipped + failed;
    }
}
