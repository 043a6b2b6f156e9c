package com.phillippitts.speechgate.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Per-connection audio accumulator for one start/stop utterance cycle.
 *
 * <p>Lifecycle: {@code listening} is false until the client sends start. Binary frames are
 * appended only while listening; frames received outside a session are dropped. Stop hands the
 * accumulated bytes over and empties the buffer. A frame that would grow the utterance past
 * {@code maxBytes} is dropped and counted; the utterance keeps what was buffered so far.
 *
 * <p>Not thread-safe. The WebSocket container delivers the messages of one connection
 * sequentially, and each connection owns its own instance.
 */
public final class AudioIngestBuffer {

    private static final Logger LOG = LogManager.getLogger(AudioIngestBuffer.class);

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final int maxBytes;
    private boolean listening;
    private boolean full;
    private long droppedFrames;
    private long overflowFrames;

    public AudioIngestBuffer() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxBytes largest utterance kept in memory
     */
    public AudioIngestBuffer(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Starts a new utterance, discarding anything left from a previous one.
     */
    public void onStart() {
        if (buffer.size() > 0) {
            LOG.debug("Discarding {} bytes left over from previous utterance", buffer.size());
        }
        buffer.reset();
        full = false;
        listening = true;
    }

    /**
     * Appends a binary audio frame when listening.
     *
     * @param frame raw PCM bytes
     * @return true if appended, false if dropped because no utterance is active or the utterance
     *         is full
     */
    public boolean onAudioFrame(byte[] frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        if (!listening) {
            droppedFrames++;
            LOG.debug("Dropping {}-byte audio frame received outside an utterance", frame.length);
            return false;
        }
        if ((long) buffer.size() + frame.length > maxBytes) {
            if (!full) {
                full = true;
                LOG.warn("Utterance reached its {}-byte limit; dropping further audio until stop", maxBytes);
            }
            overflowFrames++;
            LOG.debug("Dropping {}-byte audio frame, utterance full", frame.length);
            return false;
        }
        buffer.write(frame, 0, frame.length);
        return true;
    }

    /**
     * Ends the utterance and returns everything buffered since start.
     *
     * @return copy of the buffered audio (possibly empty); the buffer is cleared afterwards
     */
    public byte[] onStop() {
        listening = false;
        full = false;
        byte[] audio = buffer.toByteArray();
        buffer.reset();
        return audio;
    }

    /**
     * @return true while an utterance is active and has audio that was never finalized
     */
    public boolean hasPendingAudio() {
        return listening && buffer.size() > 0;
    }

    public boolean isListening() {
        return listening;
    }

    public int size() {
        return buffer.size();
    }

    public long droppedFrames() {
        return droppedFrames;
    }

    /**
     * @return frames dropped because the utterance had reached its size limit
     */
    public long overflowFrames() {
        return overflowFrames;
    }
}
