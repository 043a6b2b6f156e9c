package com.phillippitts.speechgate.service.stt;

import com.phillippitts.speechgate.domain.AudioChunk;
import com.phillippitts.speechgate.service.audio.PcmFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a long utterance into overlapping recognizer-sized windows.
 *
 * <p>Windows start every {@code step = maxChunkBytes - overlapBytes} bytes and are at most
 * {@code maxChunkBytes} long. The last window is the one that reaches the end of the buffer, so
 * every byte is covered and consecutive windows share exactly {@code overlapBytes}. A buffer of
 * length L &gt; max yields {@code ceil((L - overlap) / step)} windows. All offsets stay aligned
 * to the PCM frame size.
 */
public final class ChunkPlanner {

    private final int maxChunkBytes;
    private final int overlapBytes;

    /**
     * @param maxChunkBytes largest window in bytes
     * @param overlapBytes  bytes shared by consecutive windows; must be smaller than the window
     * @param format        PCM format used to align window boundaries
     */
    public ChunkPlanner(int maxChunkBytes, int overlapBytes, PcmFormat format) {
        int alignedMax = format.alignDown(maxChunkBytes);
        int alignedOverlap = format.alignDown(overlapBytes);
        if (alignedMax <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must hold at least one frame: " + maxChunkBytes);
        }
        if (alignedOverlap < 0 || alignedOverlap >= alignedMax) {
            throw new IllegalArgumentException(
                    "overlapBytes must be in [0, maxChunkBytes): overlap=" + overlapBytes + ", max=" + maxChunkBytes);
        }
        this.maxChunkBytes = alignedMax;
        this.overlapBytes = alignedOverlap;
    }

    /**
     * @return true if a buffer of this length needs more than one recognizer call
     */
    public boolean requiresChunking(int totalBytes) {
        return totalBytes > maxChunkBytes;
    }

    /**
     * Plans the windows for a buffer.
     *
     * @param totalBytes utterance length in bytes
     * @return windows in order; a single window for buffers up to {@code maxChunkBytes}; empty for 0
     */
    public List<AudioChunk> plan(int totalBytes) {
        if (totalBytes < 0) {
            throw new IllegalArgumentException("totalBytes must be >= 0");
        }
        List<AudioChunk> chunks = new ArrayList<>();
        if (totalBytes == 0) {
            return chunks;
        }
        int step = maxChunkBytes - overlapBytes;
        int start = 0;
        int index = 0;
        while (true) {
            int end = Math.min(start + maxChunkBytes, totalBytes);
            int overlap = index == 0 ? 0 : overlapBytes;
            chunks.add(new AudioChunk(index, start, end - start, overlap));
            if (end >= totalBytes) {
                return chunks;
            }
            start += step;
            index++;
        }
    }

    public int maxChunkBytes() {
        return maxChunkBytes;
    }

    public int overlapBytes() {
        return overlapBytes;
    }
}
