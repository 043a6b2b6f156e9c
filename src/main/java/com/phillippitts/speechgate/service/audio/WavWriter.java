package com.phillippitts.speechgate.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes canonical 44-byte-header PCM WAV files.
 */
public final class WavWriter {

    public static final int HEADER_SIZE = 44;

    private WavWriter() {}

    /**
     * Writes a WAV file wrapping the given raw PCM payload.
     *
     * @param pcm     raw little-endian PCM in {@code format}
     * @param format  PCM format of the payload
     * @param wavPath output file (created or overwritten)
     */
    public static void write(byte[] pcm, PcmFormat format, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(header(pcm.length, format));
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the RIFF/WAVE header for a payload of {@code dataSize} bytes.
     */
    static byte[] header(int dataSize, PcmFormat format) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[] { 'R', 'I', 'F', 'F' });
        buf.putInt(36 + dataSize);
        buf.put(new byte[] { 'W', 'A', 'V', 'E' });
        buf.put(new byte[] { 'f', 'm', 't', ' ' });
        buf.putInt(16);                              // fmt chunk size for PCM
        buf.putShort((short) 1);                     // PCM
        buf.putShort((short) format.channels());
        buf.putInt(format.sampleRate());
        buf.putInt(format.byteRate());
        buf.putShort((short) format.blockAlign());
        buf.putShort((short) format.bitsPerSample());
        buf.put(new byte[] { 'd', 'a', 't', 'a' });
        buf.putInt(dataSize);
        return buf.array();
    }
}
