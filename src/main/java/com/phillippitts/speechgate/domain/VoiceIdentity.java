package com.phillippitts.speechgate.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A voice the synthesizer can speak with.
 *
 * <p>Built-in voices map to a named engine voice and have no sample. Registered voices are
 * cloned from a stored reference sample.
 *
 * @param id           stable identifier used by clients
 * @param displayName  human-readable name
 * @param engineVoice  engine voice name for built-in voices, null for registered ones
 * @param samplePath   reference sample for registered voices, null for built-in ones
 * @param registeredAt registration time for registered voices, null for built-in ones
 */
public record VoiceIdentity(String id, String displayName, String engineVoice, Path samplePath,
                            Instant registeredAt) {

    public VoiceIdentity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        if ((engineVoice == null) == (samplePath == null)) {
            throw new IllegalArgumentException(
                    "Exactly one of engineVoice or samplePath must be set for voice " + id);
        }
    }

    public static VoiceIdentity builtin(String id, String engineVoice) {
        return new VoiceIdentity(id, id, engineVoice, null, null);
    }

    public static VoiceIdentity registered(String id, String displayName, Path samplePath, Instant registeredAt) {
        return new VoiceIdentity(id, displayName, null, samplePath, registeredAt);
    }

    public boolean isBuiltin() {
        return samplePath == null;
    }

    /**
     * Voice part of the synthesis cache key. Registered voices include their registration time so
     * that re-registering an id with a new sample never serves audio of the old sample.
     */
    public String cacheKey() {
        if (isBuiltin()) {
            return "builtin:" + id;
        }
        return registeredAt == null ? id : id + "@" + registeredAt.toEpochMilli();
    }
}
