package com.phillippitts.speechgate.service.tts;

import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import com.phillippitts.speechgate.exception.SpeechGateException;
import com.phillippitts.speechgate.exception.VoiceNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Built-in and registered (cloned) voices.
 *
 * <p>A registered voice is stored as {@code <dir>/<id>.wav} (reference sample) plus
 * {@code <dir>/<id>.json} (metadata: id, name, sample_path, registered_at). Registrations found
 * on disk are loaded at startup. Registering an existing id replaces its sample and name.
 *
 * <p>{@code clone_and_speak} samples are stored as {@code <dir>/<id>.wav} without metadata: such
 * a voice can be synthesized with but is not listed, and is never pre-warmed.
 */
@Component
public class VoiceRegistry {

    private static final Logger LOG = LogManager.getLogger(VoiceRegistry.class);

    static final Pattern VOICE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path directory;
    private final int maxSampleBytes;
    private final Map<String, VoiceIdentity> builtin;
    private final Map<String, VoiceIdentity> registered = new ConcurrentHashMap<>();
    private Instant lastRegistration = Instant.EPOCH;

    public VoiceRegistry(SynthesisProperties props) {
        SynthesisProperties.VoiceProperties voices = props.getVoices();
        this.directory = Path.of(voices.getDirectory());
        this.maxSampleBytes = voices.getMaxSampleBytes();
        Map<String, VoiceIdentity> builtins = new LinkedHashMap<>();
        voices.getBuiltin().forEach((id, engineVoice) -> builtins.put(id, VoiceIdentity.builtin(id, engineVoice)));
        this.builtin = Map.copyOf(builtins);
        loadRegistered();
    }

    /**
     * Decodes a base64 voice sample and enforces the size limit.
     *
     * @throws InvalidRequestException if the sample is blank, not base64 or too large
     */
    public byte[] decodeSample(String base64) {
        if (base64 == null || base64.isBlank()) {
            throw new InvalidRequestException("voice_sample", "Voice sample must not be empty");
        }
        String payload = base64.trim();
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        byte[] sample;
        try {
            sample = Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("voice_sample", "Voice sample is not valid base64", e);
        }
        if (sample.length == 0) {
            throw new InvalidRequestException("voice_sample", "Voice sample must not be empty");
        }
        if (sample.length > maxSampleBytes) {
            throw new InvalidRequestException("voice_sample",
                    "Voice sample exceeds " + maxSampleBytes + " bytes: " + sample.length);
        }
        return sample;
    }

    /**
     * Persists a named voice and makes it the most recently registered one.
     */
    public synchronized VoiceIdentity register(String voiceId, String displayName, byte[] sample) {
        requireValidId(voiceId);
        Path samplePath = writeSample(voiceId, sample);
        String name = displayName == null || displayName.isBlank() ? voiceId : displayName.trim();
        VoiceIdentity voice = VoiceIdentity.registered(voiceId, name, samplePath, nextRegistrationTime());
        writeMetadata(voice);
        registered.put(voiceId, voice);
        LOG.info("Registered voice '{}' ({} bytes sample)", voiceId, sample.length);
        return voice;
    }

    /**
     * Stores a sample for an ad hoc clone without registering (listing) the voice.
     */
    public synchronized VoiceIdentity storeSample(String voiceId, byte[] sample) {
        requireValidId(voiceId);
        Path samplePath = writeSample(voiceId, sample);
        VoiceIdentity existing = registered.get(voiceId);
        if (existing != null) {
            // Sample of a registered voice replaced: bump its registration time so cached audio is not reused.
            VoiceIdentity updated = VoiceIdentity.registered(voiceId, existing.displayName(), samplePath,
                    nextRegistrationTime());
            writeMetadata(updated);
            registered.put(voiceId, updated);
            return updated;
        }
        return sampleOnlyVoice(voiceId, samplePath);
    }

    /**
     * Copies {@code sample} to a private temporary file for one synthesis call.
     *
     * <p>The shared {@code <id>.wav} may be replaced by a concurrent request while this call waits
     * for the model; the copy pins the sample whose digest keys the cached audio. Callers release
     * it with {@link #discardSnapshot(Path)}.
     */
    public Path snapshotSample(String voiceId, byte[] sample) {
        Objects.requireNonNull(sample, "sample");
        Path snapshot = null;
        try {
            snapshot = Files.createTempFile("speechgate-sample-" + voiceId + "-", ".wav");
            Files.write(snapshot, sample);
            return snapshot;
        } catch (IOException e) {
            deleteQuietly(snapshot);
            throw new SpeechGateException("Failed to stage voice sample for '" + voiceId + "'", e);
        }
    }

    public void discardSnapshot(Path snapshot) {
        deleteQuietly(snapshot);
    }

    /**
     * Resolves a voice id: registered voices first, then built-in ones, then bare stored samples.
     *
     * @throws VoiceNotFoundException if the id is unknown
     */
    public VoiceIdentity resolve(String voiceId) {
        if (voiceId == null || voiceId.isBlank()) {
            throw new InvalidRequestException("voice_id", "Voice id must not be empty");
        }
        VoiceIdentity voice = registered.get(voiceId);
        if (voice != null) {
            return voice;
        }
        voice = builtin.get(voiceId);
        if (voice != null) {
            return voice;
        }
        if (VOICE_ID.matcher(voiceId).matches()) {
            Path sample = directory.resolve(voiceId + ".wav");
            if (Files.isRegularFile(sample)) {
                return sampleOnlyVoice(voiceId, sample);
            }
        }
        throw new VoiceNotFoundException(voiceId);
    }

    /**
     * @return registered voices, most recently registered first
     */
    public List<VoiceIdentity> registeredNewestFirst() {
        List<VoiceIdentity> voices = new ArrayList<>(registered.values());
        voices.sort(Comparator.comparing(VoiceIdentity::registeredAt).reversed()
                .thenComparing(VoiceIdentity::id));
        return voices;
    }

    public List<VoiceIdentity> builtinVoices() {
        return List.copyOf(builtin.values());
    }

    /**
     * @return registered voices (newest first) followed by built-in voices
     */
    public List<VoiceIdentity> listAll() {
        List<VoiceIdentity> all = new ArrayList<>(registeredNewestFirst());
        builtin.values().stream()
                .filter(v -> !registered.containsKey(v.id()))
                .forEach(all::add);
        return all;
    }

    public Path directory() {
        return directory;
    }

    private static void requireValidId(String voiceId) {
        if (voiceId == null || !VOICE_ID.matcher(voiceId).matches()) {
            throw new InvalidRequestException("voice_id",
                    "Voice id must be 1-64 characters of letters, digits, '_' or '-': " + voiceId);
        }
    }

    // The sample's modification time stands in for a registration time so a replaced sample gets a new cache key.
    private static VoiceIdentity sampleOnlyVoice(String voiceId, Path sample) {
        Instant stamp;
        try {
            stamp = Files.getLastModifiedTime(sample).toInstant();
        } catch (IOException e) {
            stamp = null;
        }
        return VoiceIdentity.registered(voiceId, voiceId, sample, stamp);
    }

    private Instant nextRegistrationTime() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        if (!now.isAfter(lastRegistration)) {
            now = lastRegistration.plusMillis(1);
        }
        lastRegistration = now;
        return now;
    }

    private Path writeSample(String voiceId, byte[] sample) {
        Objects.requireNonNull(sample, "sample");
        Path target = directory.resolve(voiceId + ".wav");
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, voiceId + "-", ".tmp");
            Files.write(tmp, sample);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new SpeechGateException("Failed to store voice sample for '" + voiceId + "'", e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }

    private void writeMetadata(VoiceIdentity voice) {
        JSONObject meta = new JSONObject()
                .put("id", voice.id())
                .put("name", voice.displayName())
                .put("sample_path", voice.samplePath().toString())
                .put("registered_at", voice.registeredAt().toString());
        try {
            Files.writeString(directory.resolve(voice.id() + ".json"), meta.toString(2), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpeechGateException("Failed to store voice metadata for '" + voice.id() + "'", e);
        }
    }

    private void loadRegistered() {
        if (!Files.isDirectory(directory)) {
            LOG.info("Voice directory {} does not exist yet; no registered voices", directory.toAbsolutePath());
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                loadMetadata(file);
            }
        } catch (IOException e) {
            LOG.warn("Cannot read voice directory {}: {}", directory, e.getMessage());
        }
        registered.values().stream()
                .map(VoiceIdentity::registeredAt)
                .max(Comparator.naturalOrder())
                .ifPresent(latest -> lastRegistration = latest);
        LOG.info("Loaded {} registered voice(s) from {}", registered.size(), directory.toAbsolutePath());
    }

    private void loadMetadata(Path file) {
        try {
            JSONObject meta = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            String id = meta.getString("id");
            Path sample = directory.resolve(id + ".wav");
            if (!VOICE_ID.matcher(id).matches() || !Files.isRegularFile(sample)) {
                LOG.warn("Ignoring voice metadata {}: invalid id or missing sample", file.getFileName());
                return;
            }
            Instant registeredAt = meta.has("registered_at")
                    ? Instant.parse(meta.getString("registered_at"))
                    : Files.getLastModifiedTime(file).toInstant();
            registered.put(id, VoiceIdentity.registered(id, meta.optString("name", id), sample, registeredAt));
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.warn("Ignoring unreadable voice metadata {}: {}", file.getFileName(), e.getMessage());
        }
    }
}
