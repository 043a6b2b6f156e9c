package com.phillippitts.speechgate.service.inference.process;

import com.phillippitts.speechgate.config.properties.InferenceProperties;
import com.phillippitts.speechgate.config.properties.RecognitionProperties;
import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InferenceException;
import com.phillippitts.speechgate.service.audio.PcmFormat;
import com.phillippitts.speechgate.service.audio.WavWriter;
import com.phillippitts.speechgate.service.inference.InferenceModel;
import com.phillippitts.speechgate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link InferenceModel} that delegates to external recognizer and synthesizer programs.
 *
 * <p><b>Recognition:</b> PCM is wrapped into a temporary WAV file ({@link WavWriter}), the
 * recognizer command runs with {@code {input}} pointing at it, and stdout is parsed as text or
 * JSON. The WAV file is deleted afterwards.
 *
 * <p><b>Synthesis:</b> the synthesizer command runs with the text, voice and options filled in
 * and must write a WAV file to {@code {output}}.
 *
 * <p>Not reentrant. {@link com.phillippitts.speechgate.service.inference.ModelAccessCoordinator}
 * guarantees one call at a time.
 *
 * <p><b>Privacy:</b> never logs transcript or synthesis text at INFO.
 */
@Component
public class CommandLineInferenceModel implements InferenceModel {

    private static final Logger LOG = LogManager.getLogger(CommandLineInferenceModel.class);

    private final CommandTemplate recognizerCommand;
    private final CommandTemplate synthesizerCommand;
    private final InferenceProperties.OutputFormat outputFormat;
    private final PcmFormat pcmFormat;
    private final InferenceProcessRunner runner;

    @Autowired
    public CommandLineInferenceModel(InferenceProperties inference, RecognitionProperties recognition) {
        this(inference, recognition.toPcmFormat(), new DefaultProcessFactory());
    }

    CommandLineInferenceModel(InferenceProperties inference, PcmFormat pcmFormat, ProcessFactory processFactory) {
        Objects.requireNonNull(inference, "inference");
        this.recognizerCommand = new CommandTemplate(inference.getRecognizer().getCommand());
        this.synthesizerCommand = new CommandTemplate(inference.getSynthesizer().getCommand());
        this.outputFormat = inference.getRecognizer().getOutputFormat();
        this.pcmFormat = Objects.requireNonNull(pcmFormat, "pcmFormat");
        String wd = inference.getWorkingDirectory();
        Path workingDir = wd == null || wd.isBlank() ? null : Path.of(wd);
        this.runner = new InferenceProcessRunner(processFactory, workingDir, inference.getMaxStdoutBytes());
        if (recognizerCommand.isEmpty() || synthesizerCommand.isEmpty()) {
            LOG.warn("Inference runtime not fully configured (recognizer={}, synthesizer={})",
                    !recognizerCommand.isEmpty(), !synthesizerCommand.isEmpty());
        }
    }

    @Override
    public String recognize(byte[] pcm) {
        requireConfigured(recognizerCommand, "recognize");
        long start = System.nanoTime();
        Path wav = null;
        try {
            wav = Files.createTempFile("speechgate-stt-", ".wav");
            WavWriter.write(pcm, pcmFormat, wav);
            String stdout = runner.run(recognizerCommand.render(Map.of("input", wav.toAbsolutePath().toString())),
                    "recognize");
            String text = RecognizerOutputParser.parse(stdout, outputFormat);
            LOG.debug("Recognized {} bytes in {} ms, chars={}", pcm.length, TimeUtils.elapsedMillis(start),
                    text.length());
            return text;
        } catch (IOException | IllegalStateException e) {
            throw new InferenceException("Cannot prepare recognizer input: " + e.getMessage(), "recognize", e);
        } catch (JSONException e) {
            throw new InferenceException("Recognizer output is not valid JSON", "recognize", e);
        } finally {
            deleteQuietly(wav);
        }
    }

    @Override
    public void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output) {
        requireConfigured(synthesizerCommand, "synthesize");
        Map<String, String> values = new HashMap<>();
        values.put("text", text);
        values.put("voice", voice.id());
        values.put("voice_name", voice.engineVoice() != null ? voice.engineVoice() : "");
        values.put("voice_sample", voice.samplePath() != null ? voice.samplePath().toAbsolutePath().toString() : "");
        values.put("output", output.toAbsolutePath().toString());
        values.put("emo_alpha", String.format(Locale.ROOT, "%.2f", options.emoAlpha()));
        values.put("use_emo_text", String.valueOf(options.useEmoText()));
        long start = System.nanoTime();
        runner.run(synthesizerCommand.render(values), "synthesize");
        LOG.debug("Synthesized {} chars with voice {} in {} ms", text.length(), voice.id(),
                TimeUtils.elapsedMillis(start));
    }

    @Override
    public boolean isConfigured() {
        return !recognizerCommand.isEmpty() && !synthesizerCommand.isEmpty();
    }

    @Override
    public boolean isReady() {
        return isConfigured()
                && recognizerCommand.isExecutableResolvable()
                && synthesizerCommand.isExecutableResolvable();
    }

    private static void requireConfigured(CommandTemplate command, String operation) {
        if (command.isEmpty()) {
            throw new InferenceException("No " + operation + " command configured", operation);
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
}
