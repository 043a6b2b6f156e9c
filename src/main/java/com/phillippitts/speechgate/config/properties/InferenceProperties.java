package com.phillippitts.speechgate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Command lines of the external recognition and synthesis runtimes.
 *
 * <p>Each command is a list of arguments with {@code {placeholder}} tokens that are filled in
 * per call. Example application.properties:
 * <pre>
 * inference.recognizer.command=python3,scripts/recognize.py,--input,{input}
 * inference.recognizer.output-format=json
 * inference.synthesizer.command=python3,scripts/synthesize.py,--text,{text},--speaker,{voice_sample},--out,{output}
 * </pre>
 *
 * <p>Recognizer placeholders: {@code {input}} (WAV file). Synthesizer placeholders:
 * {@code {text}}, {@code {voice}}, {@code {voice_name}}, {@code {voice_sample}}, {@code {output}},
 * {@code {emo_alpha}}, {@code {use_emo_text}}.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public class InferenceProperties {

    private RecognizerProperties recognizer = new RecognizerProperties();
    private SynthesizerProperties synthesizer = new SynthesizerProperties();

    /** Working directory for both runtimes; blank means the application working directory. */
    private String workingDirectory = "";

    /** Cap on captured stdout per call. */
    @Positive(message = "Max stdout bytes must be positive")
    private int maxStdoutBytes = 1_048_576;

    public RecognizerProperties getRecognizer() {
        return recognizer;
    }

    public void setRecognizer(RecognizerProperties recognizer) {
        this.recognizer = recognizer;
    }

    public SynthesizerProperties getSynthesizer() {
        return synthesizer;
    }

    public void setSynthesizer(SynthesizerProperties synthesizer) {
        this.synthesizer = synthesizer;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Recognition runtime. Output is either plain text or a JSON object with a {@code text} field.
     */
    public static class RecognizerProperties {
        private List<String> command = new ArrayList<>();
        private OutputFormat outputFormat = OutputFormat.TEXT;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public OutputFormat getOutputFormat() {
            return outputFormat;
        }

        public void setOutputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
        }
    }

    /**
     * Synthesis runtime. Must write a WAV file to the {@code {output}} path.
     */
    public static class SynthesizerProperties {
        private List<String> command = new ArrayList<>();

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }
    }

    public enum OutputFormat {
        TEXT,
        JSON
    }
}
