package com.phillippitts.speechgate.exception;

/**
 * Thrown when a request names a voice that is neither registered nor built in.
 */
public class VoiceNotFoundException extends SpeechGateException {

    private final String voiceId;

    public VoiceNotFoundException(String voiceId) {
        super("Voice not found: " + voiceId);
        this.voiceId = voiceId;
    }

    public String getVoiceId() {
        return voiceId;
    }
}
