package com.phillippitts.speechgate.presentation.websocket;

import com.phillippitts.speechgate.domain.SynthesisResult;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;
import java.util.List;

/**
 * JSON frames of the recognition and synthesis protocols.
 */
final class ProtocolMessages {

    private ProtocolMessages() {}

    /**
     * Parses a client text frame.
     *
     * @throws InvalidRequestException if the payload is not a JSON object
     */
    static JSONObject parse(String payload) {
        try {
            return new JSONObject(payload);
        } catch (JSONException e) {
            throw new InvalidRequestException(null, "Invalid JSON", e);
        }
    }

    static String ready() {
        return new JSONObject().put("type", "ready").toString();
    }

    static String finalTranscript(String text) {
        return new JSONObject().put("text", text).put("is_final", true).toString();
    }

    static String error(String message) {
        return new JSONObject().put("error", message == null ? "Unknown error" : message).toString();
    }

    static String unknownAction(String action, List<String> supported) {
        return new JSONObject()
                .put("error", "Unknown action: " + action)
                .put("supported_actions", new JSONArray(supported))
                .toString();
    }

    static String audio(SynthesisResult result) {
        return new JSONObject()
                .put("success", true)
                .put("audio", Base64.getEncoder().encodeToString(result.audio()))
                .put("format", "wav")
                .put("voice_id", result.voiceId())
                .toString();
    }

    static String registered(VoiceIdentity voice) {
        return new JSONObject()
                .put("success", true)
                .put("voice_id", voice.id())
                .put("message", "Voice registered")
                .toString();
    }

    static String voices(List<VoiceIdentity> voices) {
        JSONArray list = new JSONArray();
        for (VoiceIdentity v : voices) {
            list.put(new JSONObject()
                    .put("id", v.id())
                    .put("name", v.displayName())
                    .put("builtin", v.isBuiltin()));
        }
        return new JSONObject().put("success", true).put("voices", list).toString();
    }

    static String status(boolean modelReady, boolean hasModel) {
        return new JSONObject()
                .put("success", true)
                .put("model_ready", modelReady)
                .put("has_model", hasModel)
                .toString();
    }
}
