package com.phillippitts.speechgate.service.inference.process;

import com.phillippitts.speechgate.config.properties.InferenceProperties.OutputFormat;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Turns recognizer stdout into plain text.
 *
 * <p>TEXT: all lines joined with single spaces. JSON: the top-level {@code text} field, or the
 * {@code text} of each {@code segments[]} entry joined with spaces.
 */
final class RecognizerOutputParser {

    private RecognizerOutputParser() {}

    /**
     * @throws JSONException if JSON output is expected and stdout is not a JSON object
     */
    static String parse(String stdout, OutputFormat format) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        if (format == OutputFormat.JSON) {
            return fromJson(new JSONObject(stdout.trim()));
        }
        return String.join(" ", stdout.trim().split("\\s*\\R\\s*")).trim();
    }

    private static String fromJson(JSONObject obj) {
        if (obj.has("text")) {
            return obj.optString("text", "").trim();
        }
        JSONArray segments = obj.optJSONArray("segments");
        if (segments == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length(); i++) {
            JSONObject seg = segments.optJSONObject(i);
            String t = seg == null ? "" : seg.optString("text", "").trim();
            if (!t.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(t);
            }
        }
        return sb.toString();
    }
}
