package com.phillippitts.peervoice.service.stt.whisper;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses whisper.cpp stdout into text and an approximate confidence.
 *
 * <p>JSON output ({@code -oj}) carries a {@code transcription} array of segments, each with
 * {@code text} and optionally {@code tokens[].p} probabilities; older builds emit a top-level
 * {@code text} or {@code segments}. Malformed input falls back to empty text.
 */
final class WhisperOutputParser {

    /** Confidence reported when the output carries no token probabilities. */
    static final double DEFAULT_CONFIDENCE = 0.9;

    private WhisperOutputParser() {}

    record Parsed(String text, double confidence) {}

    /**
     * Plain text mode: whisper prints one line per segment, optionally prefixed by timestamps.
     */
    static Parsed parseText(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return new Parsed("", 0.0);
        }
        StringBuilder sb = new StringBuilder();
        for (String line : stdout.split("\\R")) {
            String cleaned = line.replaceFirst("^\\[[^]]*]\\s*", "").trim();
            if (cleaned.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(cleaned);
        }
        String text = sb.toString();
        return new Parsed(text, text.isEmpty() ? 0.0 : DEFAULT_CONFIDENCE);
    }

    static Parsed parseJson(String json) {
        if (json == null || json.isBlank()) {
            return new Parsed("", 0.0);
        }
        try {
            JSONObject obj = new JSONObject(json);
            JSONArray segments = obj.optJSONArray("transcription");
            if (segments == null) {
                segments = obj.optJSONArray("segments");
            }
            if (segments == null) {
                String text = obj.optString("text", "").trim();
                return new Parsed(text, text.isEmpty() ? 0.0 : DEFAULT_CONFIDENCE);
            }
            StringBuilder sb = new StringBuilder();
            double probabilitySum = 0.0;
            int tokenCount = 0;
            for (int i = 0; i < segments.length(); i++) {
                JSONObject seg = segments.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                String t = seg.optString("text", "").trim();
                if (!t.isEmpty()) {
                    if (sb.length() > 0) {
                        sb.append(' ');
                    }
                    sb.append(t);
                }
                JSONArray tokens = seg.optJSONArray("tokens");
                if (tokens == null) {
                    continue;
                }
                for (int k = 0; k < tokens.length(); k++) {
                    JSONObject token = tokens.optJSONObject(k);
                    if (token != null && token.has("p")) {
                        probabilitySum += token.optDouble("p", 0.0);
                        tokenCount++;
                    }
                }
            }
            String text = sb.toString();
            if (text.isEmpty()) {
                return new Parsed("", 0.0);
            }
            double confidence = tokenCount == 0 ? DEFAULT_CONFIDENCE : probabilitySum / tokenCount;
            return new Parsed(text, Math.max(0.0, Math.min(1.0, confidence)));
        } catch (JSONException e) {
            return new Parsed("", 0.0);
        }
    }
}
