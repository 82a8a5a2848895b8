package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.exception.ExtractionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the model's JSON reply into an {@link ExtractionResult}.
 *
 * <p>Tolerates Markdown code fences and prose around the JSON object. A missing {@code updates}
 * object is treated as empty; confidence is clamped to [0,1] and defaults to 0.
 */
public class ExtractionResponseParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    /**
     * @throws ExtractionException with kind {@code MALFORMED_RESPONSE} if no JSON object can be read
     */
    public ExtractionResult parse(String raw) {
        String json = unwrap(raw);
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                    "Model reply is not a JSON object: " + e.getMessage(), null, e);
        }

        JSONObject updates = root.optJSONObject("updates");
        Map<String, Object> updateMap = updates == null ? Map.of() : updates.toMap();

        String reply = root.optString("reply", "");

        double confidence = root.optDouble("confidence", 0.0);
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        List<String> missing = new ArrayList<>();
        JSONArray missingArray = root.optJSONArray("missingFields");
        if (missingArray != null) {
            for (int i = 0; i < missingArray.length(); i++) {
                String key = missingArray.optString(i, "").trim();
                if (!key.isEmpty()) {
                    missing.add(key);
                }
            }
        }
        return new ExtractionResult(updateMap, reply, confidence, missing);
    }

    static String unwrap(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE, "Model reply is empty");
        }
        String text = raw.trim();
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                    "Model reply contains no JSON object");
        }
        return text.substring(start, end + 1);
    }
}
