package com.phillippitts.scantomack.service.ocr.bridge;

import com.phillippitts.scantomack.domain.BoundingBox;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.RecognizedWord;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds and interprets bridge protocol frames.
 *
 * <p>Frames are single-line JSON objects:
 * <pre>
 * request:  {"action":"process","image":"&lt;base64&gt;","language":"en"}
 *           {"action":"test"}
 * response: {"success":true,"results":[{"text":"INVOICE","confidence":0.97,
 *                                       "bbox":{"x0":10,"y0":12,"x1":98,"y1":30}}],"text":"INVOICE"}
 *           {"success":false,"error":"CUDA out of memory"}
 * </pre>
 *
 * <p>Confidences above 1 are treated as percentages. Unlike the lenient parsers used for
 * diagnostics, shape violations here are protocol errors, never silently empty results.
 */
final class BridgeMessages {

    static final String ACTION_PROCESS = "process";
    static final String ACTION_TEST = "test";

    private BridgeMessages() {
    }

    static String processRequest(byte[] image, String language) {
        return new JSONObject()
                .put("action", ACTION_PROCESS)
                .put("image", Base64.getEncoder().encodeToString(image))
                .put("language", language)
                .toString();
    }

    static String testRequest() {
        return new JSONObject().put("action", ACTION_TEST).toString();
    }

    /**
     * @return the boolean {@code success} field
     * @throws com.phillippitts.scantomack.exception.BridgeProtocolException if it is missing or not a boolean
     */
    static boolean isSuccess(JSONObject response, EngineId engine) {
        Object success = response.opt("success");
        if (success instanceof Boolean b) {
            return b;
        }
        throw RecognitionExceptionBuilder.create("Bridge response has no boolean 'success' field")
                .engine(engine)
                .metadata("keys", response.keySet())
                .buildProtocolError();
    }

    static String errorText(JSONObject response) {
        String error = response.optString("error", "");
        return error.isBlank() ? "unknown engine error" : error;
    }

    /**
     * Parses the {@code results} array of a successful response.
     *
     * @throws com.phillippitts.scantomack.exception.BridgeProtocolException on any shape violation
     */
    static List<RecognizedWord> parseWords(JSONObject response, EngineId engine) {
        JSONArray results = response.optJSONArray("results");
        if (results == null) {
            throw RecognitionExceptionBuilder.create("Bridge response 'results' is missing or not an array")
                    .engine(engine)
                    .buildProtocolError();
        }
        List<RecognizedWord> words = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            try {
                JSONObject item = results.getJSONObject(i);
                String text = item.getString("text").trim();
                if (text.isEmpty()) {
                    continue;
                }
                JSONObject box = item.getJSONObject("bbox");
                BoundingBox bbox = new BoundingBox(
                        box.getInt("x0"), box.getInt("y0"), box.getInt("x1"), box.getInt("y1"));
                words.add(RecognizedWord.of(text, normalizeConfidence(item.getDouble("confidence")), bbox));
            } catch (JSONException e) {
                throw RecognitionExceptionBuilder.create("Malformed result entry in bridge response")
                        .engine(engine)
                        .cause(e)
                        .metadata("index", i)
                        .buildProtocolError();
            }
        }
        return words;
    }

    static double normalizeConfidence(double raw) {
        if (Double.isNaN(raw) || raw <= 0.0) {
            return 0.0;
        }
        double scaled = raw > 1.0 ? raw / 100.0 : raw;
        return Math.min(1.0, scaled);
    }
}
