package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.exception.MalformedReviewException;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentAction;
import com.eainde.diagnosis.model.TreatmentPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Turns the reviewer's raw text into typed results.
 *
 * <p>Gemini is asked for bare JSON but still wraps it in markdown fences or prose
 * now and then, and older prompt versions used different field names. Everything
 * tolerable is coerced here so the rest of the pipeline only sees clean records.
 * Anything that cannot be coerced raises {@link MalformedReviewException}.</p>
 */
@Log4j2
public class ReviewerResponseParser {

    /** Plan categories, in the order they are presented to the clinician. */
    public static final List<String> PLAN_CATEGORIES = List.of(
            "immediate_interventions",
            "medications",
            "monitoring",
            "follow_up",
            "patient_education");

    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    public ReviewerOpinion parseOpinion(String raw) {
        JsonNode root = readObject(raw);

        String diagnosis = text(root, "diagnosis", "gemini_diagnosis");
        if (diagnosis.isBlank()) {
            throw new MalformedReviewException("Reviewer response has no diagnosis");
        }

        return new ReviewerOpinion(
                diagnosis,
                text(root, "validation_verdict", "ml_validation"),
                certainty(field(root, "certainty", "confidence")),
                text(root, "clinical_reasoning", "reasoning"),
                list(field(root, "differentials", "differential_diagnoses")),
                list(field(root, "red_flags")),
                bool(field(root, "needs_override")),
                text(root, "override_reason"),
                false);
    }

    /**
     * Flattens the category arrays into ordered actions. An object with none of
     * the known categories yields an empty plan, not an error.
     */
    public TreatmentPlan parsePlan(String raw) {
        JsonNode root = readObject(raw);
        List<TreatmentAction> actions = new ArrayList<>();
        for (String category : PLAN_CATEGORIES) {
            for (String action : list(root.get(category))) {
                actions.add(new TreatmentAction(category, action));
            }
        }
        return new TreatmentPlan(TreatmentPlan.REVIEWER_ORIGIN, actions);
    }

    // =========================================================================
    //  Extraction
    // =========================================================================

    JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedReviewException("Reviewer returned an empty response");
        }
        String json = extractObject(stripFences(raw));
        try {
            JsonNode node = lenientMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new MalformedReviewException("Reviewer response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedReviewException("Reviewer response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? text.substring(3) : text.substring(firstNewline + 1);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }

    static String extractObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedReviewException("No JSON object found in reviewer response");
        }
        return text.substring(start, end + 1);
    }

    // =========================================================================
    //  Coercion
    // =========================================================================

    private static JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String... names) {
        JsonNode node = field(root, names);
        return node == null || node.isContainerNode() ? "" : node.asText().trim();
    }

    /**
     * Accepts 0.85, 85, "85%", "0.85". Missing or unreadable certainty is 0.0 so it
     * can never tip an override.
     */
    static double certainty(JsonNode node) {
        if (node == null) {
            return 0.0;
        }
        double value;
        boolean percent = false;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.endsWith("%")) {
                percent = true;
                text = text.substring(0, text.length() - 1).trim();
            }
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                log.warn("Unreadable reviewer certainty '{}', using 0.0", node.asText());
                return 0.0;
            }
        } else {
            return 0.0;
        }
        if (Double.isNaN(value)) {
            return 0.0;
        }
        if (percent || value > 1.0) {
            value = value / 100.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    static boolean bool(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String text = node.asText().trim().toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("yes");
    }

    /**
     * Array of strings, array of objects (first textual value, preferring a
     * "diagnosis" or "name" field), or one comma-separated string.
     */
    static List<String> list(JsonNode node) {
        List<String> items = new ArrayList<>();
        if (node == null || node.isNull()) {
            return items;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String item = element.isObject() ? objectLabel(element) : element.asText();
                if (item != null && !item.isBlank()) {
                    items.add(item.trim());
                }
            }
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
        }
        return items;
    }

    private static String objectLabel(JsonNode object) {
        JsonNode preferred = field(object, "diagnosis", "name", "condition");
        if (preferred != null && preferred.isValueNode()) {
            return preferred.asText();
        }
        Iterator<JsonNode> values = object.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }
}
