package com.social.automation.integration;

import com.social.automation.model.DeleteDecision;
import com.social.automation.model.QueuedItem;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Criteria-driven keyword scorer. Recognised criteria:
 * <ul>
 *   <li>{@code keywords}: terms indicating the item should go</li>
 *   <li>{@code threshold}: minimum confidence to recommend deletion (default 0.5)</li>
 *   <li>{@code legitimate_keywords}: terms that mark the item as legitimate and veto deletion</li>
 * </ul>
 */
public class KeywordSafetyModerator implements SafetyModerator {

    static final double DEFAULT_THRESHOLD = 0.5;

    @Override
    public DeleteDecision evaluateDeleteCriteria(QueuedItem item, Map<String, Object> criteria) {
        String text = item.getText() != null ? item.getText().toLowerCase(Locale.ROOT) : "";
        List<String> keywords = stringList(criteria.get("keywords"));
        List<String> legitimateKeywords = stringList(criteria.get("legitimate_keywords"));
        double threshold = criteria.get("threshold") instanceof Number n ? n.doubleValue() : DEFAULT_THRESHOLD;

        long matches = keywords.stream().filter(text::contains).count();
        double confidence = matches == 0 ? 0.0 : Math.min(1.0, 0.5 + 0.25 * (matches - 1));
        String legitimateHit = legitimateKeywords.stream().filter(text::contains).findFirst().orElse(null);
        boolean legitimate = legitimateHit != null;

        String reason;
        if (legitimate) {
            reason = "legitimate keyword '" + legitimateHit + "'";
        } else if (matches == 0) {
            reason = "no delete keywords matched";
        } else if (confidence < threshold) {
            reason = "confidence below threshold";
        } else {
            reason = matches + " delete keyword(s) matched";
        }

        return DeleteDecision.builder()
                .recommendedDelete(!legitimate && matches > 0 && confidence >= threshold)
                .confidence(confidence)
                .threshold(threshold)
                .legitimate(legitimate)
                .reason(reason)
                .build();
    }

    private List<String> stringList(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(v -> v != null && !v.toString().isBlank())
                    .map(v -> v.toString().toLowerCase(Locale.ROOT))
                    .toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s.toLowerCase(Locale.ROOT));
        }
        return List.of();
    }
}
