package com.social.automation.engine;

import com.social.automation.model.AutomationRule;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.RuleCondition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Evaluates a rule's condition against a queued item. Every populated part of the condition
 * must hold; an empty condition matches everything.
 */
@Component
public class RuleMatcher {

    static final String AUTHOR_ANY = "any";
    static final String AUTHOR_OWNER = "owner";

    public boolean matches(AutomationRule rule, QueuedItem item, ExecutionContext context) {
        RuleCondition condition = rule.getCondition();
        if (condition == null) {
            return true;
        }
        return classificationMatches(condition.getClassification(), item.getClassification())
                && keywordsMatch(condition.getKeywords(), item.getText())
                && authorStatusMatches(condition.getAuthorStatus(), item, context);
    }

    private boolean classificationMatches(String expected, String actual) {
        if (expected == null || expected.isBlank()) return true;
        return actual != null && expected.trim().equalsIgnoreCase(actual.trim());
    }

    private boolean keywordsMatch(List<String> keywords, String text) {
        if (keywords == null || keywords.stream().allMatch(k -> k == null || k.isBlank())) return true;
        if (text == null) return false;
        String haystack = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .anyMatch(k -> haystack.contains(k.toLowerCase(Locale.ROOT)));
    }

    private boolean authorStatusMatches(String expected, QueuedItem item, ExecutionContext context) {
        if (expected == null || expected.isBlank() || AUTHOR_ANY.equalsIgnoreCase(expected)) return true;
        if (AUTHOR_OWNER.equalsIgnoreCase(expected)) {
            return item.getAuthorId() != null && context.ownerAuthorId() != null
                    && item.getAuthorId().equals(context.ownerAuthorId());
        }
        return expected.equalsIgnoreCase(item.getAuthorStatus());
    }
}
