package com.social.automation.engine.abtest;

import com.social.automation.model.AutomationRule;
import com.social.automation.model.Variant;
import com.social.automation.model.VariantKey;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Weighted random (roulette-wheel) choice of a response variant from a rule's embedded tests.
 */
@Component
public class VariantSelector {

    private final Random random;

    public VariantSelector(Random random) {
        this.random = random;
    }

    public VariantKey selectVariant(AutomationRule rule) {
        return selectVariant(rule, null);
    }

    /**
     * @param testId explicit test to draw from; the rule's first test when null. A test the
     *               rule does not define resolves to variant {@code A} of that test.
     */
    public VariantKey selectVariant(AutomationRule rule, String testId) {
        if (rule == null || !rule.hasAbTests()) {
            return VariantKey.DEFAULT;
        }
        Map<String, List<Variant>> tests = rule.getAbTests();
        String tid = testId != null ? testId : tests.keySet().iterator().next();
        List<Variant> variants = tests.get(tid);
        if (variants == null || variants.isEmpty()) {
            return new VariantKey(tid, "A");
        }

        double total = 0.0;
        for (Variant v : variants) {
            total += Math.max(0.0, v.getWeight());
        }
        if (total <= 0.0) {
            return new VariantKey(tid, variants.get(random.nextInt(variants.size())).getVariantId());
        }

        double r = random.nextDouble() * total;
        double cumulative = 0.0;
        for (Variant v : variants) {
            cumulative += Math.max(0.0, v.getWeight());
            if (cumulative > r) {
                return new VariantKey(tid, v.getVariantId());
            }
        }
        // only reachable through floating point rounding at the top of the wheel
        return new VariantKey(tid, variants.get(variants.size() - 1).getVariantId());
    }

    /**
     * The variant definition behind a key, or null when the rule no longer has it.
     */
    public Variant findVariant(AutomationRule rule, VariantKey key) {
        if (rule == null || !rule.hasAbTests()) return null;
        List<Variant> variants = rule.getAbTests().get(key.testId());
        if (variants == null) return null;
        return variants.stream()
                .filter(v -> key.variantId().equals(v.getVariantId()))
                .findFirst()
                .orElse(null);
    }
}
