package com.social.automation.engine;

import com.social.automation.model.AutomationRule;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.RuleCondition;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher();
    private final ExecutionContext context = ExecutionContext.of(TestDataFactory.SCOPE, "owner-1");

    private AutomationRule ruleWith(RuleCondition condition) {
        AutomationRule rule = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        rule.setCondition(condition);
        return rule;
    }

    @Test
    void emptyCondition_matchesEverything() {
        QueuedItem item = TestDataFactory.createItem("i1", "anything", 0, 1L);
        assertThat(matcher.matches(ruleWith(new RuleCondition()), item, context)).isTrue();
        assertThat(matcher.matches(ruleWith(null), item, context)).isTrue();
    }

    @Test
    void classification_isCaseInsensitive() {
        QueuedItem item = TestDataFactory.createClassifiedItem("i1", "how?", "Question");
        RuleCondition question = RuleCondition.builder().classification("question").build();
        RuleCondition praise = RuleCondition.builder().classification("praise").build();

        assertThat(matcher.matches(ruleWith(question), item, context)).isTrue();
        assertThat(matcher.matches(ruleWith(praise), item, context)).isFalse();
    }

    @Test
    void keywords_anySubstringMatches() {
        RuleCondition condition = RuleCondition.builder().keywords(List.of("refund", "shipping")).build();

        assertThat(matcher.matches(ruleWith(condition),
                TestDataFactory.createItem("i1", "Where is my SHIPPING label", 0, 1L), context)).isTrue();
        assertThat(matcher.matches(ruleWith(condition),
                TestDataFactory.createItem("i2", "great content", 0, 1L), context)).isFalse();
    }

    @Test
    void authorStatus_ownerComparesAgainstScopeOwner() {
        RuleCondition owner = RuleCondition.builder().authorStatus("owner").build();
        QueuedItem byOwner = TestDataFactory.createItem("i1", "pinned", 0, 1L);
        byOwner.setAuthorId("owner-1");
        QueuedItem byViewer = TestDataFactory.createItem("i2", "hi", 0, 1L);

        assertThat(matcher.matches(ruleWith(owner), byOwner, context)).isTrue();
        assertThat(matcher.matches(ruleWith(owner), byViewer, context)).isFalse();
    }

    @Test
    void authorStatus_connectorStatusAndAny() {
        QueuedItem subscriber = TestDataFactory.createItem("i1", "hi", 0, 1L);
        subscriber.setAuthorStatus("subscriber");

        assertThat(matcher.matches(ruleWith(RuleCondition.builder().authorStatus("Subscriber").build()),
                subscriber, context)).isTrue();
        assertThat(matcher.matches(ruleWith(RuleCondition.builder().authorStatus("member").build()),
                subscriber, context)).isFalse();
        assertThat(matcher.matches(ruleWith(RuleCondition.builder().authorStatus("any").build()),
                subscriber, context)).isTrue();
    }

    @Test
    void allPopulatedPartsMustHold() {
        RuleCondition condition = RuleCondition.builder()
                .classification("question")
                .keywords(List.of("refund"))
                .build();

        assertThat(matcher.matches(ruleWith(condition),
                TestDataFactory.createClassifiedItem("i1", "refund please?", "question"), context)).isTrue();
        assertThat(matcher.matches(ruleWith(condition),
                TestDataFactory.createClassifiedItem("i2", "refund please?", "complaint"), context)).isFalse();
    }
}
