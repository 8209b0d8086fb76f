package com.social.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Match predicate of a rule. Every populated field must match; an empty
 * condition matches every item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Conditions an item must satisfy for the rule to fire")
public class RuleCondition {

    @Schema(description = "Required classification label (case-insensitive)", example = "question")
    private String classification;

    @Schema(description = "Any of these keywords must appear in the text (case-insensitive substring)",
            example = "[\"refund\", \"shipping\"]")
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Schema(description = "Author status: any, owner, or a connector-supplied status", example = "any")
    private String authorStatus;
}
