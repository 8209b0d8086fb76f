package com.social.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One arm of an A/B test embedded in a rule")
public class Variant {

    @Schema(example = "A")
    private String variantId;

    @Schema(description = "Relative selection weight, non-negative", example = "0.5")
    private double weight;

    @Schema(description = "Template used when this variant is selected", example = "thanks-short")
    private String templateRef;
}
