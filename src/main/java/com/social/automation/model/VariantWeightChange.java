package com.social.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantWeightChange {
    private String ruleId;
    private String testId;
    private String variantId;
    private double oldWeight;
    private double newWeight;
    private String reason;              // winner, rebalance, pause
    private double pValue;
    private long adjustedAt;
}
