package com.social.automation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyRuleOutcome {
    private String ruleId;
    private LocalDate day;
    private boolean automated;
    private long responses;
    private long impressions;
    private long conversions;
    private long engagementCount;
    private double engagementSum;

    @JsonIgnore
    public double getCtr() {
        return impressions > 0 ? (double) conversions / impressions : 0.0;
    }
}
