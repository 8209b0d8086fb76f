package com.social.automation.model.analytics;

import java.time.LocalDate;

/**
 * A day whose CTR moved by at least the configured fraction against the trailing 7-day mean.
 */
public record CtrAnomaly(
        String ruleId,
        LocalDate day,
        double ctr,
        double trailingMean,
        double change,
        String direction     // spike, drop
) {}
