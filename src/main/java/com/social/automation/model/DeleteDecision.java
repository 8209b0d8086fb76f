package com.social.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured verdict of the moderation collaborator on a delete request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteDecision {
    private boolean recommendedDelete;
    private double confidence;
    private double threshold;
    private boolean legitimate;
    private String reason;
}
