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
@Schema(description = "An externally-sourced interaction (comment, mention) waiting for automation")
public class QueuedItem {

    @Schema(description = "External item identifier, unique per platform", example = "Ugx9a1b2c3")
    private String itemId;

    @Schema(description = "Scope (connected channel) the item belongs to", example = "CH-001")
    private String scopeId;

    @Schema(description = "Parent content (video, post) the item was left on", example = "VID-42")
    private String contentId;

    @Schema(description = "Raw text of the interaction", example = "Can I get a refund?")
    private String text;

    @Schema(description = "Classification label produced by the classifier", example = "question")
    private String classification;

    @Schema(description = "Author identifier on the platform", example = "UC-author-1")
    private String authorId;

    @Schema(description = "Author status supplied by the connector", example = "subscriber")
    private String authorStatus;

    @Builder.Default
    private ItemStatus status = ItemStatus.PENDING;

    @Schema(description = "Higher = more urgent")
    private int priority;

    private long createdAt;
    private long updatedAt;
}
