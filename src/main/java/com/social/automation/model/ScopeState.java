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
@Schema(description = "Polling state of a connected source")
public class ScopeState {

    @Schema(example = "CH-001")
    private String scopeId;

    @Schema(description = "Author id of the scope owner, used by the `owner` author-status condition")
    private String ownerAuthorId;

    @Builder.Default
    private boolean pollingEnabled = true;

    @Schema(description = "Minutes between polls; 0 uses the service default", example = "15")
    private int pollIntervalMinutes;

    @Schema(description = "Epoch millis of the last completed poll, 0 if never polled")
    private long lastPolledAt;
}
