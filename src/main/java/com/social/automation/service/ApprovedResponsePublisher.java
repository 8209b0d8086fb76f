package com.social.automation.service;

import com.social.automation.integration.ResponseHandoff;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.QueuedItem;
import com.social.automation.repository.QueuedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Hands the response held by an approved entry to the publication path, which posts it and
 * closes the queued item. A rejected handoff leaves the item in {@code NEEDS_REVIEW}; it never
 * undoes the approval.
 */
@Component
public class ApprovedResponsePublisher {

    private static final Logger log = LoggerFactory.getLogger(ApprovedResponsePublisher.class);

    static final String PAYLOAD_RESPONSE_TEXT = "responseText";

    private final ResponseHandoff responseHandoff;
    private final QueuedItemRepository queuedItemRepo;

    public ApprovedResponsePublisher(ResponseHandoff responseHandoff, QueuedItemRepository queuedItemRepo) {
        this.responseHandoff = responseHandoff;
        this.queuedItemRepo = queuedItemRepo;
    }

    @EventListener
    public void onApprovalGranted(ApprovalGrantedEvent event) {
        ApprovalEntry entry = event.entry();
        Object text = entry.getPayload() != null ? entry.getPayload().get(PAYLOAD_RESPONSE_TEXT) : null;
        if (text == null || text.toString().isBlank()) {
            log.warn("Approval {} carries no response text, nothing to publish", entry.getApprovalId());
            return;
        }

        try {
            QueuedItem item = queuedItemRepo.findById(entry.getItemId());
            if (item == null) {
                item = QueuedItem.builder().itemId(entry.getItemId()).scopeId(entry.getScopeId()).build();
            }
            if (!responseHandoff.handOff(item, text.toString())) {
                log.warn("Publication of approved response {} for item {} was rejected",
                        entry.getApprovalId(), entry.getItemId());
                return;
            }
            log.info("Approved response {} for item {} queued for publication",
                    entry.getApprovalId(), entry.getItemId());
        } catch (Exception e) {
            log.error("Error publishing approved response {} for item {}: {}",
                    entry.getApprovalId(), entry.getItemId(), e.getMessage(), e);
        }
    }
}
