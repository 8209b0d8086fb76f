package com.social.automation.service;

import com.social.automation.config.AutomationConfig;
import com.social.automation.integration.PostResult;
import com.social.automation.integration.ResponsePublicationQueue;
import com.social.automation.integration.ResponsePublicationQueue.Publication;
import com.social.automation.integration.SourceConnector;
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import com.social.automation.repository.QueuedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Posts handed-off responses through the source connector and closes their items.
 * <p>
 * An item the engine has not yet moved out of {@code PENDING} is put back untouched. A post
 * that fails is retried on later passes; once the attempts run out the item goes to
 * {@code NEEDS_REVIEW} for a human.
 */
@Service
public class ResponsePublishingService {

    private static final Logger log = LoggerFactory.getLogger(ResponsePublishingService.class);

    private final ObjectProvider<ResponsePublicationQueue> queueProvider;
    private final ObjectProvider<SourceConnector> connectorProvider;
    private final QueuedItemRepository queuedItemRepo;
    private final AutomationConfig.Publishing config;

    public ResponsePublishingService(ObjectProvider<ResponsePublicationQueue> queueProvider,
                                     ObjectProvider<SourceConnector> connectorProvider,
                                     QueuedItemRepository queuedItemRepo,
                                     AutomationConfig automationConfig) {
        this.queueProvider = queueProvider;
        this.connectorProvider = connectorProvider;
        this.queuedItemRepo = queuedItemRepo;
        this.config = automationConfig.getPublishing();
    }

    /**
     * Drain one batch from the publication queue.
     * @return number of responses posted
     */
    public int publishPending() {
        ResponsePublicationQueue queue = queueProvider.getIfAvailable();
        if (queue == null) {
            return 0;
        }
        List<Publication> batch = queue.drain(config.getBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }

        SourceConnector connector = connectorProvider.getIfAvailable();
        if (connector == null) {
            log.warn("No source connector configured, {} responses left queued", batch.size());
            batch.forEach(queue::requeue);
            return 0;
        }

        int published = 0;
        for (Publication publication : batch) {
            try {
                if (publish(connector, queue, publication)) {
                    published++;
                }
            } catch (Exception e) {
                log.error("Error publishing response for item {}: {}",
                        publication.item().getItemId(), e.getMessage(), e);
                retryOrEscalate(queue, publication);
            }
        }
        if (published > 0) {
            log.info("Published {} of {} queued responses", published, batch.size());
        }
        return published;
    }

    private boolean publish(SourceConnector connector, ResponsePublicationQueue queue, Publication publication) {
        QueuedItem item = publication.item();
        QueuedItem stored = queuedItemRepo.findById(item.getItemId());
        ItemStatus status = stored != null ? stored.getStatus() : null;
        if (status == ItemStatus.DONE) {
            log.debug("Item {} already closed, dropping queued response", item.getItemId());
            return false;
        }
        if (status == ItemStatus.PENDING) {
            queue.requeue(publication);
            return false;
        }

        PostResult result = connector.postResponse(item.getScopeId(), item.getItemId(), publication.text());
        if (!result.success()) {
            log.warn("Platform rejected response for item {} (attempt {})",
                    item.getItemId(), publication.attempts() + 1);
            retryOrEscalate(queue, publication);
            return false;
        }

        if (status != null && !queuedItemRepo.transitionStatus(item.getItemId(), status, ItemStatus.DONE)) {
            log.debug("Item {} changed while its response was posted, left as is", item.getItemId());
        }
        log.debug("Response for item {} published as {}", item.getItemId(), result.externalId());
        return true;
    }

    private void retryOrEscalate(ResponsePublicationQueue queue, Publication publication) {
        Publication next = publication.retried();
        String itemId = publication.item().getItemId();
        if (next.attempts() < config.getMaxAttempts() && queue.requeue(next)) {
            return;
        }
        log.error("Giving up on response for item {} after {} attempts", itemId, next.attempts());
        if (!queuedItemRepo.transitionStatus(itemId, ItemStatus.PROCESSING, ItemStatus.NEEDS_REVIEW)) {
            log.debug("Item {} not in processing, status left as is", itemId);
        }
    }
}
