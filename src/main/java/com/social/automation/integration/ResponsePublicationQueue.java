package com.social.automation.integration;

import com.social.automation.model.QueuedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Default {@link ResponseHandoff}: a bounded in-memory queue drained by
 * {@code ResponsePublishingService}. A full queue rejects the handoff, which the executor
 * records as a failed execution and the item stays pending.
 */
public class ResponsePublicationQueue implements ResponseHandoff {

    private static final Logger log = LoggerFactory.getLogger(ResponsePublicationQueue.class);

    public record Publication(QueuedItem item, String text, int attempts) {

        public Publication retried() {
            return new Publication(item, text, attempts + 1);
        }
    }

    private final BlockingQueue<Publication> queue;

    public ResponsePublicationQueue(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean handOff(QueuedItem item, String responseText) {
        boolean accepted = queue.offer(new Publication(item, responseText, 0));
        if (!accepted) {
            log.warn("Publication queue full ({} entries), rejecting response for item {}",
                    queue.size(), item.getItemId());
        }
        return accepted;
    }

    public List<Publication> drain(int max) {
        List<Publication> batch = new ArrayList<>();
        queue.drainTo(batch, max);
        return batch;
    }

    public boolean requeue(Publication publication) {
        return queue.offer(publication);
    }

    public int size() {
        return queue.size();
    }
}
