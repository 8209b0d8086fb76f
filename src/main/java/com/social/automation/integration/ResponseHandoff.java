package com.social.automation.integration;

import com.social.automation.model.QueuedItem;

/**
 * Downstream publication path for responses that do not need human sign-off, and for
 * approved ones. An implementation accepts the response for later posting and owns closing
 * the queued item once the post has gone through.
 */
public interface ResponseHandoff {

    /**
     * @return true when the response was accepted for publication
     */
    boolean handOff(QueuedItem item, String responseText);
}
