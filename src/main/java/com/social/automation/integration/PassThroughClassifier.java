package com.social.automation.integration;

import java.util.List;

/**
 * Used when no classification service is wired: items are queued without a label, so only
 * keyword and author-status conditions can match them.
 */
public class PassThroughClassifier implements Classifier {

    @Override
    public Classification classify(String text) {
        return new Classification(null, List.of(), null);
    }
}
