package com.social.automation.integration;

import com.social.automation.model.DeleteDecision;
import com.social.automation.model.QueuedItem;

import java.util.Map;

public interface SafetyModerator {

    DeleteDecision evaluateDeleteCriteria(QueuedItem item, Map<String, Object> criteria);
}
