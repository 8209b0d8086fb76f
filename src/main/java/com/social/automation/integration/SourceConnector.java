package com.social.automation.integration;

import java.util.List;

/**
 * Access to the third-party platform a scope is connected to. Implementations may throw
 * on transport errors; callers treat those as transient and skip the affected item.
 */
public interface SourceConnector {

    List<ContentRef> listNewParentContent(String scopeId, long since);

    List<RawItem> listNewChildItems(String scopeId, ContentRef content);

    PostResult postResponse(String scopeId, String itemId, String text);

    boolean deleteItem(String scopeId, String itemId);
}
