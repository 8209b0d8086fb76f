package com.social.automation.integration;

/**
 * A child interaction as returned by the source, before it is queued.
 */
public record RawItem(String itemId, String text, String authorId, String authorStatus, long createdAt) {}
