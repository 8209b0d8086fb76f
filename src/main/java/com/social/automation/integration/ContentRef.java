package com.social.automation.integration;

/**
 * A recently published parent content (a video, a post) whose comments are polled.
 */
public record ContentRef(String contentId, String title, long publishedAt) {}
