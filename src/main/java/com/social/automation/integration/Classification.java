package com.social.automation.integration;

import java.util.List;

public record Classification(String label, List<String> keywords, String language) {}
