package com.social.automation.integration;

import java.util.Map;

public interface TemplateRenderer {

    String render(String templateRef, Map<String, String> context);
}
