package com.social.automation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI responseAutomationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Response Automation API")
                        .version("1.0.0")
                        .description(
                                "Operator API for the automated response orchestration engine.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Polling loop ingests new comments per scope (idempotent by external item id)\n" +
                                "2. Automation cycle runs each scope's enabled rules in priority order, first match wins\n" +
                                "3. Action executor applies rate limiting, pacing, variant selection and safety gating\n" +
                                "4. Responses needing sign-off land in the approval queue (urgent at priority >= 90)\n" +
                                "5. Outcome feedback drives A/B significance testing and variant reweighting\n\n" +
                                "**Action types:**\n" +
                                "- `respond` renders a template variant and posts or queues it for approval\n" +
                                "- `delete` removes the item when the moderation check recommends it\n" +
                                "- `flag` moves the item to `NEEDS_REVIEW`")
                        .contact(new Contact().name("Response Automation Team")));
    }
}
