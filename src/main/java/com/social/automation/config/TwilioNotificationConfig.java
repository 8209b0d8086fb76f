package com.social.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Twilio settings for urgent-approval alerts. Alerts are only sent when {@code enabled} is set.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private String channel = "sms";  // "sms" or "whatsapp"
    private int maxEntriesPerMessage = 5;
}
