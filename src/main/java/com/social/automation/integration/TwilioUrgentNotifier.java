package com.social.automation.integration;

import com.social.automation.config.MetricsConfig;
import com.social.automation.config.TwilioNotificationConfig;
import com.social.automation.model.ApprovalEntry;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(1)
@ConditionalOnProperty(prefix = "twilio", name = "enabled", havingValue = "true")
public class TwilioUrgentNotifier implements UrgentApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioUrgentNotifier.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioUrgentNotifier(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        Twilio.init(config.getAccountSid(), config.getAuthToken());
        log.info("Twilio urgent-approval notifier initialized. Channel: {}", config.getChannel());
    }

    @Async
    @Override
    @Observed(name = "notification.send", contextualName = "send-urgent-approval")
    public void notifyUrgent(List<ApprovalEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }

        try {
            String body = buildMessageBody(entries);
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Urgent approval alert sent for {} entries, sid={}", entries.size(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send urgent approval alert for {} entries: {}", entries.size(), e.getMessage(), e);
        }
    }

    String buildMessageBody(List<ApprovalEntry> entries) {
        StringBuilder body = new StringBuilder("[APPROVAL] ")
                .append(entries.size())
                .append(" urgent item(s) waiting");
        entries.stream()
                .limit(Math.max(1, config.getMaxEntriesPerMessage()))
                .forEach(e -> body.append(String.format("\nScope %s, item %s, priority %d",
                        e.getScopeId(), e.getItemId(), e.getPriority())));
        if (entries.size() > config.getMaxEntriesPerMessage()) {
            body.append("\n...");
        }
        return body.toString();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
