package com.safego.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(NotificationTemplate template) {
        log.info("Security notification [{}] to {}: {}", template.channel(), mask(template.recipient()), template.subject());
    }

    private static String mask(String recipient) {
        if (recipient == null || recipient.length() <= 4) {
            return "****";
        }
        return recipient.substring(0, 2) + "****" + recipient.substring(recipient.length() - 2);
    }
}
