package com.safego.backend.service;

public record NotificationTemplate(Channel channel, String recipient, String subject, String body) {

    public enum Channel {
        EMAIL,
        SMS
    }
}
