package com.safego.backend.service;

/**
 * Delivers rendered security notifications. Delivery failures are reported by throwing.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationTemplate template);
}
