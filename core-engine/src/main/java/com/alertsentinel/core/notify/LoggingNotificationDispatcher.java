package com.alertsentinel.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatcher that only logs. Used when no transport is wired.
 *
 * @since 1.0.0
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public boolean notify(NotificationRequest request) {
        LOG.info("Notification [{}] to {} via {}: {} {}", request.getPriority(), request.getRecipientClass(),
                request.getChannel(), request.getMessage(), request.getMetadata());
        return true;
    }
}
