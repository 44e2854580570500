package com.alertsentinel.core.notify;

import com.alertsentinel.core.error.CollaboratorException;

/**
 * Boundary to the notification transport.
 *
 * @since 1.0.0
 */
public interface NotificationDispatcher {

    /**
     * @param request notification to deliver
     * @return {@code true} if the transport accepted the notification
     * @throws CollaboratorException if the transport failed
     */
    boolean notify(NotificationRequest request);
}
