/**
 * Outbound notification boundary. The core builds
 * {@link com.alertsentinel.core.notify.NotificationRequest}s; transports live
 * outside this module.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.notify;
