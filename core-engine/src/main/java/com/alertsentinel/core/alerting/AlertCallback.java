package com.alertsentinel.core.alerting;

import com.alertsentinel.core.model.Alert;

/**
 * Receives every alert the engine fires.
 *
 * <p>
 * Invoked after the engine lock is released, on the thread that submitted the
 * sample. A callback that throws is logged and counted; remaining callbacks
 * still run.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertCallback {

    /**
     * @param alert independent copy of the fired alert
     */
    void onAlert(Alert alert);
}
