/**
 * Locking and background-worker primitives shared by the core components.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.concurrent;
