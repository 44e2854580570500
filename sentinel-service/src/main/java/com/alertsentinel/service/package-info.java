/**
 * Runnable host for the sentinel core: environment configuration, the
 * health and query endpoint, Micrometer meters and snapshot persistence.
 *
 * @since 1.0.0
 */
package com.alertsentinel.service;
