/**
 * Configuration loading and validation.
 *
 * <p>
 * The YAML file is parsed by
 * {@link com.alertsentinel.core.config.SentinelConfigLoader} into a
 * string-typed {@link com.alertsentinel.core.config.SentinelConfig}, which is
 * then resolved once into a
 * {@link com.alertsentinel.core.config.ResolvedConfig}. Unknown comparators,
 * actions, kinds and severities are rejected during resolution.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.config;
