/**
 * Configuration loading and validation for the Spectral Residual detector.
 *
 * <p>
 * Hyperparameters are defined in YAML and loaded by
 * {@link com.spectralsentinel.core.config.DetectorConfigLoader} into a
 * {@link com.spectralsentinel.core.config.DetectorConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.config;
