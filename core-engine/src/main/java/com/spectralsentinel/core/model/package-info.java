/**
 * Domain model classes for Spectral Sentinel.
 *
 * <p>
 * This package contains the value objects shared between the detection
 * engine and the command-line runner:
 * </p>
 * <ul>
 * <li>{@link com.spectralsentinel.core.model.Sample} — timestamped
 * observation</li>
 * <li>{@link com.spectralsentinel.core.model.DetectionResult} — saliency,
 * score and anomaly flag per point</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.model;
