/**
 * Spectral Residual detection pipeline.
 *
 * <p>
 * {@link com.spectralsentinel.core.detection.SpectralResidualDetector} is the
 * entry point and implements
 * {@link com.spectralsentinel.core.detection.AnomalyDetector}. It composes
 * stateless stages, leaves first:
 * </p>
 * <ul>
 * <li>{@link com.spectralsentinel.core.detection.Convolver} — zero-padded
 * moving average</li>
 * <li>{@link com.spectralsentinel.core.detection.Extrapolator} — pads both
 * ends with a trend estimate</li>
 * <li>{@link com.spectralsentinel.core.detection.FourierTransform} —
 * arbitrary-length DFT</li>
 * <li>{@link com.spectralsentinel.core.detection.SaliencyMapper} — spectral
 * residual saliency map</li>
 * <li>{@link com.spectralsentinel.core.detection.Scorer} — saliency against its
 * local average</li>
 * <li>{@link com.spectralsentinel.core.detection.Thresholder} — score to
 * flag</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.detection;
