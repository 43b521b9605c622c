/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable snapshot of the engine settings.
 *
 * <p>Settings are defined in {@link TimeSeriesMatrixSettings}:</p>
 * <ul>
 *   <li>{@link TimeSeriesMatrixSettings#RESAMPLER_VALIDATE_ALIGNMENT}</li>
 *   <li>{@link TimeSeriesMatrixSettings#DEFAULT_ZONE}</li>
 * </ul>
 *
 * @param validateAlignment whether the resampler rejects out-of-order or off-grid samples
 * @param defaultZone zone for matrices built from irregular samples without an explicit zone
 */
public record MatrixConfig(boolean validateAlignment, ZoneId defaultZone) {

    private static final Logger logger = LogManager.getLogger(MatrixConfig.class);

    private static final MatrixConfig DEFAULT = fromSettings(Settings.EMPTY);

    public MatrixConfig {
        Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    /**
     * Configuration matching the setting defaults.
     */
    public static MatrixConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Read the configuration from node settings; unset settings take their defaults.
     *
     * @param settings the settings to read
     * @return the materialised configuration
     * @throws IllegalArgumentException if a setting value is invalid
     */
    public static MatrixConfig fromSettings(Settings settings) {
        MatrixConfig config = new MatrixConfig(
            TimeSeriesMatrixSettings.RESAMPLER_VALIDATE_ALIGNMENT.get(settings),
            ZoneId.of(TimeSeriesMatrixSettings.DEFAULT_ZONE.get(settings))
        );
        if (!settings.isEmpty()) {
            logger.info("Loaded time series matrix config: validateAlignment={}, defaultZone={}", config.validateAlignment(), config.defaultZone());
        }
        return config;
    }

    /**
     * Copy of this configuration with alignment validation switched.
     */
    public MatrixConfig withValidateAlignment(boolean validate) {
        return new MatrixConfig(validate, defaultZone);
    }
}
