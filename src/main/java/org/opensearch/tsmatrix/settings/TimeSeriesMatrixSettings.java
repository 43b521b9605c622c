/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.settings;

import org.opensearch.common.settings.Setting;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Settings recognised by the time series matrix engine.
 */
public final class TimeSeriesMatrixSettings {

    /**
     * Whether the resampler rejects samples that are out of order or off the frequency grid. When disabled
     * such samples are skipped.
     */
    public static final Setting<Boolean> RESAMPLER_VALIDATE_ALIGNMENT = Setting.boolSetting(
        "tsmatrix.resampler.validate_alignment",
        true,
        Setting.Property.NodeScope
    );

    /**
     * Zone used for matrices built from irregular samples when the caller does not name one.
     */
    public static final Setting<String> DEFAULT_ZONE = Setting.simpleString(
        "tsmatrix.default_zone",
        "UTC",
        TimeSeriesMatrixSettings::validateZone,
        Setting.Property.NodeScope
    );

    private TimeSeriesMatrixSettings() {}

    /**
     * @return all settings of the engine
     */
    public static List<Setting<?>> getSettings() {
        return List.of(RESAMPLER_VALIDATE_ALIGNMENT, DEFAULT_ZONE);
    }

    private static void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid value [" + zone + "] for setting [tsmatrix.default_zone]", e);
        }
    }
}
