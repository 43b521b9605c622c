/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsmatrix.core.time;

import org.opensearch.common.unit.TimeValue;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact frequency strings.
 *
 * <p>Calendar steps use the suffixes {@code bd} (business days), {@code d}, {@code w}, {@code mo} and
 * {@code y}. Every other string is handed to {@link TimeValue#parseTimeValue(String, String)} and becomes a
 * fixed {@link DurationFrequency}, so {@code "15m"}, {@code "1h"} and {@code "500ms"} all work.</p>
 *
 * <pre>{@code
 * Frequency daily = Frequencies.parse("1d");     // CalendarFrequency
 * Frequency trading = Frequencies.parse("1bd");  // BusinessDayFrequency
 * Frequency hourly = Frequencies.parse("1h");    // DurationFrequency
 * }</pre>
 */
public final class Frequencies {

    private static final String SETTING_NAME = "frequency";
    private static final Pattern CALENDAR_PATTERN = Pattern.compile("^(-?\\d+)\\s*(bd|d|w|mo|y)$");

    private Frequencies() {}

    /**
     * @param rep the frequency string
     * @return the parsed frequency
     * @throws IllegalArgumentException if the string cannot be parsed or denotes a non-positive step
     */
    public static Frequency parse(String rep) {
        if (rep == null || rep.isBlank()) {
            throw new IllegalArgumentException("Frequency must not be empty");
        }
        String normalized = rep.trim();
        Matcher matcher = CALENDAR_PATTERN.matcher(normalized.toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            long amount;
            try {
                amount = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid frequency amount in [" + rep + "]", e);
            }
            return switch (matcher.group(2)) {
                case "bd" -> new BusinessDayFrequency(amount);
                case "d" -> CalendarFrequency.days(amount);
                case "w" -> CalendarFrequency.weeks(amount);
                case "mo" -> CalendarFrequency.months(amount);
                case "y" -> CalendarFrequency.years(amount);
                default -> throw new IllegalStateException("Unhandled calendar suffix in [" + rep + "]");
            };
        }
        TimeValue timeValue = TimeValue.parseTimeValue(normalized, SETTING_NAME);
        return DurationFrequency.of(timeValue);
    }
}
