package com.z254.gridpulse.signal;

import java.time.LocalDate;
import java.util.List;

/**
 * Aligned per-point inputs of zone clustering.
 *
 * @param dates       point dates
 * @param values      metric values
 * @param volumes     activity volume per point, or null for a constant volume
 * @param eventCounts external events per point, or null for none
 */
public record ZoneInput(
        List<LocalDate> dates,
        double[] values,
        double[] volumes,
        int[] eventCounts) {

    public ZoneInput {
        if (dates.size() != values.length) {
            throw new IllegalArgumentException("dates and values must have the same length");
        }
        if (volumes != null && volumes.length != values.length) {
            throw new IllegalArgumentException("volumes must align with values");
        }
        if (eventCounts != null && eventCounts.length != values.length) {
            throw new IllegalArgumentException("event counts must align with values");
        }
    }

    public int size() {
        return values.length;
    }
}
