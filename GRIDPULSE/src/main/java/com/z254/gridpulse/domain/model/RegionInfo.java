package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A supported region with its coordinates and base load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionInfo {

    private String code;

    private String name;

    private String localName;

    private double latitude;

    private double longitude;

    /**
     * Typical daily base load in MW.
     */
    private double baseLoad;
}
