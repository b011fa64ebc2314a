package com.airledger.core.window;

import com.airledger.core.model.Pollutant;
import com.airledger.core.model.WindowResult;

import java.time.Instant;
import java.util.List;

/**
 * Rolling averages for one station and pollutant, one result per horizon that holds at least one reading,
 * ordered from the shortest horizon to the longest.
 */
public interface WindowView {
    List<WindowResult> currentAverages(String stationId, Pollutant pollutant, Instant asOf);
}
