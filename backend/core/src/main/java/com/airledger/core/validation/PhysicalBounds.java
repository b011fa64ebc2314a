package com.airledger.core.validation;

import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Inclusive physical plausibility ranges. Pollutants in μg/m³ except CO (mg/m³).
 */
public final class PhysicalBounds {
    public record Range(double min, double max) {
        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    private static final Map<Pollutant, Range> POLLUTANTS = new EnumMap<>(Pollutant.class);
    private static final Map<String, MetField> MET_FIELDS = new LinkedHashMap<>();

    static {
        POLLUTANTS.put(Pollutant.PM25, new Range(0.0, 1000.0));
        POLLUTANTS.put(Pollutant.PM10, new Range(0.0, 2000.0));
        POLLUTANTS.put(Pollutant.NO2, new Range(0.0, 2000.0));
        POLLUTANTS.put(Pollutant.SO2, new Range(0.0, 2000.0));
        POLLUTANTS.put(Pollutant.CO, new Range(0.0, 100.0));
        POLLUTANTS.put(Pollutant.O3, new Range(0.0, 1000.0));

        MET_FIELDS.put("temperature", new MetField(MetContext::temperature, new Range(-50.0, 60.0)));
        MET_FIELDS.put("humidity", new MetField(MetContext::humidity, new Range(0.0, 100.0)));
        MET_FIELDS.put("wind_speed", new MetField(MetContext::windSpeed, new Range(0.0, 100.0)));
        MET_FIELDS.put("wind_direction", new MetField(MetContext::windDirection, new Range(0.0, 360.0)));
        MET_FIELDS.put("pressure", new MetField(MetContext::pressure, new Range(800.0, 1100.0)));
    }

    record MetField(Function<MetContext, Double> accessor, Range range) {
    }

    private PhysicalBounds() {
    }

    public static Range forPollutant(Pollutant pollutant) {
        return POLLUTANTS.get(pollutant);
    }

    static Map<String, MetField> metFields() {
        return MET_FIELDS;
    }
}
