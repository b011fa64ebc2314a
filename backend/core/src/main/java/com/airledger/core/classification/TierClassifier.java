package com.airledger.core.classification;

import com.airledger.core.model.ClassificationEvent;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.RuleResult;
import com.airledger.core.model.Tier;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;
import com.airledger.core.rules.RuleEngine;
import com.airledger.core.rules.RuleOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps window averages to compliance tiers: a breached 24-hour limit is a VIOLATION, 8-hour a FLAG and
 * 1-hour a MONITOR. Horizons are evaluated independently, so several tiers can fire for the same pollutant
 * in one pass. Horizons without a configured limit never trigger.
 */
public final class TierClassifier {
    private static final Logger LOGGER = Logger.getLogger(TierClassifier.class.getName());

    private final RuleEngine ruleEngine;
    private final ZoneAdjustments zones;
    private final Clock clock;

    public TierClassifier(RuleEngine ruleEngine, ZoneAdjustments zones, Clock clock) {
        this.ruleEngine = ruleEngine;
        this.zones = zones;
        this.clock = clock;
    }

    public List<ClassificationEvent> classify(
            String stationId,
            Pollutant pollutant,
            List<WindowResult> windowResults,
            String zone,
            ConsecutiveBreachProbe consecutiveBreachProbe
    ) {
        return classify(stationId, pollutant, windowResults, zone, consecutiveBreachProbe, null);
    }

    /**
     * @param metOverride context attached to every event instead of the window's own aggregate, when non-null
     */
    public List<ClassificationEvent> classify(
            String stationId,
            Pollutant pollutant,
            List<WindowResult> windowResults,
            String zone,
            ConsecutiveBreachProbe consecutiveBreachProbe,
            MetContext metOverride
    ) {
        double zoneFactor = zones.factorFor(zone);
        Map<WindowHorizon, WindowResult> byHorizon = new EnumMap<>(WindowHorizon.class);
        for (WindowResult window : windowResults) {
            byHorizon.put(window.horizon(), window);
        }

        List<ClassificationEvent> events = new ArrayList<>();
        for (WindowHorizon horizon : WindowHorizon.classificationOrder()) {
            WindowResult window = byHorizon.get(horizon);
            if (window == null) {
                continue;
            }
            double adjusted = window.averageValue() / zoneFactor;
            RuleOutcome outcome = ruleEngine.lookup(pollutant, horizon.period(), adjusted);
            if (!(outcome instanceof RuleOutcome.Evaluated evaluated)) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("No " + horizon.period().label() + " limit for " + pollutant.code() + "; horizon skipped");
                }
                continue;
            }
            RuleResult rule = evaluated.result();
            if (rule.withinLimit()) {
                continue;
            }

            Tier tier = Tier.forHorizon(horizon);
            boolean consecutive = tier == Tier.VIOLATION
                    && consecutiveBreachProbe != null
                    && consecutiveBreachProbe.hadPriorDayViolation(stationId, pollutant);
            events.add(new ClassificationEvent(
                    stationId,
                    pollutant,
                    tier,
                    tier.initialStatus(),
                    rule,
                    horizon,
                    window.windowStart(),
                    window.windowEnd(),
                    metOverride != null ? metOverride : window.met(),
                    consecutive
            ));
            LOGGER.log(tier == Tier.MONITOR ? Level.INFO : Level.WARNING, String.format(
                    "%s: station=%s pollutant=%s observed=%.2f limit=%.2f excess=%.1f%%%s",
                    tier, stationId, pollutant.code(), rule.observedValue(), rule.limitValue(),
                    rule.exceedancePercent(), consecutive ? " (consecutive day)" : ""
            ));
        }
        return events;
    }

    /**
     * Classifies every pollutant of a station and gathers the events into one result.
     */
    public ClassificationResult classifyAllPollutants(
            String stationId,
            Map<Pollutant, List<WindowResult>> windowsByPollutant,
            String zone,
            ConsecutiveBreachProbe consecutiveBreachProbe
    ) {
        List<ClassificationEvent> events = new ArrayList<>();
        windowsByPollutant.forEach((pollutant, windows) ->
                events.addAll(classify(stationId, pollutant, windows, zone, consecutiveBreachProbe)));
        ClassificationResult result = new ClassificationResult(stationId, events, clock.instant());
        if (!events.isEmpty()) {
            LOGGER.info("Classification complete for station=" + stationId + ": " + events.size() + " events"
                    + " (VIOLATION=" + result.count(Tier.VIOLATION)
                    + ", FLAG=" + result.count(Tier.FLAG)
                    + ", MONITOR=" + result.count(Tier.MONITOR) + ")");
        }
        return result;
    }
}
