package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable regulatory limit table: pollutant, averaging period, numeric limit and legal citation.
 *
 * <p>JSON layout:
 * <pre>
 * {
 *   "version": "CPCB NAAQS 2009",
 *   "legal_ref": "CPCB NAAQS 2009, Notification B-29016/20/90/PCI-I",
 *   "limits": { "PM2.5": { "24hr": 60, "annual": 40 }, ... },
 *   "citations": { "PM2.5": "..." }
 * }
 * </pre>
 */
public final class RegulatoryLimits {
    private static final Logger LOGGER = Logger.getLogger(RegulatoryLimits.class.getName());

    private final String version;
    private final String legalReference;
    private final Map<Pollutant, Map<AveragingPeriod, RegulatoryLimit>> limits;

    private RegulatoryLimits(String version, String legalReference, Map<Pollutant, Map<AveragingPeriod, RegulatoryLimit>> limits) {
        this.version = version;
        this.legalReference = legalReference;
        this.limits = limits;
    }

    public static RegulatoryLimits load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            RegulatoryLimits table = parse(in, file.toString());
            LOGGER.info("Regulatory limits loaded from " + file + " (" + table.version + ")");
            return table;
        } catch (NoSuchFileException e) {
            throw new RegulatoryConfigurationException(
                    "Regulatory limit table not found at " + file + "; cannot start rule engine", e);
        } catch (IOException e) {
            throw new RegulatoryConfigurationException("Failed reading regulatory limit table " + file, e);
        }
    }

    public static RegulatoryLimits parse(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new RegulatoryConfigurationException("Malformed regulatory limit table " + sourceName, e);
        }
        if (root == null || !root.path("limits").isObject()) {
            throw new RegulatoryConfigurationException("Regulatory limit table " + sourceName + " has no limits");
        }

        String version = root.path("version").asText("CPCB NAAQS 2009");
        String legalReference = root.path("legal_ref").asText(version);
        JsonNode citations = root.path("citations");

        Map<Pollutant, Map<AveragingPeriod, RegulatoryLimit>> table = new EnumMap<>(Pollutant.class);
        Iterator<Map.Entry<String, JsonNode>> pollutants = root.path("limits").fields();
        while (pollutants.hasNext()) {
            Map.Entry<String, JsonNode> pollutantEntry = pollutants.next();
            Pollutant pollutant = Pollutant.fromKey(pollutantEntry.getKey()).orElseThrow(() ->
                    new RegulatoryConfigurationException("Unknown pollutant in " + sourceName + ": " + pollutantEntry.getKey()));
            String citation = citations.path(pollutantEntry.getKey()).asText(legalReference);

            Map<AveragingPeriod, RegulatoryLimit> periods = new EnumMap<>(AveragingPeriod.class);
            Iterator<Map.Entry<String, JsonNode>> periodEntries = pollutantEntry.getValue().fields();
            while (periodEntries.hasNext()) {
                Map.Entry<String, JsonNode> periodEntry = periodEntries.next();
                AveragingPeriod period = AveragingPeriod.fromLabel(periodEntry.getKey()).orElseThrow(() ->
                        new RegulatoryConfigurationException("Unknown averaging period in " + sourceName + ": " + periodEntry.getKey()));
                JsonNode value = periodEntry.getValue();
                if (value.isNull()) {
                    continue;
                }
                if (!value.isNumber() || value.asDouble() <= 0) {
                    throw new RegulatoryConfigurationException("Limit for " + pollutant.label() + " "
                            + period.label() + " must be a positive number in " + sourceName);
                }
                periods.put(period, new RegulatoryLimit(pollutant, period, value.asDouble(), citation));
            }
            table.put(pollutant, Collections.unmodifiableMap(periods));
        }
        if (table.isEmpty()) {
            throw new RegulatoryConfigurationException("Regulatory limit table " + sourceName + " is empty");
        }
        return new RegulatoryLimits(version, legalReference, Collections.unmodifiableMap(table));
    }

    public Optional<RegulatoryLimit> find(Pollutant pollutant, AveragingPeriod period) {
        Map<AveragingPeriod, RegulatoryLimit> periods = limits.get(pollutant);
        return periods == null ? Optional.empty() : Optional.ofNullable(periods.get(period));
    }

    public String version() {
        return version;
    }

    public String legalReference() {
        return legalReference;
    }

    public int size() {
        return limits.values().stream().mapToInt(Map::size).sum();
    }
}
