package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;
import com.airledger.core.support.TestReadings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegulatoryLimitsTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsEveryConfiguredLimit() throws Exception {
        Path file = tempDir.resolve("regulatory-limits.json");
        Files.writeString(file, TestReadings.CPCB_LIMITS);

        RegulatoryLimits limits = RegulatoryLimits.load(file);

        assertEquals(12, limits.size());
        assertEquals("CPCB NAAQS 2009", limits.version());
        assertEquals(100.0, limits.find(Pollutant.PM10, AveragingPeriod.TWENTY_FOUR_HOURS).orElseThrow().value());
        assertTrue(limits.find(Pollutant.O3, AveragingPeriod.ANNUAL).isEmpty());
    }

    @Test
    void missingFileIsAConfigurationError() {
        RegulatoryConfigurationException error = assertThrows(RegulatoryConfigurationException.class,
                () -> RegulatoryLimits.load(tempDir.resolve("absent.json")));

        assertTrue(error.getMessage().contains("not found"));
    }

    @Test
    void perPollutantCitationOverridesTheTableReference() {
        RegulatoryLimits limits = TestReadings.limits("""
                {"version": "v2", "legal_ref": "General", "limits": {"CO": {"8hr": 2}, "SO2": {"24hr": 80}},
                 "citations": {"CO": "Schedule VII, item 10"}}
                """);

        assertEquals("Schedule VII, item 10", limits.find(Pollutant.CO, AveragingPeriod.EIGHT_HOURS).orElseThrow().citation());
        assertEquals("General", limits.find(Pollutant.SO2, AveragingPeriod.TWENTY_FOUR_HOURS).orElseThrow().citation());
    }

    @Test
    void rejectsUnusableTables() {
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("{\"version\": \"x\"}"));
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("{\"limits\": {}}"));
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("{\"limits\": {\"NOX\": {\"1hr\": 1}}}"));
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("{\"limits\": {\"CO\": {\"2hr\": 1}}}"));
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("{\"limits\": {\"CO\": {\"1hr\": -4}}}"));
        assertThrows(RegulatoryConfigurationException.class, () -> TestReadings.limits("not json"));
    }
}
