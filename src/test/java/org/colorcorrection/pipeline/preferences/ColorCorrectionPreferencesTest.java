package org.colorcorrection.pipeline.preferences;

import org.colorcorrection.pipeline.ColorCorrectionChecks;
import org.colorcorrection.pipeline.controller.BatchSettings;
import org.colorcorrection.pipeline.controller.SelectionFallback;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColorCorrectionPreferencesTest {

    @AfterEach
    void tearDown() {
        ColorCorrectionPreferences.resetOverrides();
        System.clearProperty(ColorCorrectionPreferences.POLL_INTERVAL);
        System.clearProperty(ColorCorrectionPreferences.SERVER_HOST);
    }

    @Test
    void bundledDefaultsAreLoaded() {
        assertEquals("localhost", ColorCorrectionPreferences.getServerHost());
        assertEquals(5000, ColorCorrectionPreferences.getServerPort());
        assertEquals(4, ColorCorrectionPreferences.getParallelThreshold());
        assertEquals("FIRST_IMAGE", ColorCorrectionPreferences.getSelectionFallback());
    }

    @Test
    void settersOverrideSystemProperties() {
        System.setProperty(ColorCorrectionPreferences.SERVER_HOST, "gpu-box");
        assertEquals("gpu-box", ColorCorrectionPreferences.getServerHost());

        ColorCorrectionPreferences.setServerHost("127.0.0.1");
        assertEquals("127.0.0.1", ColorCorrectionPreferences.getServerHost());

        ColorCorrectionPreferences.resetOverrides();
        assertEquals("gpu-box", ColorCorrectionPreferences.getServerHost());
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        System.setProperty(ColorCorrectionPreferences.POLL_INTERVAL, "fast");

        assertEquals(200, ColorCorrectionPreferences.getPollIntervalMillis());
    }

    @Test
    void batchSettingsSnapshotThePreferences() {
        ColorCorrectionPreferences.setPollIntervalMillis(50);
        ColorCorrectionPreferences.setDefaultWorkerCount(6);
        ColorCorrectionPreferences.setSelectionFallback("reject");

        BatchSettings settings = BatchSettings.fromPreferences();

        assertEquals(Duration.ofMillis(50), settings.pollInterval());
        assertEquals(6, settings.defaultWorkers());
        assertEquals(SelectionFallback.REJECT, settings.selectionFallback());
        assertTrue(ColorCorrectionChecks.validateBatchPreferences());
    }

    @Test
    void workerCountAboveCapIsInvalid() {
        ColorCorrectionPreferences.setDefaultWorkerCount(12);

        assertThrows(IllegalArgumentException.class, BatchSettings::fromPreferences);
        assertFalse(ColorCorrectionChecks.validateBatchPreferences());
    }

    @Test
    void unknownFallbackNameUsesFirstImage() {
        assertEquals(SelectionFallback.FIRST_IMAGE, SelectionFallback.fromName("random"));
        assertEquals(SelectionFallback.FIRST_IMAGE, SelectionFallback.fromName(null));
    }
}
