package org.colorcorrection.pipeline.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrectionConfigTest {

    @Test
    void defaultsEnableEveryStage() {
        CorrectionConfig config = CorrectionConfig.builder().build();

        assertEquals(EnumSet.allOf(CorrectionStage.class), config.getEnabledStages());
        assertEquals(CorrectionMethod.PLS, config.getEffectiveMethod());
        assertFalse(config.isSaveModel());
        assertTrue(config.isComputeDeltaE());
        assertFalse(config.isDetectChartFirst());
        assertEquals(50, config.getFlatField().bins());
        assertEquals(5, config.getGamma().maxDegree());
        assertEquals(List.of(64, 32, 16), config.getColorCorrection().hiddenLayers());
    }

    @Test
    void atLeastOneStageMustBeEnabled() {
        CorrectionConfig.Builder builder = CorrectionConfig.builder()
                .ffcEnabled(false).gcEnabled(false).wbEnabled(false).ccEnabled(false);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void conventionalMethodTurnsOffLearnedCorrection() {
        CorrectionConfig config = CorrectionConfig.builder().method(CorrectionMethod.CONVENTIONAL).build();

        assertFalse(config.getColorCorrection().learned());
        assertEquals(CorrectionMethod.CONVENTIONAL, config.getEffectiveMethod());

        CorrectionConfig learned = config.toBuilder().method(CorrectionMethod.SVM).build();
        assertTrue(learned.getColorCorrection().learned());
        assertEquals(CorrectionMethod.SVM, learned.getEffectiveMethod());
    }

    @Test
    void toBuilderCopiesEverything() {
        CorrectionConfig config = CorrectionConfig.builder()
                .wbEnabled(false)
                .method(CorrectionMethod.NN)
                .saveModel(true)
                .build();

        assertEquals(config, config.toBuilder().build());
        assertEquals(config.hashCode(), config.toBuilder().build().hashCode());
        assertNotEquals(config, config.toBuilder().saveModel(false).build());
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CorrectionConfig.GammaParams(0));
        CorrectionConfig.ColorCorrectionParams cc = CorrectionConfig.ColorCorrectionParams.defaults();
        assertThrows(IllegalArgumentException.class, () -> cc.withFitMethod(CorrectionMethod.CONVENTIONAL));
    }

    @Test
    void stageKeysResolveFromOutputNames() {
        assertEquals(CorrectionStage.CC, CorrectionStage.fromKey("leaf_CC").orElseThrow());
        assertEquals(CorrectionStage.FFC, CorrectionStage.fromKey("ffc").orElseThrow());
        assertTrue(CorrectionStage.fromKey("leaf_original").isEmpty());
        assertTrue(CorrectionStage.fromKey(null).isEmpty());
    }
}
