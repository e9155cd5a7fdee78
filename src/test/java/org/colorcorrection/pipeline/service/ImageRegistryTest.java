package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.model.ImageRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.colorcorrection.pipeline.service.FakePipelineBackend.uploaded;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageRegistryTest {

    private ImageRegistry registry;
    private List<ImageRef> refs;

    @BeforeEach
    void setUp() {
        registry = new ImageRegistry();
        refs = registry.add(uploaded("a.jpg", "b.jpg", "c.jpg"));
    }

    @Test
    void indicesFollowUploadOrder() {
        List<ImageRef> more = registry.add(uploaded("d.jpg"));

        assertEquals(0, refs.get(0).index());
        assertEquals(2, refs.get(2).index());
        assertEquals(3, more.get(0).index());
        assertEquals(4, registry.size());
    }

    @Test
    void secondAcquireIsRejectedWithoutBlocking() throws Exception {
        try (ImageRegistry.RunningLease lease = registry.acquire("run-cc")) {
            assertTrue(registry.isRunning());
            assertEquals("run-cc", registry.getRunningOperation());

            PreconditionException e = assertThrows(PreconditionException.class,
                    () -> registry.acquire("detect-chart"));
            assertEquals("detect-chart", e.getStage());
            assertTrue(e.getMessage().contains("run-cc"));
        }
        assertFalse(registry.isRunning());
        assertNull(registry.getRunningOperation());
    }

    @Test
    void leaseIsReleasedWhenTheBodyThrows() {
        assertThrows(IllegalStateException.class, () -> {
            try (ImageRegistry.RunningLease lease = registry.acquire("run-cc")) {
                throw new IllegalStateException("failure inside");
            }
        });
        assertFalse(registry.isRunning());
    }

    @Test
    void closingALeaseTwiceDoesNotReleaseAnotherOwner() throws Exception {
        ImageRegistry.RunningLease first = registry.acquire("first");
        first.close();
        ImageRegistry.RunningLease second = registry.acquire("second");

        first.close();

        assertTrue(registry.isRunning());
        assertEquals("second", registry.getRunningOperation());
        second.close();
    }

    @Test
    void setRunningTogglesTheGate() throws Exception {
        registry.setRunning(true);
        assertThrows(PreconditionException.class, () -> registry.setRunning(true));
        registry.setRunning(false);
        assertFalse(registry.isRunning());
    }

    @Test
    void clearWhileRunningIsRejected() throws Exception {
        try (ImageRegistry.RunningLease lease = registry.acquire("batch-parallel_train")) {
            assertThrows(PreconditionException.class, () -> registry.clear());
        }
        assertEquals(3, registry.size());
    }

    @Test
    void gateHolderClearsWithoutReleasing() throws Exception {
        ImageRegistry.RunningLease lease = registry.acquire("clear-session");
        registry.clear(lease);

        assertTrue(registry.isEmpty());
        assertTrue(registry.isRunning());
        assertThrows(PreconditionException.class, () -> registry.acquire("run-cc"));

        lease.close();
        assertFalse(registry.isRunning());
        assertThrows(IllegalStateException.class, () -> registry.clear(lease));

        ImageRegistry other = new ImageRegistry();
        try (ImageRegistry.RunningLease foreign = other.acquire("clear-session")) {
            assertThrows(IllegalStateException.class, () -> registry.clear(foreign));
        }
    }

    @Test
    void clearInvalidatesOldRefsAndState() throws Exception {
        registry.select(refs.get(1));
        registry.recordModel(refs.get(1));
        registry.recordChartDetection(refs.get(1), true);

        registry.clear();

        assertTrue(registry.isEmpty());
        assertTrue(registry.getSelected().isEmpty());
        assertFalse(registry.getModelStatus().available());
        assertThrows(PreconditionException.class, () -> registry.validate(refs.get(0)));

        List<ImageRef> fresh = registry.add(uploaded("a.jpg"));
        assertEquals(0, fresh.get(0).index());
        assertTrue(registry.getChartDetected(fresh.get(0)).isEmpty());
        // same index and name, different generation
        assertThrows(PreconditionException.class, () -> registry.select(refs.get(0)));
        registry.select(fresh.get(0));
    }

    @Test
    void validateRejectsUnknownRefs() {
        ImageRef foreign = new ImageRef(7, "1-7", "x.jpg", null, refs.get(0).generation());

        PreconditionException e = assertThrows(PreconditionException.class, () -> registry.validate(foreign));
        assertEquals(7, e.getImageIndex().getAsInt());
        assertThrows(PreconditionException.class, () -> registry.validate(null));
    }

    @Test
    void defaultApplyTargetsExcludeTheSelection() throws Exception {
        assertEquals(refs, registry.defaultApplyTargets());

        registry.select(refs.get(1));

        assertEquals(List.of(refs.get(0), refs.get(2)), registry.defaultApplyTargets());
    }

    @Test
    void modelWithUnknownSource() {
        registry.recordModel(null);

        assertTrue(registry.getModelStatus().available());
        assertNull(registry.getModelStatus().sourceImage());

        registry.clearModel();
        assertFalse(registry.getModelStatus().available());
    }
}
