package com.harvest.coordinator.config;

import com.harvest.coordinator.crawl.model.LimitAction;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoordinatorPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getFetch().setUserAgent("   ");
        assertTrue(properties.getFetch().getUserAgent().startsWith("harvest-coordinator/0.1"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getFetch().setConcurrency(0);
        properties.getFetch().setPerHostDelayMs(-10);
        properties.getFetch().setMaxBodyBytes(10);
        properties.setMaxConcurrentJobs(-1);
        assertEquals(1, properties.getFetch().getConcurrency());
        assertEquals(1, properties.getFetch().getPerHostDelayMs());
        assertEquals(1024, properties.getFetch().getMaxBodyBytes());
        assertEquals(1, properties.getMaxConcurrentJobs());
    }

    @Test
    void failureThresholdAndCheckpointSettingsAreClamped() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getLimits().setFailureRateThreshold(3.0);
        properties.getCheckpoint().setIntervalPages(0);
        properties.getCheckpoint().setKeepLast(-4);
        properties.getEvents().setRingCapacity(0);
        properties.getLimits().setDurationCheckSeconds(0);
        assertEquals(1.0, properties.getLimits().getFailureRateThreshold());
        assertEquals(1, properties.getCheckpoint().getIntervalPages());
        assertEquals(1, properties.getCheckpoint().getKeepLast());
        assertEquals(1, properties.getEvents().getRingCapacity());
        assertEquals(1, properties.getLimits().getDurationCheckSeconds());
    }

    @Test
    void partialPrecedenceIsCompletedAndDeduplicated() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getLimits().setPrecedence(Arrays.asList(LimitAction.WARN, null, LimitAction.WARN, LimitAction.PAUSE));
        assertEquals(
            List.of(LimitAction.WARN, LimitAction.PAUSE, LimitAction.CANCEL, LimitAction.STOP),
            properties.getLimits().getPrecedence()
        );

        properties.getLimits().setPrecedence(null);
        assertEquals(
            List.of(LimitAction.CANCEL, LimitAction.STOP, LimitAction.PAUSE, LimitAction.WARN),
            properties.getLimits().getPrecedence()
        );
    }
}
