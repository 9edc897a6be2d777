package com.delta.harvester.harvest.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.HarvestRunStatus;
import com.delta.harvester.harvest.model.StopReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HarvestCliRunnerTest {

    @Mock
    private HarvestRunService harvestRunService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void doesNothingUnlessEnabled() {
        HarvesterProperties properties = new HarvesterProperties();

        new HarvestCliRunner(properties, harvestRunService, applicationContext).run(new DefaultApplicationArguments());

        verify(harvestRunService, never()).run();
    }

    @Test
    void runsOneHarvestWhenEnabled() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        Instant now = Instant.parse("2026-03-01T06:00:00Z");
        when(harvestRunService.run()).thenReturn(new HarvestRunStatus(
            now, now, 0L, StopReason.WORKLIST_EXHAUSTED, 3, 3, List.of(), List.of(), List.of(), 0,
            false, 4, 0, 9, 9, true, false, 0, 0, 0, 0, 9
        ));

        new HarvestCliRunner(properties, harvestRunService, applicationContext).run(new DefaultApplicationArguments());

        verify(harvestRunService).run();
    }
}
