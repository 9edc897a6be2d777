package com.delta.harvester.harvest.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.HarvestRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestRunService harvestRunService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestRunService harvestRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.harvestRunService = harvestRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        HarvestRunStatus status = harvestRunService.run();
        log.info(
            "Harvest finished with {}: pages={}/{} errors={} empty={} abandoned={} cooldowns={}",
            status.stopReason(),
            status.pagesSucceeded(),
            status.pagesAttempted(),
            status.errorPages(),
            status.emptyPages(),
            status.abandonedPages(),
            status.cooldownsUsed()
        );
        log.info(
            "Cursor nextPage={} baselineComplete={} failedQueue={} new={} updated={} state={}",
            status.nextPage(),
            status.baselineComplete(),
            status.failedQueueSize(),
            status.newCount(),
            status.updatedCount(),
            status.stateSize()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
