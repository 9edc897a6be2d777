package com.delta.harvester.harvest.api;

import com.delta.harvester.harvest.model.CursorStatusResponse;
import com.delta.harvester.harvest.model.HarvestRunStatus;
import com.delta.harvester.harvest.service.HarvestRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/harvest")
public class HarvestController {
    private final HarvestRunService harvestRunService;

    public HarvestController(HarvestRunService harvestRunService) {
        this.harvestRunService = harvestRunService;
    }

    @PostMapping("/run")
    public HarvestRunStatus run() {
        return harvestRunService.run();
    }

    @GetMapping("/status")
    public HarvestRunStatus status() {
        return harvestRunService.getLastStatus()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No harvest run recorded yet"));
    }

    @GetMapping("/cursor")
    public CursorStatusResponse cursor() {
        return harvestRunService.getCursorStatus();
    }
}
