package com.pricewatch.tracker.harvest.api;

import com.pricewatch.tracker.harvest.model.HarvestPassRequest;
import com.pricewatch.tracker.harvest.model.HarvestStatusResponse;
import com.pricewatch.tracker.harvest.service.HarvestOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/harvest")
public class HarvestController {
    private final HarvestOrchestratorService orchestratorService;

    public HarvestController(HarvestOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @GetMapping("/status")
    public HarvestStatusResponse status() {
        return orchestratorService.status();
    }

    @PostMapping("/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public HarvestStatusResponse run(@RequestBody(required = false) HarvestApiRunRequest request) {
        HarvestPassRequest passRequest = new HarvestPassRequest(
            request == null || request.items() == null ? List.of() : request.items(),
            request != null && Boolean.TRUE.equals(request.force()),
            request == null ? null : request.workers()
        );
        orchestratorService.startAsync(passRequest);
        return orchestratorService.status();
    }

    @PostMapping("/stop")
    public HarvestStatusResponse stop() {
        orchestratorService.requestStop();
        return orchestratorService.status();
    }
}
