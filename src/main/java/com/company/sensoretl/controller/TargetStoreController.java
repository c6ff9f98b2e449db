package com.company.sensoretl.controller;

import com.company.sensoretl.dto.response.TargetSummaryResponse;
import com.company.sensoretl.service.SignalProvisioningService;
import com.company.sensoretl.service.TargetSummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Target store", description = "Signal registry provisioning and loaded data overview")
@RequiredArgsConstructor
public class TargetStoreController {

    private final TargetSummaryService summaryService;
    private final SignalProvisioningService provisioningService;

    @GetMapping("/target/summary")
    @Operation(summary = "Totals, time range, per-signal statistics and daily distribution of loaded data")
    public ResponseEntity<TargetSummaryResponse> getSummary() {
        return ResponseEntity.ok(summaryService.summarize());
    }

    @PostMapping("/signals/provision")
    @Operation(summary = "Insert catalog signals missing from the registry")
    public ResponseEntity<Map<String, Object>> provisionSignals() {
        List<String> inserted = provisioningService.provisionMissing();

        Map<String, Object> response = new HashMap<>();
        response.put("inserted", inserted);
        response.put("insertedCount", inserted.size());
        return ResponseEntity.ok(response);
    }
}
