package com.company.alerting.controller;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.suppression.AlarmStateTable;
import com.company.alerting.suppression.SuppressionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Engine status")
@RequiredArgsConstructor
public class HealthController {

    private final EngineConfig config;
    private final SuppressionEngine suppressionEngine;
    private final AlarmStateTable stateTable;

    @GetMapping
    @Operation(summary = "Engine status")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "alert-engine");
        response.put("environment", config.getEnvironment());
        response.put("suppressionRules", suppressionEngine.ruleCount());
        response.put("subscriptions", config.getSubscriptions().size());
        response.put("trackedAlarms", stateTable.size());
        response.put("heldNotifications", suppressionEngine.heldCount());

        return ResponseEntity.ok(response);
    }
}
