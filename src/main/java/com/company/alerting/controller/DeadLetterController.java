package com.company.alerting.controller;

import com.company.alerting.domain.DeliveryResult;
import com.company.alerting.dto.response.DeadLetterResponse;
import com.company.alerting.dto.response.DeliveryResultResponse;
import com.company.alerting.security.CallerContext;
import com.company.alerting.service.DeadLetterReplayService;
import com.company.alerting.service.DeadLetterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/dead-letters")
@Tag(name = "Dead Letters", description = "Inspect and replay failed deliveries")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class DeadLetterController {

    private final DeadLetterService deadLetterService;
    private final DeadLetterReplayService replayService;
    private final CallerContext callerContext;

    @GetMapping
    @Operation(summary = "List recent dead letters")
    @PreAuthorize("hasRole('OPERATOR')")
    public ResponseEntity<List<DeadLetterResponse>> list(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(deadLetterService.recent(limit).stream()
                .map(DeadLetterResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{deadLetterId}")
    @Operation(summary = "Get a dead letter")
    @PreAuthorize("hasRole('OPERATOR')")
    public ResponseEntity<DeadLetterResponse> get(@PathVariable long deadLetterId) {
        return ResponseEntity.ok(DeadLetterResponse.from(deadLetterService.get(deadLetterId)));
    }

    @PostMapping("/{deadLetterId}/replay")
    @Operation(summary = "Replay a dead letter to its original channel and endpoint")
    @PreAuthorize("hasRole('OPERATOR')")
    public ResponseEntity<DeliveryResultResponse> replay(@PathVariable long deadLetterId) {
        log.info("Dead letter {} replay requested by {}", deadLetterId, callerContext.getCurrentCallerId());
        DeliveryResult result = replayService.replay(deadLetterId);
        return ResponseEntity.ok(DeliveryResultResponse.from(result));
    }
}
