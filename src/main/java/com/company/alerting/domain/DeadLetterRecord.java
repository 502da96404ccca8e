package com.company.alerting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {
    private Long deadLetterId;
    private String eventId;
    private String severity;
    private String channelType;
    private String endpoint;
    private String reason;
    private Integer attempts;

    // JSON serialized EnrichedEvent and List<DeliveryAttempt>
    private String payload;
    private String history;

    private Instant createdAt;
    private Instant replayedAt;
    private String replayStatus;
}
