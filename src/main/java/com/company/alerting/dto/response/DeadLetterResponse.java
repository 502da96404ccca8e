package com.company.alerting.dto.response;

import com.company.alerting.domain.DeadLetterRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Dead letter summary. The stored payload is omitted; replay reads it server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterResponse {
    private Long deadLetterId;
    private String eventId;
    private String severity;
    private String channelType;
    private String endpoint;
    private String reason;
    private Integer attempts;
    private Instant createdAt;
    private Instant replayedAt;
    private String replayStatus;

    public static DeadLetterResponse from(DeadLetterRecord record) {
        return DeadLetterResponse.builder()
                .deadLetterId(record.getDeadLetterId())
                .eventId(record.getEventId())
                .severity(record.getSeverity())
                .channelType(record.getChannelType())
                .endpoint(record.getEndpoint())
                .reason(record.getReason())
                .attempts(record.getAttempts())
                .createdAt(record.getCreatedAt())
                .replayedAt(record.getReplayedAt())
                .replayStatus(record.getReplayStatus())
                .build();
    }
}
