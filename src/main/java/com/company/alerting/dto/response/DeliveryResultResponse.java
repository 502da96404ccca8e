package com.company.alerting.dto.response;

import com.company.alerting.domain.DeliveryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResultResponse {
    private String eventId;
    private String channelType;
    private String endpoint;
    private String status;
    private int attempts;
    private String lastError;

    public static DeliveryResultResponse from(DeliveryResult result) {
        return DeliveryResultResponse.builder()
                .eventId(result.getEventId())
                .channelType(result.getChannelType() != null ? result.getChannelType().name() : null)
                .endpoint(result.getEndpoint())
                .status(result.getStatus().name())
                .attempts(result.getAttempts())
                .lastError(result.getLastError())
                .build();
    }
}
