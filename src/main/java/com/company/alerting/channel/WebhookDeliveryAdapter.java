package com.company.alerting.channel;

import com.company.alerting.config.EngineConfig;
import com.company.alerting.domain.EnrichedEvent;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.exception.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP POST delivery. Endpoints subscribed with auto-confirm must complete a confirmation
 * handshake before their first notification; confirmed endpoints are remembered for the
 * lifetime of the process.
 */
@Component
@Slf4j
public class WebhookDeliveryAdapter implements DeliveryAdapter {

    public static final String MESSAGE_TYPE_HEADER = "X-Alert-Message-Type";
    public static final String NOTIFICATION = "Notification";
    public static final String SUBSCRIPTION_CONFIRMATION = "SubscriptionConfirmation";

    private final RestTemplate restTemplate;
    private final RestTemplate confirmationRestTemplate;
    private final ObjectMapper objectMapper;
    private final Set<String> autoConfirmEndpoints;

    private final Set<String> confirmed = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, Object> confirmationLocks = new ConcurrentHashMap<>();

    public WebhookDeliveryAdapter(@Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                                  @Qualifier("confirmationRestTemplate") RestTemplate confirmationRestTemplate,
                                  ObjectMapper objectMapper,
                                  EngineConfig config) {
        this.restTemplate = restTemplate;
        this.confirmationRestTemplate = confirmationRestTemplate;
        this.objectMapper = objectMapper;
        this.autoConfirmEndpoints = Set.copyOf(config.autoConfirmEndpoints());
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.WEBHOOK;
    }

    /**
     * Performs the confirmation handshake for auto-confirm endpoints, bounded only by the
     * confirmation read timeout.
     */
    @Override
    public void prepare(String endpoint) {
        if (autoConfirmEndpoints.contains(endpoint)) {
            ensureConfirmed(endpoint, parse(endpoint));
        }
    }

    @Override
    public void send(String endpoint, EnrichedEvent event) {
        URI uri = parse(endpoint);

        if (autoConfirmEndpoints.contains(endpoint)) {
            ensureConfirmed(endpoint, uri);
        }

        String body = toJson(AlertMessage.from(event));
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.POST, entity(body, NOTIFICATION), String.class);
        } catch (HttpStatusCodeException e) {
            throw classify(endpoint, e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw DeliveryException.transientFailure("Webhook " + endpoint + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw DeliveryException.transientFailure("Webhook " + endpoint + " failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw classify(endpoint, response.getStatusCode(), null);
        }
        log.debug("Webhook {} accepted event {} with {}", endpoint, event.getEventId(), response.getStatusCode());
    }

    public boolean isConfirmed(String endpoint) {
        return confirmed.contains(endpoint);
    }

    private void ensureConfirmed(String endpoint, URI uri) {
        if (confirmed.contains(endpoint)) {
            return;
        }
        synchronized (confirmationLocks.computeIfAbsent(endpoint, k -> new Object())) {
            if (confirmed.contains(endpoint)) {
                return;
            }
            confirm(endpoint, uri);
            confirmed.add(endpoint);
            log.info("Webhook endpoint {} confirmed", endpoint);
        }
    }

    private void confirm(String endpoint, URI uri) {
        String token = UUID.randomUUID().toString();
        String body = toJson(Map.of("type", SUBSCRIPTION_CONFIRMATION, "token", token));

        ResponseEntity<String> response;
        try {
            response = confirmationRestTemplate.exchange(
                    uri, HttpMethod.POST, entity(body, SUBSCRIPTION_CONFIRMATION), String.class);
        } catch (RestClientException e) {
            // Includes timeouts: an endpoint that cannot confirm in time is never going to receive alerts
            throw DeliveryException.permanentFailure(
                    "Confirmation handshake with " + endpoint + " failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || !echoesToken(response.getBody(), token)) {
            throw DeliveryException.permanentFailure(
                    "Confirmation handshake with " + endpoint + " was not acknowledged", null);
        }
    }

    private boolean echoesToken(String body, String token) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && token.equals(node.path("token").asText(null));
        } catch (JsonProcessingException e) {
            log.warn("Confirmation response is not JSON: {}", e.getOriginalMessage());
            return false;
        }
    }

    private DeliveryException classify(String endpoint, HttpStatusCode status, Throwable cause) {
        String message = "Webhook " + endpoint + " responded " + status.value();
        if (status.value() == 429 || status.is5xxServerError()) {
            return DeliveryException.transientFailure(message, cause);
        }
        return DeliveryException.permanentFailure(message, cause);
    }

    private HttpEntity<String> entity(String body, String messageType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(MESSAGE_TYPE_HEADER, messageType);
        return new HttpEntity<>(body, headers);
    }

    private URI parse(String endpoint) {
        try {
            URI uri = new URI(endpoint);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw DeliveryException.permanentFailure("Malformed webhook URL " + endpoint, null);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw DeliveryException.permanentFailure("Malformed webhook URL " + endpoint, e);
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw DeliveryException.permanentFailure("Cannot serialize webhook payload", e);
        }
    }
}
