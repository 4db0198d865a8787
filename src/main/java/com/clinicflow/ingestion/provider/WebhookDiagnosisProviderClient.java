package com.clinicflow.ingestion.provider;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.ingestion.exception.ProviderUnavailableException;
import com.clinicflow.ingestion.exception.TransportFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts the request as JSON to the configured webhook (an automation workflow fronting the model).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookDiagnosisProviderClient implements DiagnosisProviderClient {

    private final RestClient providerRestClient;
    private final ObjectMapper objectMapper;
    private final ClinicFlowProperties properties;

    @Override
    public ClinicFlowProperties.ProviderMode mode() {
        return ClinicFlowProperties.ProviderMode.WEBHOOK;
    }

    @Override
    public JsonNode requestDiagnosis(ObjectNode payload) {
        String url = properties.getProvider().getWebhookUrl();
        if (!StringUtils.hasText(url)) {
            throw new ProviderUnavailableException("Provider webhook URL is not configured (clinicflow.provider.webhook-url)");
        }
        String body;
        try {
            body = providerRestClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException ex) {
            log.warn("Provider webhook call failed: {}", ex.getMessage());
            throw new ProviderUnavailableException("Provider webhook call failed: " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(body)) {
            throw new TransportFormatException("Provider webhook returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new TransportFormatException("Provider webhook returned a body that is not JSON", ex);
        }
    }
}
