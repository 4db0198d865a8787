package com.clinicflow.ingestion.provider;

import com.clinicflow.config.ClinicFlowProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Sends a diagnosis request to an external clinical-analysis provider and returns its raw answer.
 * Implementations throw {@link com.clinicflow.ingestion.exception.ProviderUnavailableException} when the
 * provider cannot be reached, and {@link com.clinicflow.ingestion.exception.TransportFormatException}
 * when the answer is not JSON.
 */
public interface DiagnosisProviderClient {

    ClinicFlowProperties.ProviderMode mode();

    JsonNode requestDiagnosis(ObjectNode payload);
}
