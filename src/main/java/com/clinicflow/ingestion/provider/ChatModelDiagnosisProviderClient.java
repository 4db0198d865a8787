package com.clinicflow.ingestion.provider;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.ingestion.exception.ProviderUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Asks a chat model directly. The free-text reply is wrapped as {@code {"text": ...}} so it travels the
 * same inbound path as a webhook answer.
 */
@Component
@Slf4j
public class ChatModelDiagnosisProviderClient implements DiagnosisProviderClient {

    static final String SYSTEM_PROMPT = """
            You are a clinical decision support assistant for a medical practitioner.
            Analyse the patient case and answer with a single JSON object in a ```json fenced block.
            Required field: primary_diagnosis (string).
            Other fields: differential_diagnoses, recommended_actions, treatment (arrays of strings),
            inventory_drugs and additional_therapy (arrays of objects with drug_name, dosage, duration,
            instructions, prescription_required, and for inventory drugs the inventory id as drug_id),
            severity_level (critical, high, moderate or low), confidence_score (0 to 1),
            improved_patient_history, clinical_assessment and monitoring_plan.
            Only put drugs listed in user_drug_inventory into inventory_drugs, using their exact names.
            Answer in the language named by detected_language.
            """;
    static final String USER_TEMPLATE = "Patient case:\n{request}";

    private final ObjectProvider<ChatClient> chatClientProvider;
    private final ObjectMapper objectMapper;

    public ChatModelDiagnosisProviderClient(ObjectProvider<ChatClient> chatClientProvider, ObjectMapper objectMapper) {
        this.chatClientProvider = chatClientProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClinicFlowProperties.ProviderMode mode() {
        return ClinicFlowProperties.ProviderMode.CHAT_MODEL;
    }

    @Override
    public JsonNode requestDiagnosis(ObjectNode payload) {
        ChatClient chatClient = chatClientProvider.getIfAvailable();
        if (chatClient == null) {
            throw new ProviderUnavailableException("Chat model provider is not configured. "
                    + "Check the spring.ai.openai settings or switch clinicflow.provider.mode to WEBHOOK.");
        }
        String content;
        try {
            content = chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(user -> user.text(USER_TEMPLATE).param("request", payload.toPrettyString()))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.warn("Chat model call failed: {}", ex.getMessage());
            throw new ProviderUnavailableException("Chat model call failed: " + ex.getMessage(), ex);
        }
        return wrap(content);
    }

    private JsonNode wrap(@Nullable String content) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("text", content == null ? "" : content);
        return envelope;
    }
}
