package com.clinicflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class ProviderClientConfig {

    private static final int MAX_LOGGED_BODY = 2000;

    @Bean
    public RestClient providerRestClient(ClinicFlowProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getProvider().getTimeout());
        requestFactory.setReadTimeout(properties.getProvider().getTimeout());
        return RestClient.builder()
                // buffering lets the interceptor log the body and the caller still read it
                .requestFactory(new BufferingClientHttpRequestFactory(requestFactory))
                .requestInterceptor(new LoggingRequestInterceptor())
                .build();
    }

    @Bean
    public ChatClient diagnosisChatClient(ObjectProvider<ChatModel> chatModelProvider) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            log.info("No chat model configured; CHAT_MODEL provider mode is unavailable.");
            return null;
        }
        return ChatClient.builder(chatModel).build();
    }

    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.clinicflow.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            httpLogger.debug("Provider request: {} {} ({} bytes)", request.getMethod(), request.getURI(), body.length);
            if (body.length > 0) {
                httpLogger.debug("Provider request body: {}", abbreviate(new String(body, StandardCharsets.UTF_8)));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            try {
                httpLogger.debug("Provider response status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("Provider response status: unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Provider response body: {}", abbreviate(new String(body, StandardCharsets.UTF_8)));
            }
        }

        private static String abbreviate(String value) {
            return value.length() <= MAX_LOGGED_BODY ? value : value.substring(0, MAX_LOGGED_BODY) + "...";
        }
    }
}
