package me.golemcore.groupdesk.adapter.outbound.agent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.groupdesk.domain.model.AgentProfile;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.AgentGenerationPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Generates mention autoresponses with the agent's configured LLM endpoint.
 *
 * <p>
 * The backend is picked from the agent's API URL:
 * <ul>
 * <li>{@code generativelanguage.googleapis.com} - Gemini
 * {@code generateContent}, key passed as query parameter</li>
 * <li>{@code openai.com} - OpenAI-compatible {@code chat/completions}, bearer
 * key</li>
 * <li>anything else - Gemini-style request</li>
 * </ul>
 * One request per call, no retry. Every failure is logged and mapped to an
 * empty result.
 */
@Component
@Slf4j
public class HttpAgentGenerationAdapter implements AgentGenerationPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String GEMINI_HOST = "generativelanguage.googleapis.com";
    private static final String OPENAI_HOST = "openai.com";
    private static final String OPENAI_MODEL = "gpt-3.5-turbo";
    private static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";

    private final GroupDeskProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpAgentGenerationAdapter(GroupDeskProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        long timeoutMs = properties.getAgent().getTimeoutMs();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public Optional<String> generate(AgentProfile agent, String prompt, String senderName, String groupName) {
        if (agent.getApiUrl() == null || agent.getApiUrl().isBlank()) {
            log.warn("[Agent] Agent {} has no API URL", agent.getName());
            return Optional.empty();
        }
        String systemPrompt = buildSystemPrompt(agent, senderName, groupName);
        try {
            String url = agent.getApiUrl().toLowerCase(Locale.ROOT);
            if (url.contains(OPENAI_HOST) && !url.contains(GEMINI_HOST)) {
                return callOpenAi(agent, systemPrompt, prompt);
            }
            return callGemini(agent, systemPrompt, prompt);
        } catch (Exception e) { // NOSONAR - generation failures must not reach the pipeline
            log.warn("[Agent] Generation failed for {}: {}", agent.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    static String buildSystemPrompt(AgentProfile agent, String senderName, String groupName) {
        String base = agent.getSystemPrompt() != null && !agent.getSystemPrompt().isBlank()
                ? agent.getSystemPrompt()
                : DEFAULT_SYSTEM_PROMPT;
        return base + "\n\n"
                + "You are responding to a message in the group '" + groupName + "'. "
                + "The message was sent by '" + senderName + "'. "
                + "Keep your response concise and friendly for a chat environment.";
    }

    private Optional<String> callGemini(AgentProfile agent, String systemPrompt, String prompt) throws IOException {
        HttpUrl base = HttpUrl.get(agent.getApiUrl());
        HttpUrl url = agent.getApiKey() != null
                ? base.newBuilder().addQueryParameter("key", agent.getApiKey()).build()
                : base;

        Map<String, Object> payload = Map.of(
                "contents", List.of(Map.of(
                        "parts", List.of(Map.of("text", systemPrompt + "\n\nUser message: " + prompt)))),
                "generationConfig", Map.of(
                        "maxOutputTokens", outputTokens(agent),
                        "temperature", properties.getAgent().getTemperature()));

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();

        return execute(request, root -> root.path("candidates").path(0).path("content").path("parts").path(0)
                .path("text"));
    }

    private Optional<String> callOpenAi(AgentProfile agent, String systemPrompt, String prompt) throws IOException {
        Map<String, Object> payload = Map.of(
                "model", OPENAI_MODEL,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", prompt)),
                "max_tokens", outputTokens(agent),
                "temperature", properties.getAgent().getTemperature());

        Request.Builder builder = new Request.Builder()
                .url(agent.getApiUrl())
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON));
        if (agent.getApiKey() != null && !agent.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + agent.getApiKey());
        }

        return execute(builder.build(), root -> root.path("choices").path(0).path("message").path("content"));
    }

    private Optional<String> execute(Request request, Function<JsonNode, JsonNode> extractor)
            throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("[Agent] API error: HTTP {}", response.code());
                return Optional.empty();
            }
            JsonNode text = extractor.apply(objectMapper.readTree(responseBody.string()));
            if (!text.isTextual() || text.asText().isBlank()) {
                log.warn("[Agent] Unexpected response structure");
                return Optional.empty();
            }
            return Optional.of(text.asText());
        }
    }

    private int outputTokens(AgentProfile agent) {
        return agent.getOutputTokenLimit() != null && agent.getOutputTokenLimit() > 0
                ? agent.getOutputTokenLimit()
                : properties.getAgent().getDefaultOutputTokens();
    }
}
