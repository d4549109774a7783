package me.golemcore.groupdesk.adapter.outbound.bridge;

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

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeStatus;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.infrastructure.http.FeignClientFactory;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * REST client for the bridge service that drives the tenants' chat sessions.
 *
 * <p>
 * Each call carries the connect/read timeouts from {@code groupdesk.bridge.*}.
 * Remote failures are returned as {@link BridgeResult#failed(String)}, never
 * thrown:
 * <ul>
 * <li>timeouts become {@value #TIMEOUT_ERROR}, which the retry policy treats
 * as transient</li>
 * <li>non-2xx responses carry the bridge's own {@code error} text, or
 * {@code HTTP <status>} when the body has none</li>
 * </ul>
 * Feign's retryer is disabled; retries are decided by the domain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpBridgeAdapter implements BridgePort {

    static final String TIMEOUT_ERROR = "Request timed out - bridge service is busy";

    private final FeignClientFactory feignClientFactory;
    private final GroupDeskProperties properties;
    private final ObjectMapper objectMapper;

    private BridgeApi api;

    @PostConstruct
    public void init() {
        GroupDeskProperties.BridgeProperties bridge = properties.getBridge();
        String baseUrl = bridge.getBaseUrl().replaceAll("/+$", "");
        this.api = feignClientFactory.createWithoutRetry(BridgeApi.class, baseUrl,
                Duration.ofMillis(bridge.getConnectTimeoutMs()),
                Duration.ofMillis(bridge.getReadTimeoutMs()));
        log.info("[Bridge] Client initialized for {}", baseUrl);
    }

    @Override
    public BridgeResult initSession(String tenantId) {
        return call("init " + tenantId, () -> api.init(tenantId));
    }

    @Override
    public BridgeStatus getStatus(String tenantId) {
        return api.status(tenantId);
    }

    @Override
    public BridgeResult sendText(String tenantId, String groupId, String content, boolean mentionAll,
            List<String> mentionIds) {
        return call("send " + groupId,
                () -> api.send(tenantId, groupId, new TextRequest(content, mentionAll, mentionIds)));
    }

    @Override
    public BridgeResult sendMedia(String tenantId, String groupId, String mediaReference, String caption,
            boolean mentionAll, List<String> mentionIds) {
        return call("send-media " + groupId, () -> api.sendMedia(tenantId, groupId,
                new MediaRequest(mediaReference, caption, mentionAll, mentionIds)));
    }

    @Override
    public BridgeResult sendPoll(String tenantId, String groupId, String question, List<String> options,
            boolean allowMultiple, boolean mentionAll, List<String> mentionIds) {
        return call("send-poll " + groupId, () -> api.sendPoll(tenantId, groupId,
                new PollRequest(question, options, allowMultiple, mentionAll, mentionIds)));
    }

    @Override
    public BridgeResult setGroupMode(String tenantId, String groupId, boolean adminOnly) {
        return call("settings " + groupId,
                () -> api.settings(tenantId, groupId, new SettingsRequest(adminOnly)));
    }

    @Override
    public BridgeResult sendWelcome(String tenantId, String groupId, String content, List<String> joinerPhones,
            List<String> extraMentionPhones) {
        return call("send-welcome " + groupId, () -> api.sendWelcome(tenantId, groupId,
                new WelcomeRequest(content, joinerPhones, extraMentionPhones)));
    }

    @Override
    public BridgeResult deleteMedia(String mediaReference) {
        return call("delete-media", () -> api.deleteMedia(new DeleteMediaRequest(mediaReference)));
    }

    private BridgeResult call(String operation, Supplier<BridgeResult> request) {
        try {
            BridgeResult result = request.get();
            if (result == null) {
                return BridgeResult.failed("Empty response from bridge");
            }
            if (!result.isSuccess()) {
                log.debug("[Bridge] {} rejected: {}", operation, result.getError());
            }
            return result;
        } catch (RetryableException e) {
            if (isTimeout(e)) {
                log.warn("[Bridge] {} timed out", operation);
                return BridgeResult.failed(TIMEOUT_ERROR);
            }
            log.warn("[Bridge] {} failed: {}", operation, e.getMessage());
            return BridgeResult.failed("Bridge unreachable: " + e.getMessage());
        } catch (FeignException e) {
            log.warn("[Bridge] {} returned HTTP {}", operation, e.status());
            return BridgeResult.failed(errorFromBody(e));
        } catch (RuntimeException e) { // NOSONAR - the port contract is to never throw
            log.error("[Bridge] {} failed unexpectedly", operation, e);
            return BridgeResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static boolean isTimeout(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof InterruptedIOException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private String errorFromBody(FeignException e) {
        String body = e.contentUTF8();
        if (body != null && !body.isBlank()) {
            try {
                BridgeResult parsed = objectMapper.readValue(body, BridgeResult.class);
                if (parsed.getError() != null && !parsed.getError().isBlank()) {
                    return parsed.getError();
                }
            } catch (Exception parseError) { // NOSONAR - fall back to the status code
                log.debug("[Bridge] Non-JSON error body: {}", body);
            }
        }
        return "HTTP " + e.status();
    }

    interface BridgeApi {

        @RequestLine("POST /api/clients/{tenantId}/init")
        @Headers("Content-Type: application/json")
        BridgeResult init(@Param("tenantId") String tenantId);

        @RequestLine("GET /api/clients/{tenantId}/status")
        BridgeStatus status(@Param("tenantId") String tenantId);

        @RequestLine("POST /api/clients/{tenantId}/groups/{groupId}/send")
        @Headers("Content-Type: application/json")
        BridgeResult send(@Param("tenantId") String tenantId, @Param("groupId") String groupId,
                TextRequest request);

        @RequestLine("POST /api/clients/{tenantId}/groups/{groupId}/send-media-from-path")
        @Headers("Content-Type: application/json")
        BridgeResult sendMedia(@Param("tenantId") String tenantId, @Param("groupId") String groupId,
                MediaRequest request);

        @RequestLine("POST /api/clients/{tenantId}/groups/{groupId}/send-poll")
        @Headers("Content-Type: application/json")
        BridgeResult sendPoll(@Param("tenantId") String tenantId, @Param("groupId") String groupId,
                PollRequest request);

        @RequestLine("POST /api/clients/{tenantId}/groups/{groupId}/settings")
        @Headers("Content-Type: application/json")
        BridgeResult settings(@Param("tenantId") String tenantId, @Param("groupId") String groupId,
                SettingsRequest request);

        @RequestLine("POST /api/clients/{tenantId}/groups/{groupId}/send-welcome")
        @Headers("Content-Type: application/json")
        BridgeResult sendWelcome(@Param("tenantId") String tenantId, @Param("groupId") String groupId,
                WelcomeRequest request);

        @RequestLine("DELETE /api/clients/media")
        @Headers("Content-Type: application/json")
        BridgeResult deleteMedia(DeleteMediaRequest request);
    }

    // Request DTOs

    @Data
    @AllArgsConstructor
    static class TextRequest {
        private String content;
        private boolean mentionAll;
        private List<String> mentionIds;
    }

    @Data
    @AllArgsConstructor
    static class MediaRequest {
        private String filePath;
        private String caption;
        private boolean mentionAll;
        private List<String> mentionIds;
    }

    @Data
    @AllArgsConstructor
    static class PollRequest {
        private String question;
        private List<String> options;
        private boolean allowMultipleAnswers;
        private boolean mentionAll;
        private List<String> mentionIds;
    }

    @Data
    @AllArgsConstructor
    static class SettingsRequest {
        private boolean messagesAdminOnly;
    }

    @Data
    @AllArgsConstructor
    static class WelcomeRequest {
        private String content;
        private List<String> joinerPhones;
        private List<String> extraMentionPhones;
    }

    @Data
    @AllArgsConstructor
    static class DeleteMediaRequest {
        private String filePath;
    }
}
