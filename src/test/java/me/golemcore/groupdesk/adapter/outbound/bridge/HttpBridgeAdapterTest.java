package me.golemcore.groupdesk.adapter.outbound.bridge;

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeStatus;
import me.golemcore.groupdesk.infrastructure.config.AutoConfiguration;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.infrastructure.http.FeignClientFactory;
import me.golemcore.groupdesk.infrastructure.http.OkHttpConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpBridgeAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final String TENANT = "tenant-1";
    private static final String GROUP = "120363@g.us";

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MockWebServer mockServer;
    private GroupDeskProperties properties;
    private HttpBridgeAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new GroupDeskProperties();
        properties.getBridge().setBaseUrl(mockServer.url("/").toString());
        properties.getBridge().setReadTimeoutMs(500);
        properties.getBridge().setConnectTimeoutMs(500);

        FeignClientFactory factory = new FeignClientFactory(new OkHttpConfig(properties).okHttpClient(),
                objectMapper);
        adapter = new HttpBridgeAdapter(factory, properties, objectMapper);
        adapter.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void sendTextPostsMentionsToGroupEndpoint() throws Exception {
        mockServer.enqueue(json("{\"success\": true}"));

        BridgeResult result = adapter.sendText(TENANT, GROUP, "Hello", false, List.of("111", "222"));

        assertTrue(result.isSuccess());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertTrue(request.getPath().startsWith("/api/clients/tenant-1/groups/"));
        assertTrue(request.getPath().endsWith("/send"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("Hello", body.get("content").asText());
        assertFalse(body.get("mentionAll").asBoolean());
        assertEquals(2, body.get("mentionIds").size());
    }

    @Test
    void sendPollUsesBridgeFieldNames() throws Exception {
        mockServer.enqueue(json("{\"success\": true}"));

        adapter.sendPoll(TENANT, GROUP, "Lunch?", List.of("Pizza", "Sushi"), true, true, List.of());

        RecordedRequest request = mockServer.takeRequest();
        assertTrue(request.getPath().endsWith("/send-poll"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("Lunch?", body.get("question").asText());
        assertTrue(body.get("allowMultipleAnswers").asBoolean());
        assertTrue(body.get("mentionAll").asBoolean());
    }

    @Test
    void setGroupModeSendsAdminOnlyFlag() throws Exception {
        mockServer.enqueue(json("{\"success\": true}"));

        assertTrue(adapter.setGroupMode(TENANT, GROUP, true).isSuccess());

        RecordedRequest request = mockServer.takeRequest();
        assertTrue(request.getPath().endsWith("/settings"));
        assertTrue(objectMapper.readTree(request.getBody().readUtf8()).get("messagesAdminOnly").asBoolean());
    }

    @Test
    void sendMediaAndDeleteMediaUseFilePath() throws Exception {
        mockServer.enqueue(json("{\"success\": true}"));
        mockServer.enqueue(json("{\"success\": true}"));

        adapter.sendMedia(TENANT, GROUP, "/media/flyer.png", "Caption", false, List.of());
        adapter.deleteMedia("/media/flyer.png");

        RecordedRequest send = mockServer.takeRequest();
        assertTrue(send.getPath().endsWith("/send-media-from-path"));
        assertEquals("/media/flyer.png", objectMapper.readTree(send.getBody().readUtf8()).get("filePath").asText());

        RecordedRequest delete = mockServer.takeRequest();
        assertEquals("DELETE", delete.getMethod());
        assertEquals("/api/clients/media", delete.getPath());
    }

    @Test
    void returnsBridgeErrorFromFailedResponse() {
        mockServer.enqueue(json("{\"success\": false, \"error\": \"Client not ready\"}"));

        BridgeResult result = adapter.sendText(TENANT, GROUP, "Hello", false, List.of());

        assertFalse(result.isSuccess());
        assertEquals("Client not ready", result.getError());
        assertFalse(result.isTransient());
    }

    @Test
    void extractsErrorFromHttpErrorBody() {
        mockServer.enqueue(json("{\"success\": false, \"error\": \"Group not found\"}").setResponseCode(404));
        mockServer.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertEquals("Group not found", adapter.sendText(TENANT, GROUP, "a", false, List.of()).getError());
        assertEquals("HTTP 500", adapter.sendText(TENANT, GROUP, "b", false, List.of()).getError());
    }

    @Test
    void mapsReadTimeoutToTransientFailure() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        BridgeResult result = adapter.sendText(TENANT, GROUP, "Hello", false, List.of());

        assertFalse(result.isSuccess());
        assertEquals(HttpBridgeAdapter.TIMEOUT_ERROR, result.getError());
        assertTrue(result.isTransient());
    }

    @Test
    void mapsConnectionFailureToPermanentFailure() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String deadUrl = stopped.url("/").toString();
        stopped.shutdown();
        properties.getBridge().setBaseUrl(deadUrl);
        HttpBridgeAdapter unreachable = new HttpBridgeAdapter(
                new FeignClientFactory(new OkHttpConfig(properties).okHttpClient(), objectMapper),
                properties, objectMapper);
        unreachable.init();

        BridgeResult result = unreachable.initSession(TENANT);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Bridge unreachable"));
    }

    @Test
    void getStatusParsesReadyFlag() {
        mockServer.enqueue(json("{\"status\": \"ready\", \"hasQR\": false}"));

        BridgeStatus status = adapter.getStatus(TENANT);

        assertTrue(status.isReady());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON);
    }
}
