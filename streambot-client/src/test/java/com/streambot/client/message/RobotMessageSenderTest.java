package com.streambot.client.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.StreamException;
import com.streambot.client.credential.ClientIdentity;
import com.streambot.client.credential.Credentials;
import com.streambot.client.negotiate.TokenNegotiator;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RobotMessageSenderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private Credentials credentials;
    private RobotMessageSender sender;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        credentials = new Credentials(new ClientIdentity("robot-code", "secret"), "ua", 8000, 1000);
        credentials.storeToken("T1", Instant.now().plusSeconds(3600));
        TokenNegotiator negotiator = new TokenNegotiator(credentials, new OkHttpClient(),
                server.url("/gettoken").toString(), server.url("/gateway").toString(), Clock.systemUTC());
        OpenApiClient openApi = new OpenApiClient(negotiator, new OkHttpClient(), mapper, server.url("/").toString());
        sender = new RobotMessageSender(openApi, mapper, "robot-code");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendToGroup_postsTemplateAsMsgParam() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"processQueryKey\":\"pqk-1\"}"));

        String key = sender.sendToGroup("cid-1", new MessageTemplate.SampleText("hello"));

        assertEquals("pqk-1", key);
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1.0/robot/groupMessages/send", request.getPath());
        assertEquals("T1", request.getHeader("x-acs-dingtalk-access-token"));
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("robot-code", body.get("robotCode").asText());
        assertEquals("cid-1", body.get("openConversationId").asText());
        assertEquals("sampleText", body.get("msgKey").asText());
        assertEquals("hello", mapper.readTree(body.get("msgParam").asText()).get("content").asText());
    }

    @Test
    void sendToUser_isBatchOfOne() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"processQueryKey\":\"pqk-2\",\"invalidStaffIdList\":[]}"));

        sender.sendToUser("u1", new MessageTemplate.SampleImageMsg("https://img.example/a.png"));

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1.0/robot/oToMessages/batchSend", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals(1, body.get("userIds").size());
        assertEquals("u1", body.get("userIds").get(0).asText());
        assertEquals("sampleImageMsg", body.get("msgKey").asText());
        JsonNode param = mapper.readTree(body.get("msgParam").asText());
        assertEquals("https://img.example/a.png", param.get("photoURL").asText());
    }

    @Test
    void actionCardFieldNames_matchWireFormat() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        sender.sendToUsers(List.of("u1", "u2"), new MessageTemplate.SampleActionCard2(
                "t", "body", "Yes", "https://a", "No", "https://b"));

        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        JsonNode param = mapper.readTree(body.get("msgParam").asText());
        assertEquals("sampleActionCard2", body.get("msgKey").asText());
        assertEquals("Yes", param.get("actionTitle1").asText());
        assertEquals("https://b", param.get("actionURL2").asText());
        assertFalse(param.has("msgKey"));
    }

    @Test
    void httpError_isStreamException() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"code\":\"InvalidParameter\"}"));

        assertThrows(StreamException.class,
                () -> sender.sendToGroup("cid-1", new MessageTemplate.SampleMarkdown("t", "**x**")));
    }

    @Test
    void unauthorized_dropsCachedToken() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThrows(StreamException.class,
                () -> sender.sendToGroup("cid-1", new MessageTemplate.SampleText("x")));
        assertTrue(credentials.cachedToken(Instant.now()).isEmpty());
    }

    @Test
    void emptyRecipients_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> sender.sendToUsers(List.of(), new MessageTemplate.SampleText("x")));
    }
}
