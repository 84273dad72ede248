package com.streambot.client.negotiate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.AuthException;
import com.streambot.client.NegotiationException;
import com.streambot.client.credential.ClientIdentity;
import com.streambot.client.credential.Credentials;
import com.streambot.client.credential.Subscription;
import com.streambot.client.credential.SubscriptionType;
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
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenNegotiatorTest {

    private MockWebServer server;
    private MutableClock clock;
    private Credentials credentials;
    private TokenNegotiator negotiator;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        credentials = new Credentials(new ClientIdentity("ding-app", "ding-secret"), "streambot-test", 8000, 1000);
        negotiator = new TokenNegotiator(credentials, new OkHttpClient(),
                server.url("/gettoken").toString(),
                server.url("/v1.0/gateway/connections/open").toString(),
                clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse tokenResponse(String token, long expiresIn) {
        return new MockResponse().setBody(
                "{\"errcode\":0,\"errmsg\":\"ok\",\"access_token\":\"" + token + "\",\"expires_in\":" + expiresIn + "}");
    }

    @Test
    void getToken_fetchesAndStoresExpiry() throws Exception {
        server.enqueue(tokenResponse("T1", 7200));

        assertEquals("T1", negotiator.getToken());

        assertEquals(clock.instant().plusSeconds(7200), credentials.getTokenExpiresAt());
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("ding-app", request.getRequestUrl().queryParameter("appkey"));
        assertEquals("ding-secret", request.getRequestUrl().queryParameter("appsecret"));
    }

    @Test
    void getToken_servesCachedTokenBeforeExpiry() throws Exception {
        server.enqueue(tokenResponse("T1", 7200));

        assertEquals("T1", negotiator.getToken());
        clock.advanceSeconds(3600);
        assertEquals("T1", negotiator.getToken());

        assertEquals(1, server.getRequestCount());
    }

    @Test
    void getToken_camelCaseResponse_cachedForExpiresIn() throws Exception {
        Instant t0 = clock.instant();
        server.enqueue(new MockResponse().setBody(
                "{\"errcode\":0,\"accessToken\":\"T1\",\"errmsg\":\"\",\"expiresIn\":7200}"));

        assertEquals("T1", negotiator.getToken());
        clock.advanceSeconds(10);
        assertEquals("T1", negotiator.getToken());

        assertEquals(1, server.getRequestCount());
        assertEquals(t0.plusSeconds(7200), credentials.getTokenExpiresAt());
    }

    @Test
    void getToken_refetchesOnceAfterExpiry() throws Exception {
        server.enqueue(tokenResponse("T1", 60));
        server.enqueue(tokenResponse("T2", 60));

        assertEquals("T1", negotiator.getToken());
        clock.advanceSeconds(61);
        assertEquals("T2", negotiator.getToken());
        assertEquals("T2", negotiator.getToken());

        assertEquals(2, server.getRequestCount());
    }

    @Test
    void invalidateToken_forcesFetch() throws Exception {
        server.enqueue(tokenResponse("T1", 7200));
        server.enqueue(tokenResponse("T2", 7200));

        negotiator.getToken();
        negotiator.invalidateToken();

        assertEquals("T2", negotiator.getToken());
    }

    @Test
    void getToken_nonZeroErrcode_isAuthError() {
        server.enqueue(new MockResponse().setBody("{\"errcode\":40089,\"errmsg\":\"invalid appkey\"}"));

        AuthException e = assertThrows(AuthException.class, () -> negotiator.getToken());

        assertTrue(e.getMessage().contains("40089"));
        assertTrue(credentials.cachedToken(clock.instant()).isEmpty());
    }

    @Test
    void getToken_httpFailure_isAuthError() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThrows(AuthException.class, () -> negotiator.getToken());
    }

    @Test
    void getToken_unreadableBody_isAuthError() {
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        assertThrows(AuthException.class, () -> negotiator.getToken());
    }

    @Test
    void getEndpoint_postsSnapshotWithFreshToken() throws Exception {
        credentials.addSubscription(new Subscription(SubscriptionType.CALLBACK, "/v1.0/im/bot/messages/get"));
        credentials.storeToken("OLD", clock.instant().plusSeconds(7200));
        server.enqueue(tokenResponse("T1", 7200));
        server.enqueue(new MockResponse().setBody("{\"endpoint\":\"wss://gw.example/connect\",\"ticket\":\"abc\"}"));

        String url = negotiator.getEndpoint();

        assertEquals("wss://gw.example/connect?ticket=abc", url);
        server.takeRequest();
        RecordedRequest gateway = server.takeRequest();
        assertEquals("POST", gateway.getMethod());
        assertEquals("/v1.0/gateway/connections/open", gateway.getPath());
        assertEquals("T1", gateway.getHeader("access-token"));
        assertEquals("application/json", gateway.getHeader("Accept"));

        JsonNode body = new ObjectMapper().readTree(gateway.getBody().readUtf8());
        assertEquals("ding-app", body.get("clientId").asText());
        assertEquals("ding-secret", body.get("clientSecret").asText());
        assertEquals("streambot-test", body.get("ua").asText());
        assertEquals(3, body.get("subscriptions").size());
    }

    @Test
    void getEndpoint_gatewayError_isNegotiationError() {
        server.enqueue(tokenResponse("T1", 7200));
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"code\":\"Forbidden\"}"));

        NegotiationException e = assertThrows(NegotiationException.class, () -> negotiator.getEndpoint());
        assertTrue(e.getMessage().contains("403"));
    }

    @Test
    void getEndpoint_missingTicket_isNegotiationError() {
        server.enqueue(tokenResponse("T1", 7200));
        server.enqueue(new MockResponse().setBody("{\"endpoint\":\"wss://gw.example/connect\"}"));

        assertThrows(NegotiationException.class, () -> negotiator.getEndpoint());
    }

    @Test
    void getEndpoint_tokenFailure_isAuthErrorWithoutGatewayCall() {
        server.enqueue(new MockResponse().setBody("{\"errcode\":1,\"errmsg\":\"nope\"}"));

        assertThrows(AuthException.class, () -> negotiator.getEndpoint());
        assertEquals(1, server.getRequestCount());
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
