package com.streambot.client.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private Credentials newCredentials() {
        return new Credentials(new ClientIdentity("ding-app", "s3cret-value"), "streambot-test", 8000, 1000);
    }

    @Test
    void defaultSubscriptions_areEventAndSystemWildcards() {
        List<Subscription> subs = newCredentials().getSubscriptions();

        assertEquals(List.of(
                new Subscription(SubscriptionType.EVENT, "*"),
                new Subscription(SubscriptionType.SYSTEM, "*")), subs);
    }

    @Test
    void addSubscription_isIdempotentAndKeepsOrder() {
        Credentials credentials = newCredentials();
        Subscription robot = new Subscription(SubscriptionType.CALLBACK, "/v1.0/im/bot/messages/get");

        assertTrue(credentials.addSubscription(robot));
        assertFalse(credentials.addSubscription(new Subscription(SubscriptionType.CALLBACK,
                "/v1.0/im/bot/messages/get")));

        List<Subscription> subs = credentials.getSubscriptions();
        assertEquals(3, subs.size());
        assertEquals(robot, subs.get(2));
        assertTrue(credentials.hasSubscription(robot));
    }

    @Test
    void cachedToken_emptyUntilStored() {
        Credentials credentials = newCredentials();
        assertTrue(credentials.cachedToken(NOW).isEmpty());

        credentials.storeToken("tok-1", NOW.plusSeconds(7200));

        assertEquals("tok-1", credentials.cachedToken(NOW).orElseThrow());
        assertEquals("tok-1", credentials.cachedToken(NOW.plusSeconds(7200)).orElseThrow());
        assertTrue(credentials.cachedToken(NOW.plusSeconds(7201)).isEmpty());
    }

    @Test
    void invalidateToken_dropsCachedToken() {
        Credentials credentials = newCredentials();
        credentials.storeToken("tok-1", NOW.plusSeconds(60));

        credentials.invalidateToken();

        assertTrue(credentials.cachedToken(NOW).isEmpty());
        assertEquals(Instant.EPOCH, credentials.getTokenExpiresAt());
    }

    @Test
    void negativeIntervals_rejected() {
        Credentials credentials = newCredentials();
        assertThrows(IllegalArgumentException.class, () -> credentials.setHeartbeatIntervalMs(-1));
        assertThrows(IllegalArgumentException.class, () -> credentials.setReconnectIntervalMs(-5));

        credentials.setHeartbeatIntervalMs(0);
        assertEquals(0, credentials.getHeartbeatIntervalMs());
    }

    @Test
    void snapshot_serialisesGatewayBody() throws Exception {
        Credentials credentials = newCredentials();
        credentials.addSubscription(new Subscription(SubscriptionType.CALLBACK, "/v1.0/card/instances/callback"));

        JsonNode json = new ObjectMapper().valueToTree(credentials.snapshot());

        assertEquals("ding-app", json.get("clientId").asText());
        assertEquals("s3cret-value", json.get("clientSecret").asText());
        assertEquals("streambot-test", json.get("ua").asText());
        assertEquals(3, json.get("subscriptions").size());
        assertEquals("CALLBACK", json.get("subscriptions").get(2).get("type").asText());
        assertEquals("/v1.0/card/instances/callback", json.get("subscriptions").get(2).get("topic").asText());
    }

    @Test
    void snapshot_isDetachedFromLaterChanges() {
        Credentials credentials = newCredentials();
        CredentialsSnapshot snapshot = credentials.snapshot();

        credentials.addSubscription(new Subscription(SubscriptionType.CALLBACK, "/x"));
        credentials.setUserAgent("other");

        assertEquals(2, snapshot.getSubscriptions().size());
        assertEquals("streambot-test", snapshot.getUserAgent());
    }

    @Test
    void snapshotAndListing_cannotAlterLiveSubscriptions() {
        Credentials credentials = newCredentials();
        Subscription eventAll = new Subscription(SubscriptionType.EVENT, "*");

        assertThrows(UnsupportedOperationException.class,
                () -> credentials.snapshot().getSubscriptions().set(0, new Subscription(SubscriptionType.EVENT, "/x")));
        assertThrows(UnsupportedOperationException.class,
                () -> credentials.getSubscriptions().add(new Subscription(SubscriptionType.EVENT, "/x")));

        assertFalse(credentials.addSubscription(new Subscription(SubscriptionType.EVENT, "*")));
        assertEquals(eventAll, credentials.getSubscriptions().get(0));
        assertEquals("*", credentials.snapshot().getSubscriptions().get(0).topic());
        assertEquals(2, credentials.getSubscriptions().size());
    }

    @Test
    void identity_requiresBothFields_andMasksSecret() {
        assertThrows(IllegalArgumentException.class, () -> new ClientIdentity("", "x"));
        assertThrows(IllegalArgumentException.class, () -> new ClientIdentity("id", null));

        ClientIdentity identity = new ClientIdentity("id", "a-very-long-client-secret-value");
        assertFalse(identity.toString().contains("a-very-long-client-secret-value"));
        assertFalse(newCredentials().snapshot().toString().contains("s3cret-value"));
    }
}
