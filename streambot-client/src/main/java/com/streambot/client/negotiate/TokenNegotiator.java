package com.streambot.client.negotiate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.AuthException;
import com.streambot.client.NegotiationException;
import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import com.streambot.client.credential.ClientIdentity;
import com.streambot.client.credential.Credentials;
import com.streambot.client.credential.CredentialsSnapshot;
import com.streambot.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Access token management and websocket endpoint negotiation.
 * <p>
 * The token is cached in {@link Credentials} until its server-announced
 * expiry; concurrent refreshes are collapsed into one request.
 */
@Slf4j
public class TokenNegotiator {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final Credentials credentials;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String tokenUrl;
    private final String gatewayUrl;

    /** Serialises network fetches; never held together with the credentials lock. */
    private final ReentrantLock fetchLock = new ReentrantLock();

    public TokenNegotiator(Credentials credentials, OkHttpClient httpClient,
            String tokenUrl, String gatewayUrl, Clock clock) {
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.tokenUrl = tokenUrl;
        this.gatewayUrl = gatewayUrl;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get a valid access token, fetching a new one only when the cached token
     * has expired.
     */
    public String getToken() throws AuthException {
        Optional<String> cached = credentials.cachedToken(clock.instant());
        if (cached.isPresent()) {
            return cached.get();
        }
        fetchLock.lock();
        try {
            // Another thread may have refreshed while we waited
            cached = credentials.cachedToken(clock.instant());
            if (cached.isPresent()) {
                return cached.get();
            }
            return fetchToken();
        } finally {
            fetchLock.unlock();
        }
    }

    /**
     * Force-refresh the access token.
     */
    public String refreshToken() throws AuthException {
        fetchLock.lock();
        try {
            return fetchToken();
        } finally {
            fetchLock.unlock();
        }
    }

    /**
     * Drop the cached token (e.g. after the open API rejected it).
     */
    public void invalidateToken() {
        credentials.invalidateToken();
    }

    /**
     * Exchange a freshly fetched token and the current credentials for a
     * single-use websocket URL ({@code endpoint?ticket=...}).
     */
    public String getEndpoint() throws StreamException {
        String token = refreshToken();
        CredentialsSnapshot snapshot = credentials.snapshot();

        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (IOException e) {
            throw new NegotiationException("cannot encode gateway request", e);
        }
        Request request = new Request.Builder()
                .url(gatewayUrl)
                .header("Accept", StreamConstants.CONTENT_TYPE_JSON)
                .header(StreamConstants.ACCESS_TOKEN_HEADER, token)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw new NegotiationException("get endpoint http error: " + response.code() + " - " + body);
            }
            EndpointResponse endpoint;
            try {
                endpoint = objectMapper.readValue(body, EndpointResponse.class);
            } catch (IOException e) {
                throw new NegotiationException("malformed gateway response: " + e.getMessage(), e);
            }
            if (endpoint == null || isBlank(endpoint.getEndpoint()) || isBlank(endpoint.getTicket())) {
                throw new NegotiationException("gateway response without endpoint/ticket");
            }
            String url = endpoint.getEndpoint() + "?ticket=" + endpoint.getTicket();
            log.debug("Stream endpoint negotiated: {}", LogRedact.redact(url));
            return url;
        } catch (IOException e) {
            throw new NegotiationException("get endpoint failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Internal
    // =========================================================================

    private String fetchToken() throws AuthException {
        ClientIdentity identity = credentials.getIdentity();
        HttpUrl base = HttpUrl.parse(tokenUrl);
        if (base == null) {
            throw new AuthException("invalid token url: " + tokenUrl);
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("appkey", identity.clientId())
                .addQueryParameter("appsecret", identity.clientSecret())
                .build();
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw new AuthException("get token http error: " + response.code() + " - " + body);
            }
            TokenResponse token;
            try {
                token = objectMapper.readValue(body, TokenResponse.class);
            } catch (IOException e) {
                throw new AuthException("malformed token response: " + e.getMessage(), e);
            }
            if (token == null || token.getErrcode() == null) {
                throw new AuthException("token response without errcode");
            }
            if (token.getErrcode() != 0) {
                throw new AuthException("get token content error: " + token.getErrcode() + " - " + token.getErrmsg());
            }
            if (isBlank(token.getAccessToken()) || token.getExpiresIn() == null) {
                throw new AuthException("token response without accessToken/expiresIn");
            }
            Instant expiresAt = clock.instant().plusSeconds(token.getExpiresIn());
            credentials.storeToken(token.getAccessToken(), expiresAt);
            log.debug("Access token refreshed for {} ({}), expires at {}",
                    identity.clientId(), LogRedact.maskToken(token.getAccessToken()), expiresAt);
            return token.getAccessToken();
        } catch (IOException e) {
            throw new AuthException("get token failed: " + e.getMessage(), e);
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
