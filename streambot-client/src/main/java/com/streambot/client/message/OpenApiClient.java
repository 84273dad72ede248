package com.streambot.client.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import com.streambot.client.negotiate.TokenNegotiator;
import com.streambot.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * JSON POSTs against the v1.0 open API, authenticated with the cached
 * access token.
 */
@Slf4j
public class OpenApiClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final int UNAUTHORIZED = 401;

    private final TokenNegotiator negotiator;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public OpenApiClient(TokenNegotiator negotiator, OkHttpClient httpClient,
            ObjectMapper objectMapper, String baseUrl) {
        this.negotiator = negotiator;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
    }

    /**
     * POST {@code body} as JSON to {@code path} and bind the response.
     *
     * @throws StreamException on a token failure, a non-success status or an
     *                         unreadable response
     */
    public <T> T post(String path, Object body, Class<T> type) throws StreamException {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StreamException("cannot encode request for " + path, e);
        }
        String token = negotiator.getToken();
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .header(StreamConstants.OPEN_API_TOKEN_HEADER, token)
                .header("Accept", StreamConstants.CONTENT_TYPE_JSON)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                if (response.code() == UNAUTHORIZED) {
                    negotiator.invalidateToken();
                }
                log.error("Open API {} failed with HTTP {}: {}", path, response.code(), LogRedact.redact(text));
                throw new StreamException("open API " + path + " returned HTTP " + response.code());
            }
            if (type == Void.class || text.isEmpty()) {
                return null;
            }
            return objectMapper.readValue(text, type);
        } catch (IOException e) {
            throw new StreamException("open API " + path + " request failed", e);
        }
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
