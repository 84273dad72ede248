package com.streambot.client.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import com.streambot.client.negotiate.TokenNegotiator;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Uploads media to the legacy oapi host and returns its {@code media_id},
 * usable in audio, file and video message templates.
 */
@Slf4j
public class MediaUploader {

    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private final TokenNegotiator negotiator;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String oapiBaseUrl;

    public MediaUploader(TokenNegotiator negotiator, OkHttpClient httpClient,
            ObjectMapper objectMapper, String oapiBaseUrl) {
        this.negotiator = negotiator;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.oapiBaseUrl = OpenApiClient.stripTrailingSlash(oapiBaseUrl);
    }

    /**
     * @throws StreamException if the file is unreadable, the request fails or
     *                         the server answers with a non-zero errcode
     */
    public String upload(Path file, UploadType type) throws StreamException {
        if (!Files.isRegularFile(file)) {
            throw new StreamException("not a file: " + file);
        }
        HttpUrl base = HttpUrl.parse(oapiBaseUrl + StreamConstants.UPLOAD_PATH);
        if (base == null) {
            throw new StreamException("invalid upload URL: " + oapiBaseUrl);
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("access_token", negotiator.getToken())
                .build();
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("type", type.wireName())
                .addFormDataPart("media", file.getFileName().toString(),
                        RequestBody.create(file.toFile(), OCTET_STREAM))
                .build();
        Request request = new Request.Builder().url(url).post(body).build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new StreamException("media upload returned HTTP " + response.code());
            }
            UploadResponse result = objectMapper.readValue(text, UploadResponse.class);
            if (result.getErrcode() != null && result.getErrcode() != 0) {
                throw new StreamException("media upload failed: errcode=" + result.getErrcode()
                        + ", errmsg=" + result.getErrmsg());
            }
            if (result.getMediaId() == null || result.getMediaId().isEmpty()) {
                throw new StreamException("media upload response has no media_id");
            }
            log.info("Uploaded {} as {} media", file.getFileName(), type.wireName());
            return result.getMediaId();
        } catch (IOException e) {
            throw new StreamException("media upload failed", e);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class UploadResponse {
        private Integer errcode;
        private String errmsg;
        @JsonProperty("media_id")
        private String mediaId;
        private String type;
    }
}
