package com.streambot.client.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import lombok.Data;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the {@code downloadCode} of an inbound file, picture, audio or
 * video message to a temporary URL and fetches it.
 */
public class FileDownloader {

    private final OpenApiClient openApi;
    private final OkHttpClient httpClient;
    private final String robotCode;

    public FileDownloader(OpenApiClient openApi, OkHttpClient httpClient, String robotCode) {
        this.openApi = openApi;
        this.httpClient = httpClient;
        this.robotCode = robotCode;
    }

    public String downloadUrl(String downloadCode) throws StreamException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("downloadCode", downloadCode);
        body.put("robotCode", robotCode);
        DownloadResponse response = openApi.post(StreamConstants.DOWNLOAD_PATH, body, DownloadResponse.class);
        if (response == null || response.getDownloadUrl() == null || response.getDownloadUrl().isEmpty()) {
            throw new StreamException("no downloadUrl for code " + downloadCode);
        }
        return response.getDownloadUrl();
    }

    /**
     * Stream the file into {@code out}; the stream is not closed.
     *
     * @return number of bytes copied
     */
    public long download(String downloadCode, OutputStream out) throws StreamException {
        String url = downloadUrl(downloadCode);
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new StreamException("file download returned HTTP " + response.code());
            }
            try (InputStream in = body.byteStream()) {
                return in.transferTo(out);
            }
        } catch (IOException e) {
            throw new StreamException("file download failed", e);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DownloadResponse {
        private String downloadUrl;
    }
}
