package com.streambot.client.message;

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
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MediaTransferTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private MediaUploader uploader;
    private FileDownloader downloader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        Credentials credentials = new Credentials(new ClientIdentity("robot-code", "secret"), "ua", 8000, 1000);
        credentials.storeToken("T1", Instant.now().plusSeconds(3600));
        OkHttpClient http = new OkHttpClient();
        TokenNegotiator negotiator = new TokenNegotiator(credentials, http,
                server.url("/gettoken").toString(), server.url("/gateway").toString(), Clock.systemUTC());
        uploader = new MediaUploader(negotiator, http, mapper, server.url("/").toString());
        downloader = new FileDownloader(new OpenApiClient(negotiator, http, mapper, server.url("/").toString()),
                http, "robot-code");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void upload_sendsMultipartAndReturnsMediaId() throws Exception {
        Path file = Files.writeString(tempDir.resolve("note.txt"), "hello", StandardCharsets.UTF_8);
        server.enqueue(new MockResponse().setBody(
                "{\"errcode\":0,\"errmsg\":\"ok\",\"media_id\":\"@lA0\",\"type\":\"file\"}"));

        assertEquals("@lA0", uploader.upload(file, UploadType.FILE));

        RecordedRequest request = server.takeRequest();
        assertEquals("/media/upload?access_token=T1", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("multipart/form-data"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("name=\"media\"; filename=\"note.txt\""));
        assertTrue(body.contains("name=\"type\""));
        assertTrue(body.contains("hello"));
    }

    @Test
    void upload_nonZeroErrcode_isStreamException() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.png"), "png");
        server.enqueue(new MockResponse().setBody("{\"errcode\":40004,\"errmsg\":\"invalid media type\"}"));

        StreamException e = assertThrows(StreamException.class, () -> uploader.upload(file, UploadType.IMAGE));
        assertTrue(e.getMessage().contains("40004"));
    }

    @Test
    void upload_missingFile_rejectedLocally() {
        assertThrows(StreamException.class, () -> uploader.upload(tempDir.resolve("nope.bin"), UploadType.FILE));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void download_resolvesCodeThenStreamsFile() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"downloadUrl\":\"" + server.url("/files/abc") + "\"}"));
        server.enqueue(new MockResponse().setBody("file-bytes"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long copied = downloader.download("code-1", out);

        assertEquals(10, copied);
        assertEquals("file-bytes", out.toString(StandardCharsets.UTF_8));
        RecordedRequest resolve = server.takeRequest();
        assertEquals("/v1.0/robot/messageFiles/download", resolve.getPath());
        String body = resolve.getBody().readUtf8();
        assertTrue(body.contains("\"downloadCode\":\"code-1\""));
        assertTrue(body.contains("\"robotCode\":\"robot-code\""));
        assertEquals("/files/abc", server.takeRequest().getPath());
    }

    @Test
    void download_missingUrl_isStreamException() {
        server.enqueue(new MockResponse().setBody("{}"));

        assertThrows(StreamException.class, () -> downloader.downloadUrl("code-1"));
    }
}
