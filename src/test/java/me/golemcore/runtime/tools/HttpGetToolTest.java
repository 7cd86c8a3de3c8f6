package me.golemcore.runtime.tools;

import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ValidatedArgs;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpGetToolTest {

    private MockWebServer mockServer;
    private HttpGetTool tool;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        tool = new HttpGetTool(new OkHttpClient.Builder().followRedirects(false).build(), 10, true);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private ToolResult get(String url) throws Exception {
        return tool.execute(ValidatedArgs.of(Map.of("url", url))).get();
    }

    @Test
    void shouldReturnStatusAndBody() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("hello"));

        ToolResult result = get(mockServer.url("/page").toString());

        assertTrue(result.isSuccess());
        assertEquals("HTTP 200\nhello", result.getOutput());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/page", request.getPath());
    }

    @Test
    void shouldCapBodyLength() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("0123456789abcdef"));

        ToolResult result = get(mockServer.url("/").toString());

        assertEquals("HTTP 200\n0123456789", result.getOutput());
    }

    @Test
    void shouldFailOnErrorStatus() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        ToolResult result = get(mockServer.url("/nope").toString());

        assertFalse(result.isSuccess());
        assertEquals("HTTP 404 from " + mockServer.getHostName() + ": missing", result.getError());
    }

    @Test
    void shouldNotFollowRedirects() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "https://elsewhere.io/"));

        ToolResult result = get(mockServer.url("/redirect").toString());

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("HTTP 302"));
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void shouldRejectInvalidUrl() throws Exception {
        ToolResult result = get("ftp://example.com/file");

        assertFalse(result.isSuccess());
        assertEquals("Invalid URL: ftp://example.com/file", result.getError());
    }
}
