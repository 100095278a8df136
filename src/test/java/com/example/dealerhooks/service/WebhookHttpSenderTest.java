package com.example.dealerhooks.service;

import com.example.dealerhooks.config.WebhookProperties;
import com.example.dealerhooks.exception.PermanentDeliveryException;
import com.example.dealerhooks.exception.TransientDeliveryException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookHttpSenderTest {

    private MockWebServer server;
    private WebhookHttpSender sender;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        WebhookProperties properties = new WebhookProperties();
        properties.setRequestTimeout(Duration.ofMillis(300));
        properties.setUserAgent("DealerHooks-Test/1.0");
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(300))
                .build();
        sender = new WebhookHttpSender(client, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void testSuccessSendsSignedHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202).setBody("accepted"));

        WebhookHttpSender.Response response = sender.send(server.url("/hook").toString(),
                "{\"event\":\"vehicle.sold\"}", "abc123", "vehicle.sold", "2025-01-01T00:00:00Z");

        assertEquals(202, response.statusCode());
        assertEquals("accepted", response.body());

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/hook", request.getPath());
        assertEquals("{\"event\":\"vehicle.sold\"}", request.getBody().readUtf8());
        assertEquals("abc123", request.getHeader("X-Webhook-Signature"));
        assertEquals("vehicle.sold", request.getHeader("X-Webhook-Event"));
        assertEquals("2025-01-01T00:00:00Z", request.getHeader("X-Webhook-Timestamp"));
        assertEquals("DealerHooks-Test/1.0", request.getHeader("User-Agent"));
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
    }

    @Test
    void testServerErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        TransientDeliveryException e = assertThrows(TransientDeliveryException.class,
                () -> sender.send(server.url("/").toString(), "{}", "sig", "test", "ts"));
        assertEquals(503, e.getStatusCode());
        assertEquals("HTTP 503", e.getMessage());
    }

    @Test
    void testClientErrorIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(404));

        PermanentDeliveryException e = assertThrows(PermanentDeliveryException.class,
                () -> sender.send(server.url("/").toString(), "{}", "sig", "test", "ts"));
        assertEquals(404, e.getStatusCode());
    }

    @Test
    void testRedirectIsNotFollowed() {
        server.enqueue(new MockResponse().setResponseCode(302).addHeader("Location", "http://example.com/"));

        assertThrows(PermanentDeliveryException.class,
                () -> sender.send(server.url("/").toString(), "{}", "sig", "test", "ts"));
    }

    @Test
    void testTimeoutIsTransient() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        TransientDeliveryException e = assertThrows(TransientDeliveryException.class,
                () -> sender.send(server.url("/").toString(), "{}", "sig", "test", "ts"));
        assertNull(e.getStatusCode());
        assertTrue(e.getMessage().startsWith("Timed out"));
    }

    @Test
    void testSlowResponseBodyCountsAgainstTimeout() {
        // 响应头立即返回，响应体每 300ms 才发送 1 字节
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("accepted-but-very-slowly")
                .throttleBody(1, 300, TimeUnit.MILLISECONDS));

        long started = System.nanoTime();
        TransientDeliveryException e = assertThrows(TransientDeliveryException.class,
                () -> sender.send(server.url("/").toString(), "{}", "sig", "test", "ts"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(e.getMessage().startsWith("Timed out"));
        assertTrue(elapsedMillis < 3000, "attempt ran " + elapsedMillis + "ms");
    }

    @Test
    void testConnectionRefusedIsTransient() throws Exception {
        String url = server.url("/").toString();
        server.shutdown();

        TransientDeliveryException e = assertThrows(TransientDeliveryException.class,
                () -> sender.send(url, "{}", "sig", "test", "ts"));
        assertTrue(e.getMessage().startsWith("Connection error"));
    }

    @Test
    void testMalformedTargetIsPermanent() {
        assertThrows(PermanentDeliveryException.class,
                () -> sender.send("not a url", "{}", "sig", "test", "ts"));
    }
}
