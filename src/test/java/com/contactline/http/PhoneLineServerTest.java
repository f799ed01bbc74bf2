package com.contactline.http;

import com.contactline.TestConfigs;
import com.contactline.line.PhoneLineService;
import com.contactline.store.MemoryRecordStore;
import com.contactline.store.PhoneRecordRepository;
import com.contactline.store.UnavailableRecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.*;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class PhoneLineServerTest {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient http   = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private PhoneLineServer server;

    @BeforeEach
    void setup() throws IOException {
        server = start(new PhoneLineService(
                new PhoneRecordRepository(new MemoryRecordStore()),
                () -> TestConfigs.withNamespace("http-test")));
    }

    @AfterEach
    void teardown() {
        server.stop();
    }

    @Test
    void get_returnsDefaultRecord() throws IOException {
        try (Response response = http.newCall(get()).execute()) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Access-Control-Allow-Origin")).isEqualTo("*");

            final JsonNode body = json(response);
            assertThat(body.path("phone").asText()).isEqualTo(TestConfigs.DEFAULT_PHONE);
            assertThat(body.path("message").asText()).isEqualTo(TestConfigs.MESSAGE);
            assertThat(body.path("changeCount").asInt()).isZero();
        }
    }

    @Test
    void post_updatesNumber_andGetReflectsIt() throws IOException {
        try (Response response = http.newCall(post(
                "{\"phone\":\"+54 11 4344 3600\",\"password\":\"" + TestConfigs.PASSWORD + "\"}")).execute()) {
            assertThat(response.code()).isEqualTo(200);

            final JsonNode body = json(response);
            assertThat(body.path("success").asBoolean()).isTrue();
            assertThat(body.path("normalizedPhone").asText()).isEqualTo("5491143443600");
            assertThat(body.path("changeCount").asInt()).isEqualTo(1);
        }

        try (Response response = http.newCall(get()).execute()) {
            final JsonNode body = json(response);
            assertThat(body.path("phone").asText()).isEqualTo("5491143443600");
            assertThat(body.path("changeCount").asInt()).isEqualTo(1);
        }
    }

    @Test
    void post_reset_returnsZeroWithoutNormalizedPhone() throws IOException {
        try (Response response = http.newCall(post(
                "{\"password\":\"" + TestConfigs.PASSWORD + "\",\"reset\":true}")).execute()) {
            assertThat(response.code()).isEqualTo(200);

            final JsonNode body = json(response);
            assertThat(body.path("success").asBoolean()).isTrue();
            assertThat(body.path("changeCount").asInt()).isZero();
            assertThat(body.has("normalizedPhone")).isFalse();
        }
    }

    @Test
    void post_withWrongPassword_returns401() throws IOException {
        try (Response response = http.newCall(post("{\"phone\":\"11 1234 5678\",\"password\":\"bad\"}")).execute()) {
            assertThat(response.code()).isEqualTo(401);
            assertThat(json(response).path("error").asText()).isNotBlank();
        }
    }

    @Test
    void post_withInvalidPhone_returns400() throws IOException {
        try (Response response = http.newCall(post(
                "{\"phone\":\"123\",\"password\":\"" + TestConfigs.PASSWORD + "\"}")).execute()) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    void post_withMalformedJson_returns400() throws IOException {
        try (Response response = http.newCall(post("{not json")).execute()) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    void post_returns500_whenStoreUnavailable() throws IOException {
        server.stop();
        server = start(new PhoneLineService(
                new PhoneRecordRepository(new UnavailableRecordStore("Redis is not configured")),
                () -> TestConfigs.withNamespace("http-test")));

        try (Response response = http.newCall(post(
                "{\"phone\":\"11 1234 5678\",\"password\":\"" + TestConfigs.PASSWORD + "\"}")).execute()) {
            assertThat(response.code()).isEqualTo(500);
            assertThat(json(response).path("error").asText()).contains("Redis is not configured");
        }

        try (Response response = http.newCall(get()).execute()) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(json(response).path("phone").asText()).isEqualTo(TestConfigs.DEFAULT_PHONE);
        }
    }

    @Test
    void options_returnsCorsPreflight() throws IOException {
        final Request request = new Request.Builder().url(url("/api/phone")).method("OPTIONS", null).build();
        try (Response response = http.newCall(request).execute()) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Access-Control-Allow-Methods")).isEqualTo("GET, POST, OPTIONS");
        }
    }

    @Test
    void otherMethods_return405() throws IOException {
        final Request request = new Request.Builder().url(url("/api/phone")).delete().build();
        try (Response response = http.newCall(request).execute()) {
            assertThat(response.code()).isEqualTo(405);
        }
    }

    @Test
    void health_reflectsReadiness() throws IOException {
        try (Response response = http.newCall(new Request.Builder().url(url("/health/ready")).build()).execute()) {
            assertThat(response.code()).isEqualTo(503);
        }
        server.markReady();
        try (Response response = http.newCall(new Request.Builder().url(url("/health")).build()).execute()) {
            assertThat(response.code()).isEqualTo(200);
        }
        try (Response response = http.newCall(new Request.Builder().url(url("/health/live")).build()).execute()) {
            assertThat(response.code()).isEqualTo(200);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static PhoneLineServer start(final PhoneLineService service) throws IOException {
        final PhoneLineServer s = new PhoneLineServer(0, "/api/phone", service);
        s.start();
        return s;
    }

    private String url(final String path) {
        return "http://localhost:" + server.getPort() + path;
    }

    private Request get() {
        return new Request.Builder().url(url("/api/phone")).get().build();
    }

    private Request post(final String body) {
        return new Request.Builder().url(url("/api/phone")).post(RequestBody.create(body, JSON)).build();
    }

    private JsonNode json(final Response response) throws IOException {
        return mapper.readTree(response.body().string());
    }
}
