package com.phillippitts.platemate.service.conversation.gemini;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.service.conversation.ChatSessionConfig;
import com.phillippitts.platemate.service.conversation.ChatSessionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiChatApiTest {

    private static final String BASE = "https://gemini.example/v1beta";
    private static final String ENDPOINT = BASE + "/models/test-model:generateContent";
    private static final ChatSessionConfig CONFIG =
            new ChatSessionConfig("test-model", 0.7, 0.95, 64, 2048, "text/plain");

    private MockRestServiceServer server;
    private GeminiChatApi api;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        api = new GeminiChatApi(builder.build(), properties("secret-key"));
    }

    private static GeminiProperties properties(String apiKey) {
        return new GeminiProperties(apiKey, BASE, "test-model", 0.7, 0.95, 64, 2048,
                Duration.ofSeconds(5), Duration.ofSeconds(60));
    }

    private static String reply(String text) {
        return "{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"" + text
                + "\"}]},\"finishReason\":\"STOP\"}]}";
    }

    @Test
    void shouldRefuseSessionWithoutApiKey() {
        GeminiChatApi keyless = new GeminiChatApi(RestClient.create(), properties(" "));

        assertThatThrownBy(() -> keyless.startSession(CONFIG))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("API key");
    }

    @Test
    void shouldSendKeyHeaderAndAccumulateHistory() {
        // Arrange
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(GeminiChatApi.API_KEY_HEADER, "secret-key"))
                .andExpect(jsonPath("$.contents", hasSize(1)))
                .andRespond(withSuccess(reply("Ready"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT))
                .andExpect(jsonPath("$.contents", hasSize(3)))
                .andExpect(jsonPath("$.contents[1].role").value("model"))
                .andExpect(jsonPath("$.contents[2].parts[0].text").value("tacos"))
                .andRespond(withSuccess(reply("Try Taqueria"), MediaType.APPLICATION_JSON));
        ChatSessionHandle session = api.startSession(CONFIG);

        // Act
        String first = api.sendMessage(session, "prime");
        String second = api.sendMessage(session, "tacos");

        // Assert
        assertThat(first).isEqualTo("Ready");
        assertThat(second).isEqualTo("Try Taqueria");
        server.verify();
    }

    @Test
    void shouldNotCommitBlockedTurn() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT))
                .andExpect(jsonPath("$.contents", hasSize(1)))
                .andRespond(withSuccess(reply("Fine"), MediaType.APPLICATION_JSON));
        ChatSessionHandle session = api.startSession(CONFIG);

        assertThat(api.sendMessage(session, "bad")).isEmpty();
        assertThat(api.sendMessage(session, "good")).isEqualTo("Fine");
        server.verify();
    }

    @Test
    void shouldNotCommitFailedTurn() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(ENDPOINT))
                .andExpect(jsonPath("$.contents", hasSize(1)))
                .andRespond(withSuccess(reply("Back"), MediaType.APPLICATION_JSON));
        ChatSessionHandle session = api.startSession(CONFIG);

        assertThatThrownBy(() -> api.sendMessage(session, "first"))
                .isInstanceOf(HttpServerErrorException.class);
        assertThat(api.sendMessage(session, "retry")).isEqualTo("Back");
        server.verify();
    }

    @Test
    void shouldRejectForeignSessionHandle() {
        ChatSessionHandle foreign = () -> CONFIG;

        assertThatThrownBy(() -> api.sendMessage(foreign, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
