package com.phillippitts.platemate.service.conversation.gemini;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.service.conversation.ChatSessionConfig;
import com.phillippitts.platemate.service.conversation.ChatSessionHandle;
import com.phillippitts.platemate.service.conversation.GenerativeChatApi;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link GenerativeChatApi} over the Gemini {@code models/{model}:generateContent} REST endpoint.
 *
 * <p>The endpoint is stateless, so each session keeps its own {@code contents} history and sends
 * it in full with every turn. A turn is committed to history only when the call succeeds.
 */
public class GeminiChatApi implements GenerativeChatApi {

    private static final Logger LOG = LogManager.getLogger(GeminiChatApi.class);

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestClient restClient;
    private final GeminiProperties props;

    /**
     * @param restClient client whose base URL is {@code gemini.base-url}
     * @param props      API key and generation defaults
     */
    public GeminiChatApi(RestClient restClient, GeminiProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public ChatSessionHandle startSession(ChatSessionConfig config) {
        if (!props.hasApiKey()) {
            throw new IllegalStateException("Gemini API key is not configured; set GEMINI_API_KEY");
        }
        return new GeminiSession(config);
    }

    @Override
    public String sendMessage(ChatSessionHandle handle, String text) {
        if (!(handle instanceof GeminiSession session)) {
            throw new IllegalArgumentException("Not a Gemini session: " + handle);
        }
        synchronized (session) {
            List<JSONObject> contents = new ArrayList<>(session.contents);
            contents.add(GeminiJsonCodec.content(GeminiJsonCodec.ROLE_USER, text));
            String body = GeminiJsonCodec.encodeRequest(contents, session.config);

            String response = restClient.post()
                    .uri("/models/{model}:generateContent", session.config.model())
                    .header(API_KEY_HEADER, props.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);

            GeminiJsonCodec.Reply reply;
            try {
                reply = GeminiJsonCodec.decodeResponse(response);
            } catch (JSONException e) {
                throw new IllegalStateException("Unparseable Gemini response: " + e.getMessage(), e);
            }
            if (reply.isBlocked()) {
                LOG.info("Gemini reply blocked: {}", reply.blockReason());
                return "";
            }
            if (reply.text().isBlank()) {
                return "";
            }

            session.contents.add(contents.get(contents.size() - 1));
            session.contents.add(GeminiJsonCodec.content(GeminiJsonCodec.ROLE_MODEL, reply.text()));
            LOG.debug("Gemini reply: {} chars, history {} turns", reply.text().length(), session.contents.size());
            return reply.text();
        }
    }

    private static final class GeminiSession implements ChatSessionHandle {
        private final ChatSessionConfig config;
        // @GuardedBy("this")
        private final List<JSONObject> contents = new ArrayList<>();

        GeminiSession(ChatSessionConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        @Override
        public ChatSessionConfig config() {
            return config;
        }
    }
}
