package com.scbr.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.Stage;
import io.github.cdimascio.dotenv.Dotenv;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Optional;

/**
 * GeminiReasoningClient - Reasoning capability over the Gemini generateContent API.
 *
 * <p>Blocking; callers run it off the actor threads. A call timeout maps to TIMEOUT, a reply
 * without a JSON object to MALFORMED, and transport errors, 429/5xx or a missing key to
 * UNAVAILABLE.</p>
 */
public class GeminiReasoningClient implements ReasoningCapability {

    private static final Logger log = LoggerFactory.getLogger(GeminiReasoningClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta/models/";

    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String endpoint;

    public GeminiReasoningClient(String apiKey, String model) {
        this(new OkHttpClient(), apiKey, model, DEFAULT_ENDPOINT);
    }

    public GeminiReasoningClient(OkHttpClient httpClient, String apiKey, String model, String endpoint) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.model = model;
        this.endpoint = endpoint.endsWith("/") ? endpoint : endpoint + "/";
    }

    /**
     * Gemini client when GEMINI_API_KEY is set, the offline capability otherwise.
     */
    public static ReasoningCapability fromEnv() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        String key = dotenv.get("GEMINI_API_KEY", "");
        if (key.isBlank()) {
            log.info("🤖 GEMINI_API_KEY ❌ Missing - using offline reasoning");
            return new OfflineReasoningCapability();
        }
        log.info("🤖 GEMINI_API_KEY ✅ Present");
        return new GeminiReasoningClient(key, dotenv.get("GEMINI_MODEL", "gemini-1.5-flash"));
    }

    @Override
    public ReasoningResult call(Stage stage, ObjectNode context, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            return ReasoningResult.unavailable("API key missing");
        }

        ObjectNode payload = jsonMapper.createObjectNode();
        ObjectNode content = payload.putArray("contents").addObject();
        content.putArray("parts").addObject().put("text", PromptBuilder.build(stage, context));
        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", 0.2);
        generationConfig.put("maxOutputTokens", 1024);
        generationConfig.put("responseMimeType", "application/json");

        Request request = new Request.Builder()
            .url(endpoint + model + ":generateContent?key=" + apiKey)
            .post(RequestBody.create(payload.toString(), JSON))
            .build();

        OkHttpClient client = httpClient.newBuilder().callTimeout(timeout).build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("⚠️ Gemini {} returned HTTP {}", stage, response.code());
                return ReasoningResult.unavailable("HTTP " + response.code());
            }
            Optional<String> reply = replyText(text);
            if (reply.isEmpty()) {
                return ReasoningResult.malformed("no candidate text in response");
            }
            return extractJson(reply.get())
                .map(ReasoningResult::ok)
                .orElseGet(() -> ReasoningResult.malformed("reply contained no JSON object"));
        } catch (InterruptedIOException e) {
            log.warn("⏱️ Gemini {} timed out after {}", stage, timeout);
            return ReasoningResult.timeout("call exceeded " + timeout);
        } catch (IOException e) {
            log.warn("⚠️ Gemini {} transport failure: {}", stage, e.getMessage());
            return ReasoningResult.unavailable(e.getMessage());
        }
    }

    private Optional<String> replyText(String responseBody) {
        try {
            JsonNode json = jsonMapper.readTree(responseBody);
            JsonNode text = json.path("candidates").path(0).path("content").path("parts").path(0).path("text");
            return text.isTextual() ? Optional.of(text.asText()) : Optional.empty();
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * The first JSON object in a model reply: the whole reply, a fenced block, or the
     * outermost braces.
     */
    public Optional<JsonNode> extractJson(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reply.trim();
        int fence = trimmed.indexOf("```");
        if (fence >= 0) {
            int start = trimmed.indexOf('\n', fence);
            int end = trimmed.indexOf("```", fence + 3);
            if (start >= 0 && end > start) {
                trimmed = trimmed.substring(start + 1, end).trim();
            }
        }
        int open = trimmed.indexOf('{');
        int close = trimmed.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        try {
            JsonNode node = jsonMapper.readTree(trimmed.substring(open, close + 1));
            return node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @Override
    public String name() {
        return "Gemini(" + model + ")";
    }
}
