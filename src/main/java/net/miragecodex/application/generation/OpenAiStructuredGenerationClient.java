package net.miragecodex.application.generation;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link StructuredGenerationClient} backed by an OpenAI-compatible chat completions endpoint.
 *
 * <p>Requests ask for a JSON-object response. SDK retries are disabled
 * ({@code maxRetries(0)}); the gateway owns the retry policy.
 * Calls carrying a personal API key use a short-lived client built for that call.</p>
 */
@Component
public class OpenAiStructuredGenerationClient implements StructuredGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiStructuredGenerationClient.class);

    /**
     * Placeholder some deployments export instead of leaving the key unset.
     */
    private static final String API_KEY_SENTINEL = "not-configured";

    private final StructuredPayloadParser payloadParser;
    private final String baseUrl;
    private final long requestTimeoutSeconds;
    private final long readTimeoutSeconds;
    @Nullable
    private final OpenAIClient platformClient;

    public OpenAiStructuredGenerationClient(
        ObjectMapper objectMapper,
        @Value("${AI_DEFAULT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${AI_DEFAULT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${AI_DEFAULT_OPENAI_REQUEST_TIMEOUT_SECONDS:120}") long requestTimeoutSeconds,
        @Value("${AI_DEFAULT_OPENAI_READ_TIMEOUT_SECONDS:75}") long readTimeoutSeconds
    ) {
        this.payloadParser = new StructuredPayloadParser(objectMapper);
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);
        this.readTimeoutSeconds = Math.max(1L, readTimeoutSeconds);

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            this.platformClient = buildClient(apiKey.trim());
            log.info("Structured generation client configured (baseUrl={})", this.baseUrl);
        } else {
            this.platformClient = null;
            log.warn("Structured generation client has no platform API key; only personal keys will work");
        }
    }

    @Override
    public boolean isPlatformConfigured() {
        return platformClient != null;
    }

    @Override
    public JsonNode generate(StructuredGenerationRequest request) {
        String personalKey = request.target().personalApiKey();
        if (StringUtils.hasText(personalKey)) {
            OpenAIClient personalClient = buildClient(personalKey.trim());
            try {
                return generateWith(personalClient, request);
            } finally {
                personalClient.close();
            }
        }
        if (platformClient == null) {
            throw new ContentGenerationException(ErrorCode.NOT_CONFIGURED,
                "No platform API key configured for structured generation");
        }
        return generateWith(platformClient, request);
    }

    static ChatCompletionCreateParams buildParams(StructuredGenerationRequest request) {
        return ChatCompletionCreateParams.builder()
            .model(ChatModel.of(request.target().modelName()))
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(
                    ChatCompletionSystemMessageParam.builder().content(request.systemPrompt()).build()
                ),
                ChatCompletionMessageParam.ofUser(
                    ChatCompletionUserMessageParam.builder().content(request.userPrompt()).build()
                )
            ))
            .responseFormat(ResponseFormatJsonObject.builder().build())
            .temperature(request.temperature())
            .build();
    }

    private JsonNode generateWith(OpenAIClient client, StructuredGenerationRequest request) {
        ChatCompletionCreateParams params = buildParams(request);

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(Duration.ofSeconds(requestTimeoutSeconds))
                .read(Duration.ofSeconds(readTimeoutSeconds))
                .build())
            .build();

        ChatCompletion completion;
        try {
            completion = client.chat().completions().create(params, options);
        } catch (OpenAIException ex) {
            throw new ContentGenerationException(ErrorCode.TRANSPORT_FAILED,
                "Generator call failed for %s (model=%s): %s".formatted(
                    request.schemaName(), request.target().modelName(), ContentGenerationException.describeApiError(ex)),
                ex);
        } catch (RuntimeException ex) {
            throw new ContentGenerationException(ErrorCode.TRANSPORT_FAILED,
                "Generator call failed for %s (model=%s)".formatted(request.schemaName(), request.target().modelName()),
                ex);
        }

        String content = completion.choices().isEmpty()
            ? null
            : completion.choices().get(0).message().content().orElse(null);
        return payloadParser.parse(content);
    }

    private OpenAIClient buildClient(String apiKey) {
        return OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .baseUrl(baseUrl)
            .maxRetries(0)
            .build();
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            return "https://api.openai.com/v1";
        }
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
