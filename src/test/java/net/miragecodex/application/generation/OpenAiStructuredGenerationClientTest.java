package net.miragecodex.application.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.openai.models.chat.completions.ChatCompletionCreateParams;
import net.miragecodex.domain.generation.GenerationTarget;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

class OpenAiStructuredGenerationClientTest {

    @Test
    void should_ThrowNotConfigured_When_NoPlatformOrPersonalKey() {
        OpenAiStructuredGenerationClient client =
            new OpenAiStructuredGenerationClient(new ObjectMapper(), "", "https://api.openai.com/v1/", 30, 30);
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            GenerationTarget.platform("gpt-test"), "books", "system", "user", 0.5);

        assertThat(client.isPlatformConfigured()).isFalse();
        assertThatThrownBy(() -> client.generate(request))
            .isInstanceOfSatisfying(ContentGenerationException.class, exception -> {
                assertThat(exception.errorCode()).isEqualTo(ContentGenerationException.ErrorCode.NOT_CONFIGURED);
                assertThat(exception.isRetryable()).isFalse();
            });
    }

    @Test
    void should_TreatSentinelAsMissingKey_When_DeploymentExportsPlaceholder() {
        OpenAiStructuredGenerationClient client =
            new OpenAiStructuredGenerationClient(new ObjectMapper(), "not-configured", "", 30, 30);

        assertThat(client.isPlatformConfigured()).isFalse();
    }

    @Test
    void should_ReportConfigured_When_PlatformKeyPresent() {
        OpenAiStructuredGenerationClient client =
            new OpenAiStructuredGenerationClient(new ObjectMapper(), "sk-test", "http://localhost:1/v1", 1, 1);

        assertThat(client.isPlatformConfigured()).isTrue();
    }

    @Test
    void should_RequestJsonObjectResponse_When_BuildingCompletionParams() {
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            GenerationTarget.platform("gpt-test"), "books", "system", "user", 0.9);

        ChatCompletionCreateParams params = OpenAiStructuredGenerationClient.buildParams(request);

        assertThat(params.responseFormat()).hasValueSatisfying(format -> assertThat(format.isJsonObject()).isTrue());
        assertThat(params.temperature()).contains(0.9);
        assertThat(params.messages()).hasSize(2);
    }
}
