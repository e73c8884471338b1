package ch.so.arp.chatcache.chat;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link LlmClient} calling the non-streaming {@code /api/generate} endpoint of an
 * Ollama server. The conversation history is flattened into the prompt as
 * {@code role: content} lines.
 */
class OllamaLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaLlmClient.class);

    private final OllamaClientProperties properties;
    private final RestClient restClient;

    OllamaLlmClient(OllamaClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new IllegalArgumentException("Property 'chat.ollama.base-url' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.restClient = restClientBuilder.baseUrl(properties.getBaseUrl()).build();
    }

    @Override
    public String generate(String prompt, List<ChatMessage> history, double temperature) {
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "prompt", formatPrompt(prompt, history),
                "stream", false,
                "options", Map.of("temperature", temperature));

        LOGGER.debug("Generating answer with model {} via {}", properties.getModel(), properties.getBaseUrl());
        GenerateResponse response;
        try {
            response = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(GenerateResponse.class);
        } catch (ResourceAccessException ex) {
            throw new GenerationException(GenerationException.Kind.SERVICE_UNAVAILABLE,
                    "Ollama is not reachable at " + properties.getBaseUrl(), ex);
        } catch (RestClientResponseException ex) {
            GenerationException.Kind kind = ex.getStatusCode().isSameCodeAs(HttpStatus.SERVICE_UNAVAILABLE)
                    ? GenerationException.Kind.SERVICE_UNAVAILABLE
                    : GenerationException.Kind.SERVICE_ERROR;
            throw new GenerationException(kind, "Ollama answered with HTTP " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new GenerationException(GenerationException.Kind.SERVICE_ERROR,
                    "Unable to read answer from Ollama: " + ex.getMessage(), ex);
        }

        if (response == null || response.response() == null) {
            throw new GenerationException(GenerationException.Kind.SERVICE_ERROR,
                    "Ollama returned no answer", null);
        }
        return response.response();
    }

    static String formatPrompt(String prompt, List<ChatMessage> history) {
        StringJoiner joiner = new StringJoiner("\n");
        history.forEach(message -> joiner.add(message.role() + ": " + message.content()));
        joiner.add(ChatMessage.USER + ": " + prompt);
        joiner.add(ChatMessage.ASSISTANT + ":");
        return joiner.toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(String response) {
    }
}
