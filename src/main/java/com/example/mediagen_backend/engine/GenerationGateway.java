package com.example.mediagen_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Blocking JSON calls against the generation gateway with error classification: 4xx responses
 * (except 408 and 429) are permanent, everything else is retryable.
 */
public class GenerationGateway {

    private final WebClient client;
    private final Duration timeout;

    public GenerationGateway(WebClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    public JsonNode post(String uri, Object body, String operation) throws GenerationException {
        try {
            JsonNode node = client.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(errorBody -> classify(resp.statusCode(), operation, errorBody)))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            return requireBody(node, operation);
        } catch (RuntimeException e) {
            throw translate(e, operation);
        }
    }

    public JsonNode get(String uri, String operation, Object... uriVariables) throws GenerationException {
        try {
            JsonNode node = client.get()
                    .uri(uri, uriVariables)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(errorBody -> classify(resp.statusCode(), operation, errorBody)))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            return requireBody(node, operation);
        } catch (RuntimeException e) {
            throw translate(e, operation);
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode requireBody(JsonNode node, String operation) throws GenerationException {
        if (node == null) {
            throw new GenerationException(operation + " returned an empty response");
        }
        return node;
    }

    static GenerationException classify(HttpStatusCode status, String operation, String body) {
        String message = "%s failed status=%s body=%s".formatted(operation, status.value(), truncate(body));
        boolean retryable = status.is5xxServerError()
                || status.value() == HttpStatus.REQUEST_TIMEOUT.value()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
        return retryable ? new GenerationException(message) : new PermanentGenerationException(message);
    }

    private static GenerationException translate(RuntimeException e, String operation) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof GenerationException ge) {
            return ge;
        }
        if (cause instanceof TimeoutException) {
            return new GenerationException(operation + " timed out", cause);
        }
        return new GenerationException(operation + " failed: " + cause.getMessage(), cause);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
