package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.config.JacksonConfiguration;
import com.conduit.exception.ProviderPermanentException;
import com.conduit.exception.ProviderTransientException;
import com.conduit.model.CompletionRequest;
import com.conduit.model.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatibleAdapterTest {

    private ObjectMapper objectMapper;
    private ConduitProperties.AdapterConfig config;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        config = new ConduitProperties.AdapterConfig();
        config.setBaseUrl("https://api.example.test/v1");
        config.setApiKey("sk-test");
        config.setModel("gpt-test");
        config.setTimeout(Duration.ofSeconds(5));
        lastRequest = new AtomicReference<>();
    }

    private OpenAiCompatibleAdapter adapterReplying(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new OpenAiCompatibleAdapter("openai", webClient, objectMapper, config);
    }

    private static CompletionRequest request() {
        return CompletionRequest.builder()
                .id("req-1")
                .message(Message.of("system", "be brief"))
                .message(Message.of("user", "hello"))
                .capability("chat")
                .principal("team-a")
                .maxTokens(64)
                .temperature(0.3)
                .build();
    }

    @Test
    void testParsesContentAndUsage() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.OK,
                "{\"model\":\"gpt-test-0613\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"hi there\"}}],"
                        + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3}}");

        StepVerifier.create(adapter.generate(request()))
                .assertNext(response -> {
                    assertEquals("req-1", response.getRequestId());
                    assertEquals("openai", response.getProviderName());
                    assertEquals("gpt-test-0613", response.getModel());
                    assertEquals("hi there", response.getContent());
                    assertEquals(12, response.getUsage().getInputTokens());
                    assertEquals(3, response.getUsage().getOutputTokens());
                    assertFalse(response.isCached());
                })
                .verifyComplete();

        ClientRequest sent = lastRequest.get();
        assertEquals("https://api.example.test/v1/chat/completions", sent.url().toString());
        assertEquals("Bearer sk-test", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testEstimatesUsageWhenVendorOmitsIt() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"abcdefgh\"}}]}");

        StepVerifier.create(adapter.generate(request()))
                .assertNext(response -> {
                    assertEquals("gpt-test", response.getModel());
                    assertEquals(2, response.getUsage().getOutputTokens());
                    assertTrue(response.getUsage().getInputTokens() > 0);
                })
                .verifyComplete();
    }

    @Test
    void testRateLimitIsTransient() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}");

        StepVerifier.create(adapter.generate(request()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderTransientException);
                    assertFalse(((ProviderTransientException) error).isUnknown());
                })
                .verify();
    }

    @Test
    void testServerErrorIsTransient() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.BAD_GATEWAY, "{}");

        StepVerifier.create(adapter.generate(request()))
                .expectError(ProviderTransientException.class)
                .verify();
    }

    @Test
    void testClientErrorIsPermanent() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}");

        StepVerifier.create(adapter.generate(request()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderPermanentException);
                    assertEquals("openai", ((ProviderPermanentException) error).getProvider());
                })
                .verify();
    }

    @Test
    void testMissingContentIsTransient() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.OK, "{\"choices\":[]}");

        StepVerifier.create(adapter.generate(request()))
                .expectError(ProviderTransientException.class)
                .verify();
    }

    @Test
    void testEmptyBodyIsTransient() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.OK, "");

        StepVerifier.create(adapter.generate(request()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderTransientException);
                    assertTrue(error.getMessage().contains("empty reply"));
                })
                .verify();
    }

    @Test
    void testVendorRequestCarriesSamplingParameters() {
        OpenAiCompatibleAdapter adapter = adapterReplying(HttpStatus.OK, "{}");

        JsonNode body = adapter.toVendorRequest(request());

        assertEquals("gpt-test", body.get("model").asText());
        assertEquals(2, body.get("messages").size());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals(64, body.get("max_tokens").asInt());
        assertEquals(0.3, body.get("temperature").asDouble(), 1e-9);
    }
}
