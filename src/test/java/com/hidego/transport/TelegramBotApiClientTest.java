package com.hidego.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TelegramBotApiClientTest {

    private static final String TOKEN = "123456:ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghij";

    private final List<ClientRequest> requests = new ArrayList<>();

    private TelegramBotApiClient clientAnswering(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status, ExchangeStrategies.withDefaults())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new TelegramBotApiClient(builder, new ObjectMapper(), "https://api.test", TOKEN, Duration.ofSeconds(5));
    }

    @Test
    void getMeUnwrapsResult() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.OK,
                "{\"ok\":true,\"result\":{\"id\":77,\"is_bot\":true,\"first_name\":\"Alpha\",\"username\":\"alpha_bot\"}}");

        StepVerifier.create(client.getMe())
                .assertNext(user -> {
                    assertEquals(77L, user.id());
                    assertTrue(user.bot());
                    assertEquals("alpha_bot", user.username());
                })
                .verifyComplete();

        assertEquals("https://api.test/bot" + TOKEN + "/getMe", requests.get(0).url().toString());
    }

    @Test
    void copyMessageReturnsNewMessageId() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.OK, "{\"ok\":true,\"result\":{\"message_id\":555}}");

        StepVerifier.create(client.copyMessage(42L, 1001L, 7L, null, null))
                .expectNext(555L)
                .verifyComplete();
    }

    @Test
    void forbiddenErrorIsClassified() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.FORBIDDEN,
                "{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot was blocked by the user\"}");

        StepVerifier.create(client.sendMessage(OutboundMessage.text(1001L, "hi")))
                .expectErrorSatisfies(e -> {
                    assertTrue(TransportException.isKind(e, TransportErrorKind.FORBIDDEN));
                    assertEquals("sendMessage", ((TransportException) e).method());
                })
                .verify();
    }

    @Test
    void badRequestIsNotTransient() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.BAD_REQUEST,
                "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message can't be copied\"}");

        StepVerifier.create(client.copyMessage(42L, 1001L, 7L, 3L, null))
                .expectErrorSatisfies(e -> {
                    TransportException te = (TransportException) e;
                    assertEquals(TransportErrorKind.BAD_REQUEST, te.kind());
                    assertFalse(te.kind().isTransient());
                })
                .verify();
    }

    @Test
    void rateLimitAndServerErrorsAreTransient() {
        assertTrue(TransportErrorKind.fromErrorCode(429).isTransient());
        assertTrue(TransportErrorKind.fromErrorCode(502).isTransient());
        assertEquals(TransportErrorKind.UNAUTHORIZED, TransportErrorKind.fromErrorCode(401));
        assertFalse(TransportErrorKind.UNAUTHORIZED.isTransient());
    }

    @Test
    void closedTransportRefusesCalls() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.OK, "{\"ok\":true,\"result\":true}");
        client.close();
        client.close();

        assertTrue(client.isClosed());
        StepVerifier.create(client.deleteWebhook())
                .expectError(IllegalStateException.class)
                .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    void voidCallsCompleteOnSuccess() {
        TelegramBotApiClient client = clientAnswering(HttpStatus.OK, "{\"ok\":true,\"result\":true}");

        StepVerifier.create(client.setWebhook("https://relay.test/webhook/" + TOKEN, null, List.of("message")))
                .verifyComplete();
        assertTrue(requests.get(0).url().getPath().endsWith("/setWebhook"));
    }
}
