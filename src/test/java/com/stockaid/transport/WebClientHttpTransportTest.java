package com.stockaid.transport;

import com.stockaid.exception.TransportException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class WebClientHttpTransportTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void testGetWithQueryParams() {
        WebClientHttpTransport transport = transport(HttpStatus.OK, "[{\"a\":1}]");

        TransportResponse response = transport.execute(OutgoingRequest.builder()
                .method("GET")
                .url("http://example.test/ABC/quotes")
                .queryParam("apikey", "k&y=1")
                .queryParam("period", "20")
                .build());

        assertEquals(200, response.getStatusCode());
        assertTrue(response.isSuccessful());
        assertEquals("[{\"a\":1}]", response.getBody());
        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.GET, sent.method());
        assertEquals(URI.create("http://example.test/ABC/quotes?apikey=k%26y%3D1&period=20"), sent.url());
    }

    @Test
    void testReservedCharactersInQueryAreEscaped() {
        URI uri = WebClientHttpTransport.toUri(OutgoingRequest.builder()
                .method("GET")
                .url("http://example.test/chains")
                .queryParam("fromDate", "2024-01-01T00:00:00+00:00")
                .queryParam("apikey", "ab+c/d==")
                .queryParam("q", "a b")
                .build());

        assertEquals("fromDate=2024-01-01T00%3A00%3A00%2B00%3A00&apikey=ab%2Bc%2Fd%3D%3D&q=a%20b",
                uri.getRawQuery());
    }

    @Test
    void testPostSendsJsonBody() {
        WebClientHttpTransport transport = transport(HttpStatus.OK, "ok");

        transport.execute(OutgoingRequest.builder()
                .method("POST")
                .url("http://example.test/search")
                .body("{\"q\":\"x\"}")
                .build());

        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.POST, sent.method());
        assertEquals(MediaType.APPLICATION_JSON, sent.headers().getContentType());
    }

    @Test
    void testErrorStatusStillReturnsBody() {
        WebClientHttpTransport transport = transport(HttpStatus.SERVICE_UNAVAILABLE, "down");

        TransportResponse response = transport.execute(OutgoingRequest.builder()
                .method("GET")
                .url("http://example.test/x")
                .build());

        assertEquals(503, response.getStatusCode());
        assertFalse(response.isSuccessful());
        assertEquals("down", response.getBody());
    }

    @Test
    void testEmptyBodyIsEmptyString() {
        WebClientHttpTransport transport = new WebClientHttpTransport(WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()))
                .build(), Duration.ofSeconds(5));

        TransportResponse response = transport.execute(OutgoingRequest.builder()
                .method("GET")
                .url("http://example.test/x")
                .build());

        assertEquals("", response.getBody());
    }

    @Test
    void testConnectionFailureBecomesTransportException() {
        WebClientHttpTransport transport = new WebClientHttpTransport(WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IllegalStateException("Connection refused")))
                .build(), Duration.ofSeconds(5));

        TransportException e = assertThrows(TransportException.class, () -> transport.execute(
                OutgoingRequest.builder().method("GET").url("http://example.test/x").build()));
        assertTrue(e.getMessage().contains("Connection refused"));
    }

    @Test
    void testTimeoutBecomesTransportException() {
        WebClientHttpTransport transport = new WebClientHttpTransport(WebClient.builder()
                .exchangeFunction(request -> Mono.never())
                .build(), Duration.ofMillis(50));

        assertThrows(TransportException.class, () -> transport.execute(
                OutgoingRequest.builder().method("GET").url("http://example.test/x").build()));
    }

    private WebClientHttpTransport transport(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", MediaType.TEXT_PLAIN_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientHttpTransport(webClient, Duration.ofSeconds(5));
    }
}
