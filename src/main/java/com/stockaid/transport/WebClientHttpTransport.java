package com.stockaid.transport;

import com.stockaid.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} on top of the reactive {@link WebClient}, blocking for exactly one response.
 */
@Slf4j
public class WebClientHttpTransport implements HttpTransport {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientHttpTransport(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public TransportResponse execute(OutgoingRequest request) {
        URI uri;
        try {
            uri = toUri(request);
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request url: " + request.getUrl(), e);
        }

        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                .uri(uri)
                .accept(MediaType.ALL);

        WebClient.RequestHeadersSpec<?> headersSpec = spec;
        if (request.getBody() != null) {
            headersSpec = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getBody());
        }

        try {
            TransportResponse response = headersSpec
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new TransportResponse(clientResponse.statusCode().value(), body)))
                    .switchIfEmpty(Mono.error(new IllegalStateException("No response")))
                    .block(timeout);
            log.debug("{} -> HTTP {}", request, response.getStatusCode());
            return response;

        } catch (RuntimeException e) {
            throw new TransportException("Request failed: " + request + " (" + e.getMessage() + ")", e);
        }
    }

    static URI toUri(OutgoingRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getUrl());
        for (Map.Entry<String, String> param : request.getQueryParams().entrySet()) {
            // '+' would be read as a space by the provider, so only unreserved characters stay literal
            builder.queryParam(
                    UriUtils.encode(param.getKey(), StandardCharsets.UTF_8),
                    UriUtils.encode(param.getValue(), StandardCharsets.UTF_8));
        }
        return builder.build(true).toUri();
    }
}
