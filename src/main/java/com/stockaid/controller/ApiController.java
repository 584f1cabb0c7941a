package com.stockaid.controller;

import com.stockaid.model.ApiResult;
import com.stockaid.model.dto.TableResponse;
import com.stockaid.service.ApiCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP access to registered provider APIs, with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ApiController {

    static final String REFRESH_PARAM = "refresh";
    static final String CACHE_HIT_HEADER = "x-cache-hit";

    private final ApiCache apiCache;

    public ApiController(ApiCache apiCache) {
        this.apiCache = apiCache;
    }

    /**
     * Registered providers and their API names.
     */
    @GetMapping("/providers")
    public Map<String, List<String>> listProviders() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String provider : apiCache.providerNames()) {
            result.put(provider, apiCache.apiNames(provider));
        }
        return result;
    }

    /**
     * Call an API. Every query parameter except {@code refresh} is passed as an argument.
     * Responds 204 when the provider returned no data.
     */
    @GetMapping("/api/{provider}/{api}")
    public Mono<ResponseEntity<TableResponse>> call(
            @PathVariable String provider,
            @PathVariable String api,
            @RequestParam(name = REFRESH_PARAM, defaultValue = "false") boolean refresh,
            @RequestParam MultiValueMap<String, String> params) {

        Map<String, String> args = new LinkedHashMap<>(params.toSingleValueMap());
        args.remove(REFRESH_PARAM);
        log.debug("API request {}.{} args={} refresh={}", provider, api, args.keySet(), refresh);

        // call() blocks on the throttle and the network
        return Mono.fromCallable(() -> apiCache.call(provider, api, args, refresh))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> toResponse(provider, api, result));
    }

    private ResponseEntity<TableResponse> toResponse(String provider, String api, ApiResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(CACHE_HIT_HEADER, String.valueOf(result.isCacheHit()));
        if (!result.hasData()) {
            return ResponseEntity.noContent().headers(headers).build();
        }
        return ResponseEntity.ok()
                .headers(headers)
                .body(TableResponse.of(provider, api, result.isCacheHit(), result.getTable()));
    }
}
