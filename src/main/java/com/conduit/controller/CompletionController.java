package com.conduit.controller;

import com.conduit.model.CacheControlContext;
import com.conduit.model.CacheHeaders;
import com.conduit.model.CompletionRequest;
import com.conduit.model.CompletionResponse;
import com.conduit.service.CacheControlParser;
import com.conduit.service.GatewayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Completion endpoint with cache and routing provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class CompletionController {

    private final GatewayService gatewayService;
    private final CacheControlParser cacheControlParser;

    public CompletionController(GatewayService gatewayService, CacheControlParser cacheControlParser) {
        this.gatewayService = gatewayService;
        this.cacheControlParser = cacheControlParser;
    }

    @PostMapping(value = "/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CompletionResponse>> complete(
            @RequestBody CompletionRequest request,
            @RequestHeader HttpHeaders headers,
            ServerHttpRequest httpRequest) {

        log.debug("Received completion request from principal={}, capabilities={}",
                request.getPrincipal(), request.getCapabilities());

        CacheControlContext cacheContext = cacheControlParser.parse(headers);
        CompletionRequest identified = request.getId() == null || request.getId().isBlank()
                ? request.toBuilder().id(RequestIds.resolve(httpRequest)).build()
                : request;

        return gatewayService.complete(identified, cacheContext)
                .map(response -> {
                    HttpHeaders responseHeaders = new HttpHeaders();
                    responseHeaders.add(CacheHeaders.CACHE_HIT, String.valueOf(response.isCached()));
                    responseHeaders.add(CacheHeaders.PROVIDER, response.getProviderName());
                    responseHeaders.add(CacheHeaders.REQUEST_ID, response.getRequestId());

                    return ResponseEntity.ok()
                            .headers(responseHeaders)
                            .body(response);
                });
    }
}
