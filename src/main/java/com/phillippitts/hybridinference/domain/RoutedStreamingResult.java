package com.phillippitts.hybridinference.domain;

import reactor.core.publisher.Flux;

/**
 * Streaming result. The decision covers backend selection only; routing never changes once
 * the token stream has started.
 */
public record RoutedStreamingResult(Flux<String> stream, RoutingDecision routingDecision) { }
