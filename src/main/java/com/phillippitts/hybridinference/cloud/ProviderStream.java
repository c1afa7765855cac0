package com.phillippitts.hybridinference.cloud;

import reactor.core.publisher.Flux;

/** A token stream together with the id of the provider serving it. */
public record ProviderStream(String providerId, Flux<String> stream) { }
