package com.phillippitts.hybridinference.domain;

/** Generation result enriched with the routing decision that produced it. */
public record RoutedGenerationResult(LlmGenerationResult generationResult, RoutingDecision routingDecision) { }
