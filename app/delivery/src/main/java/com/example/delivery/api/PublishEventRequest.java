package com.example.delivery.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** Body of the debug endpoint that injects a domain event; id defaults to a random UUID. */
public record PublishEventRequest(String id, @NotBlank String name, Map<String, Object> payload) {}
