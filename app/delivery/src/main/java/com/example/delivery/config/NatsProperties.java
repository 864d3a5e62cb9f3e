/*
 * Where: delivery configuration binding
 * What: NATS connection settings
 * Why: the broker endpoint differs per environment
 */
package com.example.delivery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
