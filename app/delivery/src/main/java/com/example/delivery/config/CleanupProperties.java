/*
 * Where: delivery configuration binding
 * What: schedule of the pending-delivery sweep
 * Why: operators can disable or slow the sweep without redeploying
 */
package com.example.delivery.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery.cleanup")
@Validated
public record CleanupProperties(boolean enabled, @NotNull @Positive Long interval) {}
