/*
 * Where: delivery configuration binding
 * What: binds delivery.consumers.<name>.* into one ConsumerSettings per queue
 * Why: every consumer is wired from the same validated table
 */
package com.example.delivery.config;

import com.example.delivery.consumer.ConsumerSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery")
@Validated
public record ConsumerProperties(@NotEmpty Map<String, @Valid ConsumerSettings> consumers) {

  public ConsumerProperties {
    consumers = consumers == null ? Map.of() : Map.copyOf(consumers);
  }

  public ConsumerSettings settings(String name) {
    final ConsumerSettings settings = consumers.get(name);
    if (settings == null) {
      throw new IllegalStateException("missing consumer settings: delivery.consumers." + name);
    }
    return settings;
  }
}
