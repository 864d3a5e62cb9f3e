/*
 * Where: pending-delivery store integration tests
 * What: runs the confirm script and key sweeps against a real Redis
 * Why: first-confirmer-wins depends on Lua atomicity that a mock cannot show
 */
package com.example.delivery.pending;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.delivery.config.ConfirmationProperties;
import com.example.delivery.model.PendingDelivery;
import com.example.delivery.model.PendingDeliveryMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
class RedisPendingDeliveryStoreIntegrationTest {

  private static final Duration TTL = Duration.ofSeconds(60);
  private static final int REDIS_PORT = 6379;

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(REDIS_PORT);

  private static LettuceConnectionFactory connectionFactory;
  private StringRedisTemplate redisTemplate;
  private RedisPendingDeliveryStore store;

  @BeforeAll
  static void connect() {
    connectionFactory =
        new LettuceConnectionFactory(REDIS.getHost(), REDIS.getMappedPort(REDIS_PORT));
    connectionFactory.afterPropertiesSet();
    connectionFactory.start();
  }

  @AfterAll
  static void disconnect() {
    connectionFactory.destroy();
  }

  @BeforeEach
  void setUp() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.execute(
        (RedisCallback<Void>)
            connection -> {
              connection.serverCommands().flushAll();
              return null;
            });
    store =
        new RedisPendingDeliveryStore(
            redisTemplate,
            new ObjectMapper(),
            new ConfirmationProperties(TTL, Duration.ofMillis(500), Duration.ofSeconds(2)));
  }

  @Test
  void confirmationMovesRecordToMarkerOnce() {
    stage("msg_1_u1");

    final Optional<PendingDelivery> first = store.confirmDelivery("msg_1_u1");
    final Optional<PendingDelivery> second = store.confirmDelivery("msg_1_u1");

    assertThat(first).isPresent();
    assertThat(first.get().payload()).containsEntry("eventName", "invite.created");
    assertThat(second).isEmpty();
    assertThat(store.isPending("msg_1_u1")).isFalse();
    assertThat(store.takeConfirmation("msg_1_u1")).isPresent();
    assertThat(store.takeConfirmation("msg_1_u1")).isEmpty();
  }

  @Test
  void racingConfirmersSeeAtMostOneRecord() throws Exception {
    stage("msg_2_u1");
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Callable<Optional<PendingDelivery>>> tasks = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        tasks.add(() -> store.confirmDelivery("msg_2_u1"));
      }
      int winners = 0;
      for (Future<Optional<PendingDelivery>> result : pool.invokeAll(tasks)) {
        if (result.get().isPresent()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void removedRecordCannotBeConfirmed() {
    stage("msg_3_u1");

    store.removePendingDelivery("msg_3_u1");

    assertThat(store.confirmDelivery("msg_3_u1")).isEmpty();
    assertThat(store.takeConfirmation("msg_3_u1")).isEmpty();
  }

  @Test
  void stagedRecordCarriesTtlAndIsListed() {
    stage("msg_4_u1");
    stage("msg_4_u2");

    assertThat(redisTemplate.getExpire("delivery:pending:msg_4_u1")).isPositive();
    assertThat(store.listPending()).containsExactlyInAnyOrder("msg_4_u1", "msg_4_u2");
    assertThat(store.pendingCount()).isEqualTo(2L);
  }

  @Test
  void sweepEvictsOnlyRecordsWithoutExpiry() {
    stage("msg_5_u1");
    redisTemplate.opsForValue().set("delivery:pending:msg_5_u2", "{}");

    final int removed = store.cleanupExpired();

    assertThat(removed).isEqualTo(1);
    assertThat(store.listPending()).containsExactly("msg_5_u1");
  }

  private void stage(String messageId) {
    store.storePendingDelivery(
        messageId,
        Map.of("eventName", "invite.created"),
        new PendingDeliveryMetadata("u1", "t1", 1_000L, "notifications.realtimes"),
        TTL);
  }
}
