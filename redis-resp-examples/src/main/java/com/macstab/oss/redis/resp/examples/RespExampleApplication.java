/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.resp.examples.task.ExampleTask;

import lombok.extern.slf4j.Slf4j;

/**
 * Example programs for the RESP client.
 *
 * <p>Run with: {@code mvn -pl redis-resp-examples spring-boot:run
 * -Dspring-boot.run.arguments=--resp.example.task=stream-consumer}
 *
 * <p>Requires Redis on localhost:6379 or configure via:
 *
 * <pre>{@code
 * resp.example.host=your-redis-host
 * resp.example.port=6379
 * }</pre>
 *
 * <p>Tasks: {@code counter}, {@code stream-producer}, {@code stream-consumer}, {@code publisher},
 * {@code pubsub-listener}.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(RespExampleProperties.class)
public class RespExampleApplication {

  public static void main(String[] args) {
    SpringApplication.run(RespExampleApplication.class, args);
  }

  @Bean
  CommandLineRunner exampleRunner(
      final List<ExampleTask> tasks, final RespExampleProperties properties) {
    return args -> {
      final var task = select(tasks, properties.getTask());
      log.info(
          "=== RESP example '{}' against {}:{} ===",
          task.name(),
          properties.getHost(),
          properties.getPort());
      try {
        task.run();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Example '{}' interrupted", task.name());
      }
      log.info("=== Example '{}' complete ===", task.name());
    };
  }

  static ExampleTask select(final List<ExampleTask> tasks, final String name) {
    return tasks.stream()
        .filter(task -> task.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(unknownTask(tasks, name)));
  }

  private static String unknownTask(final List<ExampleTask> tasks, final String name) {
    final var known = tasks.stream().map(ExampleTask::name).sorted().collect(Collectors.toList());
    return "Unknown resp.example.task '" + name + "', expected one of " + known;
  }
}
