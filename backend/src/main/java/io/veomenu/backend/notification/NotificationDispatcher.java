package io.veomenu.backend.notification;

import io.veomenu.backend.config.NotificationProperties;
import io.veomenu.backend.notification.DispatchResult.ChannelResult;
import io.veomenu.backend.notification.channel.NotificationChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Routes authentication messages to delivery channels. Channels self-register via constructor
 * injection (Spring collects all NotificationChannel beans).
 *
 * <p>Deliveries run on the bounded {@code notificationExecutor}. {@link #dispatch} waits for each
 * channel at most {@link NotificationProperties#timeout()} and reports per-channel outcomes; a
 * failed channel never throws to the caller.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final Map<String, NotificationChannel> channels;
  private final ThreadPoolTaskExecutor executor;
  private final Duration timeout;

  public NotificationDispatcher(
      List<NotificationChannel> channelBeans,
      @Qualifier("notificationExecutor") ThreadPoolTaskExecutor executor,
      NotificationProperties properties) {
    this.channels =
        channelBeans.stream()
            .collect(Collectors.toMap(NotificationChannel::channelId, Function.identity()));
    this.executor = executor;
    this.timeout = properties.timeout();
  }

  /**
   * Delivers {@code notification} over each named channel in parallel and waits for the outcomes.
   *
   * @param channelIds channels to use, e.g. {@code "email"}, {@code "sms"}
   */
  public DispatchResult dispatch(AuthNotification notification, List<String> channelIds) {
    Map<String, CompletableFuture<Void>> pending = new LinkedHashMap<>();
    List<ChannelResult> results = new ArrayList<>();

    for (String channelId : channelIds) {
      NotificationChannel channel = channels.get(channelId);
      if (channel == null) {
        results.add(ChannelResult.failed(channelId, "Unknown channel"));
        continue;
      }
      try {
        pending.put(
            channelId, CompletableFuture.runAsync(() -> channel.deliver(notification), executor));
      } catch (RejectedExecutionException e) {
        results.add(ChannelResult.failed(channelId, "Dispatch queue full"));
      }
    }

    long deadline = System.nanoTime() + timeout.toNanos();
    for (var entry : pending.entrySet()) {
      results.add(await(entry.getKey(), entry.getValue(), deadline));
    }

    for (ChannelResult result : results) {
      if (!result.success()) {
        log.warn(
            "Failed to deliver {} via channel={}: {}",
            notification.type(),
            result.channelId(),
            result.error());
      }
    }
    return new DispatchResult(results);
  }

  /** Submits a delivery without waiting; failures are only logged. */
  public void dispatchAsync(AuthNotification notification, List<String> channelIds) {
    for (String channelId : channelIds) {
      NotificationChannel channel = channels.get(channelId);
      if (channel == null) {
        log.warn("Skipping {} notification: unknown channel={}", notification.type(), channelId);
        continue;
      }
      try {
        executor.execute(() -> deliverQuietly(channel, notification));
      } catch (RejectedExecutionException e) {
        log.warn("Dropped {} notification: dispatch queue full", notification.type());
      }
    }
  }

  private void deliverQuietly(NotificationChannel channel, AuthNotification notification) {
    try {
      channel.deliver(notification);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to deliver {} via channel={}: {}",
          notification.type(),
          channel.channelId(),
          e.getMessage());
    }
  }

  private ChannelResult await(String channelId, CompletableFuture<Void> future, long deadline) {
    try {
      long remaining = Math.max(0, deadline - System.nanoTime());
      future.get(remaining, TimeUnit.NANOSECONDS);
      return ChannelResult.ok(channelId);
    } catch (TimeoutException e) {
      future.cancel(true);
      return ChannelResult.failed(channelId, "Timed out after " + timeout.toMillis() + "ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return ChannelResult.failed(channelId, cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ChannelResult.failed(channelId, "Interrupted");
    }
  }
}
