package com.scholary.captioner.progress;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Rate-limited fan-out of progress snapshots.
 *
 * <p>Non-terminal snapshots are coalesced: at most one delivery per interval, carrying the latest
 * snapshot published. A terminal snapshot replaces anything pending and goes out immediately.
 *
 * <p>All deliveries run on the scheduler, which must have a single thread, so subscribers see
 * snapshots in publication order.
 */
public class ProgressBroadcaster {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressBroadcaster.class);

  private final TaskScheduler scheduler;
  private final long minIntervalNanos;
  private final List<ProgressSubscriber> subscribers = new CopyOnWriteArrayList<>();

  private final Object lock = new Object();
  private ProgressSnapshot latest = ProgressSnapshot.idle();
  private ProgressSnapshot pending;
  private ScheduledFuture<?> pendingFlush;
  private long lastPushNanos;

  public ProgressBroadcaster(TaskScheduler scheduler, Duration minInterval) {
    this.scheduler = scheduler;
    this.minIntervalNanos = minInterval.toNanos();
    this.lastPushNanos = System.nanoTime() - minIntervalNanos;
  }

  /**
   * Add a subscriber. It receives the current snapshot right away, then every push.
   *
   * @return a handle that removes the subscriber
   */
  public Runnable subscribe(ProgressSubscriber subscriber) {
    subscribers.add(subscriber);
    scheduler.schedule(
        () -> {
          ProgressSnapshot current;
          synchronized (lock) {
            current = latest;
          }
          deliver(subscriber, current);
        },
        Instant.now());
    return () -> unsubscribe(subscriber);
  }

  public void unsubscribe(ProgressSubscriber subscriber) {
    subscribers.remove(subscriber);
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /** Publish a snapshot. Never blocks on subscribers. */
  public void publish(ProgressSnapshot snapshot) {
    synchronized (lock) {
      latest = snapshot;

      if (snapshot.isTerminal()) {
        pending = null;
        if (pendingFlush != null) {
          pendingFlush.cancel(false);
          pendingFlush = null;
        }
        lastPushNanos = System.nanoTime();
        scheduler.schedule(() -> deliverAll(snapshot), Instant.now());
        return;
      }

      pending = snapshot;
      if (pendingFlush != null) {
        return;
      }
      long waitNanos = Math.max(0, minIntervalNanos - (System.nanoTime() - lastPushNanos));
      pendingFlush = scheduler.schedule(this::flush, Instant.now().plusNanos(waitNanos));
    }
  }

  private void flush() {
    ProgressSnapshot snapshot;
    synchronized (lock) {
      snapshot = pending;
      pending = null;
      pendingFlush = null;
      lastPushNanos = System.nanoTime();
    }
    if (snapshot != null) {
      deliverAll(snapshot);
    }
  }

  private void deliverAll(ProgressSnapshot snapshot) {
    for (ProgressSubscriber subscriber : subscribers) {
      deliver(subscriber, snapshot);
    }
  }

  private void deliver(ProgressSubscriber subscriber, ProgressSnapshot snapshot) {
    if (!subscribers.contains(subscriber)) {
      return;
    }
    try {
      subscriber.onSnapshot(snapshot);
    } catch (IOException | RuntimeException e) {
      subscribers.remove(subscriber);
      LOGGER.debug("Dropped progress subscriber after failed delivery: {}", e.getMessage());
    }
  }
}
