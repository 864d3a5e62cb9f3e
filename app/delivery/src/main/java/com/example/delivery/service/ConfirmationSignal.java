/*
 * Where: delivery confirmation wait
 * What: in-process wake-up for threads waiting on client acknowledgments
 * Why: a confirmation should end the wait immediately instead of at the next poll tick
 */
package com.example.delivery.service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class ConfirmationSignal {

  private final ConcurrentMap<String, Semaphore> waiters = new ConcurrentHashMap<>();

  public Waiter register(Collection<String> messageIds) {
    final Semaphore semaphore = new Semaphore(0);
    for (String messageId : messageIds) {
      waiters.put(messageId, semaphore);
    }
    return new Waiter(List.copyOf(messageIds), semaphore);
  }

  /** Wakes the waiter registered for the message id, if it lives on this instance. */
  public void signal(String messageId) {
    final Semaphore semaphore = waiters.get(messageId);
    if (semaphore != null) {
      semaphore.release();
    }
  }

  int registeredCount() {
    return waiters.size();
  }

  public final class Waiter implements AutoCloseable {

    private final List<String> messageIds;
    private final Semaphore semaphore;

    private Waiter(List<String> messageIds, Semaphore semaphore) {
      this.messageIds = messageIds;
      this.semaphore = semaphore;
    }

    /** Returns true when woken by a signal, false when the timeout elapsed. */
    public boolean await(Duration timeout) throws InterruptedException {
      final boolean signalled = semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
      semaphore.drainPermits();
      return signalled;
    }

    @Override
    public void close() {
      for (String messageId : messageIds) {
        waiters.remove(messageId, semaphore);
      }
    }
  }
}
