package io.intellixity.polydata.notify;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Forward-only stream of payloads published to one channel after this subscription was opened.
 * <p>
 * Backed by an unbounded per-subscriber queue, so publishers never wait for slow consumers.
 * {@link #next()} parks the consumer until a payload arrives; after {@link #close()} it reports the
 * end of the stream.
 */
public final class Subscription implements Iterator<Object>, AutoCloseable {
  private static final Object END = new Object();

  private final String channel;
  private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Consumer<Subscription> onClose;
  private Object lookahead;

  Subscription(String channel, Consumer<Subscription> onClose) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  public String channel() { return channel; }

  public boolean isClosed() { return closed.get(); }

  void offer(Object payload) {
    if (!closed.get()) queue.add(payload == null ? NullPayload.INSTANCE : payload);
  }

  /** Blocks until a payload is available or the subscription is closed. */
  @Override
  public boolean hasNext() {
    if (lookahead != null) return lookahead != END;
    try {
      lookahead = queue.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
    return lookahead != END;
  }

  @Override
  public Object next() {
    if (!hasNext()) throw new NoSuchElementException("Subscription closed: " + channel);
    Object v = lookahead;
    lookahead = null;
    return unwrap(v);
  }

  /**
   * Next payload, waiting at most {@code timeout}.
   *
   * @return the payload, or {@code null} when the timeout elapsed or the subscription is closed
   */
  public Object poll(Duration timeout) throws InterruptedException {
    if (lookahead != null) {
      if (lookahead == END) return null;
      Object v = lookahead;
      lookahead = null;
      return unwrap(v);
    }
    Object v = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (v == null) return null;
    if (v == END) {
      lookahead = END;
      return null;
    }
    return unwrap(v);
  }

  /** Payloads queued but not yet consumed. */
  public int pending() {
    return queue.size();
  }

  /** Unsubscribes; wakes a consumer blocked in {@link #next()}. Idempotent. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    onClose.accept(this);
    queue.add(END);
  }

  private static Object unwrap(Object v) {
    return (v == NullPayload.INSTANCE) ? null : v;
  }

  private enum NullPayload { INSTANCE }
}
