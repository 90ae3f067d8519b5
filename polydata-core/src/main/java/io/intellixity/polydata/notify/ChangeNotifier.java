package io.intellixity.polydata.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process publish/subscribe of entity lifecycle events.
 * <p>
 * A payload published to a channel reaches the subscriptions of exactly that channel and every
 * registered {@link RealtimeTransport}. Channels are created on first subscribe and dropped when
 * their last subscription closes.
 */
public final class ChangeNotifier {
  private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

  private final Map<String, Set<Subscription>> channels = new ConcurrentHashMap<>();
  private final List<RealtimeTransport> transports = new CopyOnWriteArrayList<>();

  public Subscription subscribe(String channel) {
    Objects.requireNonNull(channel, "channel");
    Subscription s = new Subscription(channel, this::unsubscribe);
    channels.compute(channel, (k, subs) -> {
      Set<Subscription> out = (subs == null) ? new CopyOnWriteArraySet<>() : subs;
      out.add(s);
      return out;
    });
    log.debug("polydata.notify op=subscribe channel={}", channel);
    return s;
  }

  public void unsubscribe(Subscription subscription) {
    channels.computeIfPresent(subscription.channel(), (k, subs) -> {
      subs.remove(subscription);
      return subs.isEmpty() ? null : subs;
    });
  }

  public void publish(String channel, Object payload) {
    Objects.requireNonNull(channel, "channel");
    Set<Subscription> subs = channels.get(channel);
    int local = 0;
    if (subs != null) {
      for (Subscription s : subs) {
        s.offer(payload);
        local++;
      }
    }
    for (RealtimeTransport t : transports) {
      try {
        t.deliver(channel, payload);
      } catch (RuntimeException e) {
        log.warn("polydata.notify op=deliver channel={} transport={} status=failed reason={}",
            channel, t.getClass().getSimpleName(), e.toString());
      }
    }
    log.debug("polydata.notify op=publish channel={} subscribers={} transports={}", channel, local, transports.size());
  }

  public void addTransport(RealtimeTransport transport) {
    transports.add(Objects.requireNonNull(transport, "transport"));
  }

  public void removeTransport(RealtimeTransport transport) {
    transports.remove(transport);
  }

  public int subscriberCount(String channel) {
    Set<Subscription> subs = channels.get(channel);
    return subs == null ? 0 : subs.size();
  }

  /** Channels with at least one open subscription. */
  public int channelCount() {
    return channels.size();
  }

  /** Close every subscription; consumers blocked in {@code next()} observe end of stream. */
  public void closeAll() {
    for (Set<Subscription> subs : channels.values()) {
      for (Subscription s : subs) s.close();
    }
    channels.clear();
  }
}
