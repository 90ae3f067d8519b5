package io.intellixity.polydata.notify;

/**
 * Delivers published payloads to remote clients joined to a channel (WebSocket sessions, ...).
 * Implementations must not block the publisher for long.
 */
public interface RealtimeTransport {
  void deliver(String channel, Object payload);
}
