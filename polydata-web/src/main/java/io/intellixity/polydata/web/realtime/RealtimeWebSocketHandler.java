package io.intellixity.polydata.web.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydata.notify.RealtimeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket side of the change notifier.
 * <p>
 * Clients join and leave channels with {@code {"type":"subscribe","channel":"users:created"}} and
 * {@code {"type":"unsubscribe",...}}; payloads published to a joined channel arrive as
 * {@code {"event":"data","channel":...,"payload":...}}. Membership ends with the connection.
 */
public final class RealtimeWebSocketHandler extends TextWebSocketHandler implements RealtimeTransport {
  private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

  static final int SEND_TIME_LIMIT_MS = 5_000;
  static final int BUFFER_SIZE_LIMIT = 512 * 1024;

  private final ObjectMapper mapper;
  private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> members = new ConcurrentHashMap<>();

  public RealtimeWebSocketHandler(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    log.debug("polydata.realtime op=connect session={}", session.getId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
    JsonNode msg;
    try {
      msg = mapper.readTree(message.getPayload());
    } catch (JsonProcessingException e) {
      reject(session, "Malformed message");
      return;
    }
    String type = msg.path("type").asText("");
    String channel = msg.path("channel").asText("");
    if (channel.isBlank()) {
      reject(session, "channel is required");
      return;
    }
    switch (type) {
      case "subscribe" -> join(session.getId(), channel);
      case "unsubscribe" -> leave(session.getId(), channel);
      default -> reject(session, "Unknown message type: " + type);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    sessions.remove(session.getId());
    for (String channel : members.keySet()) drop(session.getId(), channel);
    log.debug("polydata.realtime op=disconnect session={} code={}", session.getId(), status.getCode());
  }

  @Override
  public void deliver(String channel, Object payload) {
    Set<String> ids = members.get(channel);
    if (ids == null || ids.isEmpty()) return;
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("event", "data");
    event.put("channel", channel);
    event.put("payload", payload);
    TextMessage text;
    try {
      text = new TextMessage(mapper.writeValueAsString(event));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload on channel " + channel + " is not serializable", e);
    }
    for (String id : ids) {
      WebSocketSession s = sessions.get(id);
      if (s == null || !s.isOpen()) continue;
      try {
        s.sendMessage(text);
      } catch (IOException | RuntimeException e) {
        log.warn("polydata.realtime op=send channel={} session={} status=failed reason={}", channel, id, e.toString());
      }
    }
  }

  /** Channels with at least one joined session. */
  public int channelCount() {
    return members.size();
  }

  /** Sessions joined to {@code channel}. */
  public int memberCount(String channel) {
    Set<String> ids = members.get(channel);
    return ids == null ? 0 : ids.size();
  }

  private void join(String sessionId, String channel) {
    members.compute(channel, (k, ids) -> {
      Set<String> out = (ids == null) ? ConcurrentHashMap.newKeySet() : ids;
      out.add(sessionId);
      return out;
    });
    log.debug("polydata.realtime op=subscribe session={} channel={}", sessionId, channel);
  }

  private void leave(String sessionId, String channel) {
    drop(sessionId, channel);
    log.debug("polydata.realtime op=unsubscribe session={} channel={}", sessionId, channel);
  }

  private void drop(String sessionId, String channel) {
    members.computeIfPresent(channel, (k, ids) -> {
      ids.remove(sessionId);
      return ids.isEmpty() ? null : ids;
    });
  }

  private void reject(WebSocketSession session, String reason) throws IOException {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("event", "error");
    event.put("message", reason);
    WebSocketSession s = sessions.getOrDefault(session.getId(), session);
    s.sendMessage(new TextMessage(mapper.writeValueAsString(event)));
  }
}
