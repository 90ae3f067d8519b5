package io.intellixity.polydata.web.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydata.Polydata;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnProperty(prefix = "polydata", name = "enable-realtime", havingValue = "true", matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {
  public static final String PATH = "/realtime";

  private final RealtimeWebSocketHandler handler;

  public WebSocketConfig(Polydata polydata, ObjectMapper mapper) {
    this.handler = new RealtimeWebSocketHandler(mapper);
    polydata.addRealtimeTransport(handler);
  }

  @Bean
  public RealtimeWebSocketHandler realtimeWebSocketHandler() {
    return handler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, PATH).setAllowedOrigins("*");
  }
}
