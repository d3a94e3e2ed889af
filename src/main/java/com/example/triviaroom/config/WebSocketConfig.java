package com.example.triviaroom.config;

import com.example.triviaroom.handler.TriviaWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Registers the multiplayer socket with the origin patterns from {@link WebSocketProperties}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final TriviaWebSocketHandler handler;
  private final WebSocketProperties props;

  public WebSocketConfig(TriviaWebSocketHandler handler, WebSocketProperties props) {
    this.handler = handler;
    this.props = props;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    String[] patterns = props.originPatterns().toArray(String[]::new);
    if (props.isDebugOpen()) log.warn("WS origin check disabled (app.websocket.debug-open=true)");
    registry.addHandler(handler, props.getPath())
            .setAllowedOriginPatterns(patterns);
  }
}
