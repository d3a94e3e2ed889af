package com.example.triviaroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Configuration
@ConfigurationProperties("app.websocket")
public class WebSocketProperties {

  /** Endpoint of the multiplayer socket. */
  private String path = "/multiplayer";

  /** Browser origins allowed to open the socket; localhost entries match any port. */
  private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8080"));

  /** Accept every origin (local troubleshooting only). */
  private boolean debugOpen = false;

  /** Per-session outbound limits; a client slower than this is dropped. */
  private int sendTimeLimitMs = 10_000;
  private int sendBufferSizeLimit = 512 * 1024;

  /** Origin patterns handed to the handler registration. */
  public List<String> originPatterns() {
    if (debugOpen) return Collections.singletonList("*");
    Set<String> out = new LinkedHashSet<>();
    if (allowedOrigins != null) {
      for (String origin : allowedOrigins) {
        if (origin == null || origin.isBlank()) continue;
        out.addAll(expandToPatterns(origin.trim()));
      }
    }
    return out.isEmpty() ? Collections.singletonList("*") : new ArrayList<>(out);
  }

  static List<String> expandToPatterns(String origin) {
    List<String> out = new ArrayList<>();
    out.add(origin);
    if ("*".equals(origin)) return out;
    if (origin.startsWith("http://localhost") || origin.startsWith("http://127.0.0.1")) {
      out.add("http://localhost:*");
      out.add("http://127.0.0.1:*");
    }
    if (origin.startsWith("https://localhost")) {
      out.add("https://localhost:*");
    }
    return out;
  }

  // --- getters/setters ---

  public String getPath() { return path; }
  public void setPath(String path) { this.path = path; }

  public List<String> getAllowedOrigins() { return allowedOrigins; }
  public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }

  public boolean isDebugOpen() { return debugOpen; }
  public void setDebugOpen(boolean debugOpen) { this.debugOpen = debugOpen; }

  public int getSendTimeLimitMs() { return sendTimeLimitMs; }
  public void setSendTimeLimitMs(int v) { this.sendTimeLimitMs = v; }

  public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
  public void setSendBufferSizeLimit(int v) { this.sendBufferSizeLimit = v; }
}
