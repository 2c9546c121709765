package com.example.notebookengine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint pushing run and cell progress events to every connected client.
 * Broadcasting is fire-and-forget: a failed send never affects the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunEventBroadcaster extends TextWebSocketHandler {

    public static final String RUN_STARTED = "notebook.run_started";
    public static final String CELL_STARTED = "notebook.cell_started";
    public static final String CELL_FINISHED = "notebook.cell_finished";
    public static final String RUN_PAUSED = "notebook.run_paused";
    public static final String RUN_FINISHED = "notebook.run_finished";

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("Progress session connected: {} (total: {})", session.getId(), sessions.size());
        send(session, GatewayMessage.notification("gateway.connected", Map.of(
                "sessionId", session.getId(),
                "version", "0.1.0")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            GatewayMessage request = objectMapper.readValue(message.getPayload(), GatewayMessage.class);
            if ("heartbeat".equals(request.getMethod())) {
                send(session, GatewayMessage.success(request.getId(), Map.of(
                        "status", "alive",
                        "timestamp", Instant.now().toString())));
            } else {
                send(session, GatewayMessage.error(request.getId(), -32601,
                        "Method not found: " + request.getMethod()));
            }
        } catch (IOException e) {
            log.debug("Unparseable frame from {}: {}", session.getId(), e.getMessage());
            send(session, GatewayMessage.error(null, -32700, "Parse error: " + e.getMessage()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Progress session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Broadcast a notification to all open sessions.
     */
    public void broadcast(String method, Object params) {
        GatewayMessage notification = GatewayMessage.notification(method, params);
        sessions.values().forEach(session -> {
            if (session.isOpen()) {
                send(session, notification);
            }
        });
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, GatewayMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.warn("Failed to send {} to session {}: {}", message.getMethod(), session.getId(), e.getMessage());
        }
    }
}
