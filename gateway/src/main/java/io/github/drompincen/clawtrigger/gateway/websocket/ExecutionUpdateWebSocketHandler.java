package io.github.drompincen.clawtrigger.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawtrigger.protocol.event.ExecutionUpdateEvent;
import io.github.drompincen.clawtrigger.protocol.ws.WsMessage;
import io.github.drompincen.clawtrigger.protocol.ws.WsMessageType;
import io.github.drompincen.clawtrigger.runtime.event.ExecutionEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes execution updates to browser sessions of this process. A client sends
 * {@code {"type":"SUBSCRIBE_USER","userId":"..."}} and then receives every update on {@code user:<id>}.
 */
@Component
public class ExecutionUpdateWebSocketHandler extends TextWebSocketHandler implements ExecutionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionUpdateWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Map<String, Set<WebSocketSession>> topicSubscriptions = new ConcurrentHashMap<>();
    private final Set<WebSocketSession> allSessions = new CopyOnWriteArraySet<>();

    public ExecutionUpdateWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        allSessions.add(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        allSessions.remove(session);
        topicSubscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String userId = node.path("userId").asText();

        if (userId.isEmpty()) {
            send(session, WsMessage.error(null, objectMapper.createObjectNode().put("message", "userId is required")));
            return;
        }
        String topic = ExecutionUpdateEvent.userTopic(userId);
        if (WsMessageType.SUBSCRIBE_USER.name().equals(type)) {
            topicSubscriptions.computeIfAbsent(topic, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, topic, null));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            Set<WebSocketSession> set = topicSubscriptions.get(topic);
            if (set != null) set.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, topic, null));
        } else {
            send(session, WsMessage.error(topic, objectMapper.createObjectNode().put("message", "Unknown type: " + type)));
        }
    }

    @Override
    public void publish(String topic, ExecutionUpdateEvent event) {
        Set<WebSocketSession> subscribers = topicSubscriptions.get(topic);
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        WsMessage message = WsMessage.of(WsMessageType.EXECUTION_UPDATE, topic, objectMapper.valueToTree(event));
        for (WebSocketSession ws : subscribers) {
            if (ws.isOpen()) {
                try {
                    send(ws, message);
                } catch (IOException e) {
                    log.debug("Dropping update for closed session {}: {}", ws.getId(), e.getMessage());
                }
            }
        }
    }

    public int subscriberCount(String topic) {
        Set<WebSocketSession> set = topicSubscriptions.get(topic);
        return set != null ? set.size() : 0;
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        // WebSocketSession is not safe for concurrent sends.
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }
    }
}
