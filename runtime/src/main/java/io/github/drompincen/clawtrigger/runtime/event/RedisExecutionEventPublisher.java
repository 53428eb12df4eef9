package io.github.drompincen.clawtrigger.runtime.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawtrigger.protocol.event.ExecutionUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConditionalOnProperty(name = "clawtrigger.events.redis.enabled", havingValue = "true")
public class RedisExecutionEventPublisher implements ExecutionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RedisExecutionEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisExecutionEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                        @Value("${clawtrigger.events.redis.channel:clawtrigger:events}") String channel) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    @Override
    public void publish(String topic, ExecutionUpdateEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", ExecutionUpdateEvent.EVENT_NAME);
        envelope.put("room", topic);
        envelope.put("data", event);
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(envelope));
            log.debug("Published execution {} to {} on {}", event.executionId(), topic, channel);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize update for execution " + event.executionId(), e);
        }
    }
}
