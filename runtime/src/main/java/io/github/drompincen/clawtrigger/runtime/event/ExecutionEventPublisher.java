package io.github.drompincen.clawtrigger.runtime.event;

import io.github.drompincen.clawtrigger.protocol.event.ExecutionUpdateEvent;

public interface ExecutionEventPublisher {

    void publish(String topic, ExecutionUpdateEvent event);
}
