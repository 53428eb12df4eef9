package io.github.drompincen.clawtrigger.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_USER,
    UNSUBSCRIBE,

    // Server -> Client
    EXECUTION_UPDATE,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
