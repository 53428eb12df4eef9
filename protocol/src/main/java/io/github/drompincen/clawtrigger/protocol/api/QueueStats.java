package io.github.drompincen.clawtrigger.protocol.api;

public record QueueStats(long ready, long claimed, long dead) {

    public long total() {
        return ready + claimed + dead;
    }
}
