package io.github.drompincen.clawtrigger.gateway.controller;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.protocol.api.QueueStats;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueueControllerTest {

    @Mock private ExecutionQueue queue;

    private QueueController controller;

    @BeforeEach
    void setUp() {
        controller = new QueueController(queue);
    }

    @Test
    void statsComeFromQueue() {
        when(queue.stats()).thenReturn(new QueueStats(3, 1, 2));

        assertThat(controller.stats().total()).isEqualTo(6);
    }

    @Test
    void deadLettersListed() {
        QueuedJob dead = new QueuedJob("j1", QueuedJobDocument.Kind.EXECUTION, "e1", 5, 5, null,
                "Handler crashed", Instant.now());
        when(queue.listDeadLetters()).thenReturn(List.of(dead));

        assertThat(controller.deadLetters()).containsExactly(dead);
    }

    @Test
    void requeueKnownAndUnknown() {
        when(queue.requeueDeadLetter("j1")).thenReturn(true);
        when(queue.requeueDeadLetter("nope")).thenReturn(false);

        assertThat(controller.requeue("j1").getStatusCode().value()).isEqualTo(200);
        assertThat(controller.requeue("nope").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void purgeReportsCount() {
        when(queue.purgeDeadLetters()).thenReturn(4L);

        assertThat(controller.purge()).containsEntry("purged", 4L);
    }
}
