package io.github.drompincen.clawtrigger.runtime.queue;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.persistence.repository.QueuedJobRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument.State;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoExecutionQueueTest {

    @Mock
    private MongoTemplate mongoTemplate;
    @Mock
    private QueuedJobRepository repository;

    private MongoExecutionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new MongoExecutionQueue(mongoTemplate, repository, 90, 3);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(QueuedJobDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
    }

    @Test
    void enqueueInsertsReadyJobWithDelay() {
        Instant before = Instant.now();

        queue.enqueue("j1", QueuedJobDocument.Kind.EXECUTION, "exec-1", Duration.ofSeconds(60));

        ArgumentCaptor<QueuedJobDocument> doc = ArgumentCaptor.forClass(QueuedJobDocument.class);
        verify(mongoTemplate).insert(doc.capture());
        assertThat(doc.getValue().getState()).isEqualTo(State.READY);
        assertThat(doc.getValue().getMaxDeliveries()).isEqualTo(3);
        assertThat(doc.getValue().getAvailableAt()).isAfterOrEqualTo(before.plusSeconds(60));
    }

    @Test
    void enqueueExecutionUsesFreshJobId() {
        String first = queue.enqueueExecution("exec-1", Duration.ZERO);
        String second = queue.enqueueExecution("exec-1", Duration.ZERO);

        assertThat(first).isNotEqualTo(second);
        verify(mongoTemplate, times(2)).insert(any(QueuedJobDocument.class));
    }

    @Test
    void pollClaimsOldestReadyJob() {
        QueuedJobDocument claimed = document("j1", 1);
        claimed.setConsumer("host-w0");
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(QueuedJobDocument.class))).thenReturn(claimed);

        Optional<QueuedJob> job = queue.poll("host-w0");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).findAndModify(query.capture(), update.capture(), any(FindAndModifyOptions.class),
                eq(QueuedJobDocument.class));
        assertThat(job).isPresent();
        assertThat(job.get().consumer()).isEqualTo("host-w0");
        assertThat(job.get().redelivered()).isFalse();
        assertThat(query.getValue().getQueryObject().get("state")).isEqualTo(State.READY);
        assertThat(query.getValue().getSortObject().get("availableAt")).isEqualTo(1);
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("state")).isEqualTo(State.CLAIMED);
        assertThat(set.get("consumer")).isEqualTo("host-w0");
    }

    @Test
    void pollReturnsEmptyWhenNothingReady() {
        assertThat(queue.poll("c")).isEmpty();
    }

    @Test
    void rejectRequeuesWhileDeliveriesRemain() {
        queue.reject(job(1), true, Duration.ofSeconds(30), "boom");

        assertThat(setOfLastUpdate().get("state")).isEqualTo(State.READY);
        assertThat(setOfLastUpdate().get("lastError")).isEqualTo("boom");
    }

    @Test
    void rejectDeadLettersWhenDeliveriesExhausted() {
        queue.reject(job(3), true, Duration.ofSeconds(30), "boom");

        assertThat(setOfLastUpdate().get("state")).isEqualTo(State.DEAD);
    }

    @Test
    void rejectWithoutRequeueDeadLetters() {
        queue.reject(job(1), false, Duration.ZERO, "no handler");

        assertThat(setOfLastUpdate().get("state")).isEqualTo(State.DEAD);
    }

    @Test
    void recoverExpiredLeasesReturnsJobsToReadyOrDead() {
        QueuedJobDocument retryable = document("j1", 1);
        retryable.setConsumer("gone-w0");
        QueuedJobDocument exhausted = document("j2", 3);
        exhausted.setConsumer("gone-w1");
        when(mongoTemplate.find(any(Query.class), eq(QueuedJobDocument.class))).thenReturn(List.of(retryable, exhausted));

        int recovered = queue.recoverExpiredLeases();

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, times(2)).updateFirst(any(Query.class), update.capture(), eq(QueuedJobDocument.class));
        assertThat(recovered).isEqualTo(2);
        Document first = (Document) update.getAllValues().get(0).getUpdateObject().get("$set");
        Document second = (Document) update.getAllValues().get(1).getUpdateObject().get("$set");
        assertThat(first.get("state")).isEqualTo(State.READY);
        assertThat(first.get("lastError")).isEqualTo("Lease of consumer gone-w0 expired");
        assertThat(second.get("state")).isEqualTo(State.DEAD);
    }

    @Test
    void recoveryRaceLostIsNotCounted() {
        when(mongoTemplate.find(any(Query.class), eq(QueuedJobDocument.class))).thenReturn(List.of(document("j1", 1)));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(QueuedJobDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(queue.recoverExpiredLeases()).isZero();
    }

    @Test
    void statsCountsEachState() {
        when(repository.countByState(State.READY)).thenReturn(4L);
        when(repository.countByState(State.CLAIMED)).thenReturn(2L);
        when(repository.countByState(State.DEAD)).thenReturn(1L);

        assertThat(queue.stats().total()).isEqualTo(7);
        assertThat(queue.stats().dead()).isEqualTo(1);
    }

    @Test
    void requeueDeadLetterResetsDeliveries() {
        assertThat(queue.requeueDeadLetter("j1")).isTrue();

        Document set = setOfLastUpdate();
        assertThat(set.get("state")).isEqualTo(State.READY);
        assertThat(set.get("deliveries")).isEqualTo(0);
    }

    @Test
    void purgeDeletesDeadLetters() {
        when(repository.deleteByState(State.DEAD)).thenReturn(5L);

        assertThat(queue.purgeDeadLetters()).isEqualTo(5);
    }

    private Document setOfLastUpdate() {
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, atLeastOnce()).updateFirst(any(Query.class), update.capture(), eq(QueuedJobDocument.class));
        return (Document) update.getValue().getUpdateObject().get("$set");
    }

    private static QueuedJob job(int deliveries) {
        return new QueuedJob("j1", QueuedJobDocument.Kind.EXECUTION, "exec-1", deliveries, 3, "host-w0", null,
                Instant.now());
    }

    private static QueuedJobDocument document(String jobId, int deliveries) {
        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setJobId(jobId);
        doc.setPayload("exec-" + jobId);
        doc.setState(State.CLAIMED);
        doc.setDeliveries(deliveries);
        doc.setMaxDeliveries(3);
        return doc;
    }
}
