package io.github.drompincen.clawtrigger.runtime.subscription;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SubscriptionStateStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private SubscriptionStateStore store;

    @BeforeEach
    void setUp() {
        store = new SubscriptionStateStore(mongoTemplate);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SubscriptionDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
    }

    @Test
    void advanceScheduleClaimsTheFireThatWasRead() {
        Instant dueAt = Instant.parse("2026-05-01T08:00:00Z");
        Instant next = Instant.parse("2026-05-01T09:00:00Z");

        assertThat(store.advanceSchedule("s1", dueAt, next, true, Instant.now())).isTrue();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(SubscriptionDocument.class));
        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("nextExecutionTime")).isEqualTo(dueAt);
        assertThat(criteria.get("enabled")).isEqualTo(true);
        assertThat(criteria.get("deleted")).isEqualTo(false);
        assertThat(criteria).doesNotContainKey("version");
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("nextExecutionTime")).isEqualTo(next);
        assertThat(set.get("enabled")).isEqualTo(true);
        Document inc = (Document) update.getValue().getUpdateObject().get("$inc");
        assertThat(inc).containsKeys("scheduledRunCount", "version");
    }

    @Test
    void lostRaceReportsFalse() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SubscriptionDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.advanceSchedule("s1", Instant.now(), Instant.now(), true, Instant.now())).isFalse();
    }

    @Test
    void failureIncrementsFailureCount() {
        assertThat(store.recordOutcome("s1", ExecutionStatus.FAILED, Instant.now())).isTrue();

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(SubscriptionDocument.class));
        Document inc = (Document) update.getValue().getUpdateObject().get("$inc");
        assertThat(inc).containsKeys("executionCount", "failureCount", "version").doesNotContainKey("successCount");
    }

    @Test
    void silentCompletionLeavesStatisticsAlone() {
        assertThat(store.recordOutcome("s1", ExecutionStatus.COMPLETED_SILENT, Instant.now())).isFalse();
        assertThat(store.recordOutcome("s1", ExecutionStatus.RUNNING, Instant.now())).isFalse();

        verifyNoInteractions(mongoTemplate);
    }
}
