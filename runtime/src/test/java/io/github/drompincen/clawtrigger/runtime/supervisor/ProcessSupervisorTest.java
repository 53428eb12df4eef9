package io.github.drompincen.clawtrigger.runtime.supervisor;

import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.lock.DistributedLock;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.LeaseHeartbeatService;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.trigger.DueSubscriptionEvaluator;
import io.github.drompincen.clawtrigger.runtime.worker.ExecutionWorker;
import io.github.drompincen.clawtrigger.runtime.worker.WorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProcessSupervisorTest {

    @Mock
    private SchedulerBackend backend;
    @Mock
    private DueSubscriptionEvaluator evaluator;
    @Mock
    private WorkerPool workerPool;
    @Mock
    private ExecutionWorker executionWorker;
    @Mock
    private LeaseHeartbeatService leaseHeartbeat;
    @Mock
    private ExecutionQueue queue;
    @Mock
    private DistributedLock lock;
    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ScheduledFuture<Object> leaseRecoveryFuture;

    private SchedulerBackendRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchedulerBackendRegistry("queue");
        registry.register("queue", () -> backend, false);
        when(backend.backendType()).thenReturn("queue");
        doReturn(leaseRecoveryFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    }

    @Test
    void startBringsUpBackendThenWorkers() {
        ProcessSupervisor supervisor = supervisor(true, true);

        supervisor.start();

        InOrder order = inOrder(backend, workerPool, taskScheduler);
        order.verify(backend).scheduleJob(eq(SchedulerBackend.CHECK_DUE_SUBSCRIPTIONS_JOB_ID), anyString(),
                any(Runnable.class), eq(TriggerType.INTERVAL), eq(TriggerConfig.interval(60, IntervalUnit.SECONDS)), eq(true));
        order.verify(backend).start();
        order.verify(workerPool).start();
        order.verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(ProcessSupervisor.LEASE_RECOVERY_INTERVAL));
        assertThat(registry.getActive()).containsSame(backend);
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    void startIsIdempotent() {
        ProcessSupervisor supervisor = supervisor(true, true);

        supervisor.start();
        supervisor.start();

        verify(backend, times(1)).start();
        verify(workerPool, times(1)).start();
    }

    @Test
    void workerOnlyProcessRegistersJobWithoutStartingBackend() {
        ProcessSupervisor supervisor = supervisor(false, true);

        supervisor.start();

        assertThat(registry.getActive()).isEmpty();
        assertThat(registry.getJobHost()).containsSame(backend);

        supervisor.stop();

        assertThat(registry.getJobHost()).isEmpty();
        verify(backend).scheduleJob(anyString(), anyString(), any(Runnable.class), any(), any(), anyBoolean());
        verify(backend, never()).start();
        verify(workerPool).start();
        verify(lock, never()).release(anyString());
    }

    @Test
    void schedulerOnlyProcessDoesNotStartWorkers() {
        ProcessSupervisor supervisor = supervisor(true, false);

        supervisor.start();

        verify(backend).start();
        verify(workerPool, never()).start();
    }

    @Test
    void backendFailureDoesNotKeepWorkersFromStarting() {
        doThrow(new IllegalStateException("admin unreachable")).when(backend).start();
        ProcessSupervisor supervisor = supervisor(true, true);

        supervisor.start();

        verify(workerPool).start();
        assertThat(registry.getActive()).isEmpty();
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    void unknownBackendNameIsSurvived() {
        SchedulerBackendRegistry empty = new SchedulerBackendRegistry("quartz");
        ProcessSupervisor supervisor = new ProcessSupervisor(empty, evaluator, workerPool, executionWorker,
                leaseHeartbeat, queue, lock, taskScheduler, true, true, 60, 5);

        assertThatCode(supervisor::start).doesNotThrowAnyException();
        verify(workerPool).start();
    }

    @Test
    void stopTearsDownInReverseOrderAndReleasesLock() {
        ProcessSupervisor supervisor = supervisor(true, true);
        supervisor.start();

        supervisor.stop();

        InOrder order = inOrder(backend, workerPool, executionWorker, leaseHeartbeat, lock, leaseRecoveryFuture);
        order.verify(backend).stop(true);
        order.verify(workerPool).stop(Duration.ofSeconds(5));
        order.verify(executionWorker).shutdown();
        order.verify(leaseHeartbeat).shutdown();
        order.verify(lock).release(DueSubscriptionEvaluator.LOCK_NAME);
        order.verify(leaseRecoveryFuture).cancel(false);
        assertThat(registry.getActive()).isEmpty();
        assertThat(supervisor.isRunning()).isFalse();
    }

    @Test
    void failingBackendStopStillStopsWorkers() {
        doThrow(new IllegalStateException("boom")).when(backend).stop(anyBoolean());
        ProcessSupervisor supervisor = supervisor(true, true);
        supervisor.start();

        supervisor.stop();

        verify(workerPool).stop(any(Duration.class));
        verify(lock).release(DueSubscriptionEvaluator.LOCK_NAME);
    }

    @Test
    void scheduledTaskRunsEvaluatorAndContainsFailures() {
        when(evaluator.checkDueSubscriptions()).thenThrow(new IllegalStateException("mongo down"));
        ProcessSupervisor supervisor = supervisor(true, true);
        supervisor.start();

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(backend).scheduleJob(anyString(), anyString(), task.capture(), any(), any(), anyBoolean());

        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
        verify(evaluator).checkDueSubscriptions();
    }

    @Test
    void leaseRecoveryRunsAgainstQueue() {
        when(queue.recoverExpiredLeases()).thenReturn(2).thenThrow(new IllegalStateException("timeout"));
        ProcessSupervisor supervisor = supervisor(true, true);
        supervisor.start();

        ArgumentCaptor<Runnable> recovery = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleWithFixedDelay(recovery.capture(), any(Duration.class));
        recovery.getValue().run();
        assertThatCode(() -> recovery.getValue().run()).doesNotThrowAnyException();

        verify(queue, times(2)).recoverExpiredLeases();
    }

    @Test
    void stopWithoutStartIsNoop() {
        supervisor(true, true).stop();

        verifyNoInteractions(backend, workerPool, lock);
    }

    private ProcessSupervisor supervisor(boolean schedulerEnabled, boolean workerEnabled) {
        return new ProcessSupervisor(registry, evaluator, workerPool, executionWorker, leaseHeartbeat, queue, lock,
                taskScheduler, schedulerEnabled, workerEnabled, 60, 5);
    }
}
