package io.github.drompincen.clawtrigger.runtime.queue;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.persistence.repository.QueuedJobRepository;
import io.github.drompincen.clawtrigger.protocol.api.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument.State;

@Component
public class MongoExecutionQueue implements ExecutionQueue {

    private static final Logger log = LoggerFactory.getLogger(MongoExecutionQueue.class);

    private final MongoTemplate mongoTemplate;
    private final QueuedJobRepository queuedJobRepository;
    private final Duration lease;
    private final int maxDeliveries;

    public MongoExecutionQueue(MongoTemplate mongoTemplate,
                               QueuedJobRepository queuedJobRepository,
                               @Value("${clawtrigger.queue.lease-seconds:90}") long leaseSeconds,
                               @Value("${clawtrigger.queue.max-deliveries:5}") int maxDeliveries) {
        this.mongoTemplate = mongoTemplate;
        this.queuedJobRepository = queuedJobRepository;
        this.lease = Duration.ofSeconds(leaseSeconds);
        this.maxDeliveries = maxDeliveries;
    }

    @Override
    public void enqueue(String jobId, QueuedJobDocument.Kind kind, String payload, Duration delay) {
        Instant now = Instant.now();
        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setJobId(jobId);
        doc.setKind(kind);
        doc.setPayload(payload);
        doc.setState(State.READY);
        doc.setDeliveries(0);
        doc.setMaxDeliveries(maxDeliveries);
        doc.setAvailableAt(delay == null ? now : now.plus(delay));
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        mongoTemplate.insert(doc);
        log.debug("Enqueued {} job {} (payload={}, available at {})", kind, jobId, payload, doc.getAvailableAt());
    }

    @Override
    public Optional<QueuedJob> poll(String consumerId) {
        Instant now = Instant.now();
        Query ready = new Query()
                .addCriteria(Criteria.where("state").is(State.READY))
                .addCriteria(Criteria.where("availableAt").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "availableAt"));
        Update claim = new Update()
                .set("state", State.CLAIMED)
                .set("consumer", consumerId)
                .set("leaseUntil", now.plus(lease))
                .set("updatedAt", now)
                .inc("deliveries", 1);
        QueuedJobDocument claimed = mongoTemplate.findAndModify(ready, claim,
                FindAndModifyOptions.options().returnNew(true), QueuedJobDocument.class);
        if (claimed == null) {
            return Optional.empty();
        }
        log.debug("Consumer {} claimed job {} (delivery {})", consumerId, claimed.getJobId(), claimed.getDeliveries());
        return Optional.of(QueuedJob.from(claimed));
    }

    @Override
    public boolean hasOutstanding(String payload) {
        Query outstanding = new Query()
                .addCriteria(Criteria.where("payload").is(payload))
                .addCriteria(Criteria.where("state").in(State.READY, State.CLAIMED));
        return mongoTemplate.exists(outstanding, QueuedJobDocument.class);
    }

    @Override
    public void ack(QueuedJob job) {
        mongoTemplate.remove(claimedBy(job), QueuedJobDocument.class);
        log.debug("Acked job {}", job.jobId());
    }

    @Override
    public void reject(QueuedJob job, boolean requeue, Duration delay, String error) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("consumer", null)
                .set("leaseUntil", null)
                .set("lastError", error)
                .set("updatedAt", now);
        if (requeue && job.deliveries() < job.maxDeliveries()) {
            update.set("state", State.READY).set("availableAt", now.plus(delay));
            log.info("Requeued job {} after delivery {} ({})", job.jobId(), job.deliveries(), error);
        } else {
            update.set("state", State.DEAD);
            log.warn("Moved job {} to dead letters after {} deliveries: {}", job.jobId(), job.deliveries(), error);
        }
        mongoTemplate.updateFirst(claimedBy(job), update, QueuedJobDocument.class);
    }

    @Override
    public boolean extendLease(QueuedJob job, Duration extension) {
        Update update = new Update().set("leaseUntil", Instant.now().plus(extension));
        return mongoTemplate.updateFirst(claimedBy(job), update, QueuedJobDocument.class).getModifiedCount() > 0;
    }

    @Override
    public int recoverExpiredLeases() {
        Instant now = Instant.now();
        Query expired = new Query()
                .addCriteria(Criteria.where("state").is(State.CLAIMED))
                .addCriteria(Criteria.where("leaseUntil").lt(now));
        List<QueuedJobDocument> stale = mongoTemplate.find(expired, QueuedJobDocument.class);

        int recovered = 0;
        for (QueuedJobDocument item : stale) {
            State next = item.getDeliveries() >= item.getMaxDeliveries() ? State.DEAD : State.READY;
            Query guard = new Query()
                    .addCriteria(Criteria.where("jobId").is(item.getJobId()))
                    .addCriteria(Criteria.where("state").is(State.CLAIMED))
                    .addCriteria(Criteria.where("leaseUntil").lt(now));
            Update update = new Update()
                    .set("state", next)
                    .set("consumer", null)
                    .set("leaseUntil", null)
                    .set("availableAt", now)
                    .set("lastError", "Lease of consumer " + item.getConsumer() + " expired")
                    .set("updatedAt", now);
            if (mongoTemplate.updateFirst(guard, update, QueuedJobDocument.class).getModifiedCount() > 0) {
                recovered++;
                log.info("Recovered job {} from expired lease of {} (now {})", item.getJobId(), item.getConsumer(), next);
            }
        }
        return recovered;
    }

    @Override
    public QueueStats stats() {
        return new QueueStats(
                queuedJobRepository.countByState(State.READY),
                queuedJobRepository.countByState(State.CLAIMED),
                queuedJobRepository.countByState(State.DEAD));
    }

    @Override
    public List<QueuedJob> listDeadLetters() {
        return queuedJobRepository.findByStateOrderByUpdatedAtDesc(State.DEAD).stream()
                .map(QueuedJob::from)
                .toList();
    }

    @Override
    public boolean requeueDeadLetter(String jobId) {
        Instant now = Instant.now();
        Query dead = new Query()
                .addCriteria(Criteria.where("jobId").is(jobId))
                .addCriteria(Criteria.where("state").is(State.DEAD));
        Update update = new Update()
                .set("state", State.READY)
                .set("deliveries", 0)
                .set("availableAt", now)
                .set("updatedAt", now);
        boolean requeued = mongoTemplate.updateFirst(dead, update, QueuedJobDocument.class).getModifiedCount() > 0;
        if (requeued) {
            log.info("Requeued dead letter {}", jobId);
        }
        return requeued;
    }

    @Override
    public long purgeDeadLetters() {
        long purged = queuedJobRepository.deleteByState(State.DEAD);
        log.info("Purged {} dead letters", purged);
        return purged;
    }

    private Query claimedBy(QueuedJob job) {
        return new Query()
                .addCriteria(Criteria.where("jobId").is(job.jobId()))
                .addCriteria(Criteria.where("consumer").is(job.consumer()));
    }
}
