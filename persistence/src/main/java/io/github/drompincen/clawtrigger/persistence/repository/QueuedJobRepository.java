package io.github.drompincen.clawtrigger.persistence.repository;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface QueuedJobRepository extends MongoRepository<QueuedJobDocument, String> {
    long countByState(QueuedJobDocument.State state);
    List<QueuedJobDocument> findByStateOrderByUpdatedAtDesc(QueuedJobDocument.State state);
    long deleteByState(QueuedJobDocument.State state);
}
