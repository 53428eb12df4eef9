package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;

public interface QueuedJobHandler {

    QueuedJobDocument.Kind kind();

    void handle(QueuedJob job) throws Exception;
}
