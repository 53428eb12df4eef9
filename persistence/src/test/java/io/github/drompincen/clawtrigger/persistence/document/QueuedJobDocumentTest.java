package io.github.drompincen.clawtrigger.persistence.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueuedJobDocumentTest {

    @Test
    void newJobIsReadyExecutionJob() {
        QueuedJobDocument doc = new QueuedJobDocument();

        assertThat(doc.getState()).isEqualTo(QueuedJobDocument.State.READY);
        assertThat(doc.getKind()).isEqualTo(QueuedJobDocument.Kind.EXECUTION);
        assertThat(doc.getMaxDeliveries()).isEqualTo(5);
    }
}
