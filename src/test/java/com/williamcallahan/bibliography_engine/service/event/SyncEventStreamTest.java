package com.williamcallahan.bibliography_engine.service.event;

import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class SyncEventStreamTest {

    @Test
    void relaysEventsPublishedAfterSubscription() {
        SyncEventStream stream = new SyncEventStream();
        stream.onProgress(new SyncProgressEvent(1, 5, "dropped before anyone listens"));

        StepVerifier.create(stream.events().take(2))
            .then(() -> {
                stream.onProgress(new SyncProgressEvent(2, 5, "Batch 1/1"));
                stream.onCompleted(new SyncCompletedEvent(SyncOutcome.builder().total(5).cancelled(true).build()));
            })
            .assertNext(event -> {
                assertEquals(SyncEventStream.PROGRESS, event.type());
                assertEquals(2, event.progress().current());
                assertNull(event.outcome());
            })
            .assertNext(event -> {
                assertEquals(SyncEventStream.COMPLETE, event.type());
                assertTrue(event.outcome().isCancelled());
            })
            .verifyComplete();
    }
}
