package com.williamcallahan.bibliography_engine.service.event;

import com.williamcallahan.bibliography_engine.types.SyncOutcome;
import com.williamcallahan.bibliography_engine.types.SyncProgress;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Relays sync application events to reactive subscribers (SSE clients).
 * Subscribers only see events published after they subscribe.
 */
@Service
public class SyncEventStream {

    public static final String PROGRESS = "progress";
    public static final String COMPLETE = "complete";

    /**
     * One relayed event: a progress update or the terminal outcome
     */
    public record SyncStreamEvent(String type, SyncProgress progress, SyncOutcome outcome) {
    }

    private final Sinks.Many<SyncStreamEvent> sink = Sinks.many().multicast().directBestEffort();

    @EventListener
    public void onProgress(SyncProgressEvent event) {
        sink.tryEmitNext(new SyncStreamEvent(PROGRESS, event.toProgress(), null));
    }

    @EventListener
    public void onCompleted(SyncCompletedEvent event) {
        sink.tryEmitNext(new SyncStreamEvent(COMPLETE, null, event.getOutcome()));
    }

    public Flux<SyncStreamEvent> events() {
        return sink.asFlux();
    }
}
