package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.types.InferredMetadata;
import reactor.core.publisher.Mono;

/**
 * Optional free-form metadata inference (for example a language model) over a paper's text.
 * No implementation ships by default; callers treat errors, timeouts and an empty result as "no data".
 */
public interface MetadataInferenceAssist {

    /**
     * Whether the backing service is reachable right now
     */
    Mono<Boolean> isAvailable();

    Mono<InferredMetadata> inferMetadata(String text);
}
