package com.williamcallahan.bibliography_engine.service.lookup;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves source names (as stored on paper-source links) to their lookup clients.
 * New sources join by declaring another {@link BibliographicLookupClient} bean.
 */
@Component
public class LookupClientRegistry {

    private final Map<String, BibliographicLookupClient> clients = new LinkedHashMap<>();

    public LookupClientRegistry(List<BibliographicLookupClient> clients) {
        for (BibliographicLookupClient client : clients) {
            this.clients.put(client.sourceName().toLowerCase(Locale.ROOT), client);
        }
    }

    public Optional<BibliographicLookupClient> find(String sourceName) {
        if (sourceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(sourceName.toLowerCase(Locale.ROOT)));
    }
}
