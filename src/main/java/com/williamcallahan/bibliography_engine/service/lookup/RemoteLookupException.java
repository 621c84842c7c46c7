package com.williamcallahan.bibliography_engine.service.lookup;

/**
 * Thrown (or signalled) when a bibliographic source cannot answer a lookup.
 */
public class RemoteLookupException extends RuntimeException {

    private final String source;

    public RemoteLookupException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public RemoteLookupException(String source, String message) {
        super(message);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
