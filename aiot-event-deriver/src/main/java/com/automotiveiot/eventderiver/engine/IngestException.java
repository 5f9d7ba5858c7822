package com.automotiveiot.eventderiver.engine;

import java.util.List;

/**
 * A raw reading was rejected before any state changed. Subtypes tell the gateway why.
 */
public abstract class IngestException extends RuntimeException {

    private final List<String> fields;

    protected IngestException(String message, List<String> fields) {
        super(message);
        this.fields = List.copyOf(fields);
    }

    /**
     * @return the wire names of the offending fields
     */
    public List<String> getFields() {
        return fields;
    }

    /**
     * @return the error code published with the rejection
     */
    public abstract String getErrorCode();
}
