package com.automotiveiot.eventderiver.engine;

import java.util.List;

/**
 * A present field holds a physically impossible value, or the payload could not be read.
 */
public class InvalidReadingException extends IngestException {

    public InvalidReadingException(String field, String message) {
        this(field == null ? List.of() : List.of(field), message);
    }

    public InvalidReadingException(List<String> fields, String message) {
        super(message, fields);
    }

    @Override
    public String getErrorCode() {
        return "invalid_reading";
    }
}
