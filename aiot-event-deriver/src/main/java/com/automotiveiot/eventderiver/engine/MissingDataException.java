package com.automotiveiot.eventderiver.engine;

import java.util.List;

public class MissingDataException extends IngestException {

    public MissingDataException(List<String> missingFields) {
        super("Missing required sensor fields: " + String.join(", ", missingFields), missingFields);
    }

    @Override
    public String getErrorCode() {
        return "missing_data";
    }
}
