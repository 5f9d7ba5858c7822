package com.automotiveiot.jdbcsink;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Durable storage for derived records. Both methods return the generated record id and throw
 * {@link StorageException} when the write fails.
 */
public interface DrivingRecordStore {

    long persistSnapshot(JsonNode snapshot);

    long persistEvent(String kind, JsonNode event);
}
