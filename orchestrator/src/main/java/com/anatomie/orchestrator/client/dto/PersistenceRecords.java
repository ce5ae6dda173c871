package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Wire shapes of the persistence backend's record API
 * ({"records": [{"fields": {...}}]} in, {"records": [{"id", "fields"}]} out).
 * Listing a table returns the same {"records": [...]} envelope.
 */
public final class PersistenceRecords {

    private PersistenceRecords() {}

    public record Fields(Map<String, Object> fields) {}

    public record CreateRequest(List<Fields> records) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecordList(List<StoredRecord> records) {
        public RecordList {
            if (records == null) records = List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoredRecord(String id, Map<String, Object> fields) {
        public StoredRecord {
            if (fields == null) fields = Map.of();
        }
    }
}
