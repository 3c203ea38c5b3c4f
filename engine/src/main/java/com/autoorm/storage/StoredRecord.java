package com.autoorm.storage;

import java.util.Map;

/**
 * One stored record as a backend hands it out: its identifier and a copy of its raw field values.
 * The values map does not contain the identifier.
 *
 * @param id the record identifier
 * @param values raw field values keyed by field name; may contain null values
 */
public record StoredRecord(long id, Map<String, Object> values) {}
