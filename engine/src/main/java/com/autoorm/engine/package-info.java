/**
 * The data engine: schema-checked create, read, update, delete and query over a pluggable storage
 * backend.
 *
 * <p>{@link com.autoorm.engine.DataEngine} is the entry point. Records come back as {@link
 * com.autoorm.engine.DataRecord}s; queries take a {@link com.autoorm.engine.Filter} or a {@link
 * com.autoorm.engine.Query} and return a lazy {@link com.autoorm.engine.RecordSequence}.
 */
package com.autoorm.engine;
