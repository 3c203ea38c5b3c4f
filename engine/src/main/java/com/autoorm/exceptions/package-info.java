/**
 * Exceptions thrown by the data engine.
 *
 * <p>All of them extend {@link com.autoorm.exceptions.DataEngineException} and are unchecked.
 * Input problems extend {@link com.autoorm.exceptions.ValidationException} and are raised before
 * the storage backend is touched, so a rejected write never leaves a partial change behind.
 */
package com.autoorm.exceptions;
