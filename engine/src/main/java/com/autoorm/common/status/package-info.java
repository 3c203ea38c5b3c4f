/**
 * Status reporting for the storage layer.
 *
 * <p>Backends never throw for expected outcomes. They return a {@link
 * com.autoorm.common.status.StatusOr} holding either the result or a {@link
 * com.autoorm.common.status.Status} whose {@link com.autoorm.common.status.StatusCode} tells the
 * engine what went wrong:
 *
 * <pre>
 * StatusOr&lt;Long&gt; idOr = backend.insert("blog", "users", null, values);
 * if (idOr.isNotOk()) {
 *     // ALREADY_EXISTS, INTERNAL, ...
 *     return idOr.getStatus();
 * }
 * long id = idOr.getValue();
 * </pre>
 *
 * <p>The engine turns non-OK statuses into the exceptions in {@code com.autoorm.exceptions}.
 */
package com.autoorm.common.status;
