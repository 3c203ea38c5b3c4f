/**
 * Model schemas and where they come from.
 *
 * <p>Raw {@link com.autoorm.schema.ModelDefinition}s are validated into immutable {@link
 * com.autoorm.schema.ModelSchema}s held by the {@link com.autoorm.schema.ModelRegistry}.
 * Definitions can be written by hand or derived from annotated Java records with {@link
 * com.autoorm.schema.ModelClasses}.
 */
package com.autoorm.schema;
