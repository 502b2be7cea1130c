/**
 * JSON batch encoding on Jackson.
 *
 * <p>{@link io.github.clickin.batch.json.jackson.JsonBatchWriter} writes the same operation
 * sequence as the multipart/mixed writer as one JSON document, with changesets expressed as
 * atomicity groups.
 */
package io.github.clickin.batch.json.jackson;
