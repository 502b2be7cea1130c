/**
 * Batch writer engine.
 *
 * <p>Holds the machinery every encoding shares: the state machine that validates writer calls,
 * boundary allocation, Content-ID bookkeeping, operation message creation and a reference
 * {@link io.github.clickin.batch.spi.BatchOutputSink} over an {@link java.io.OutputStream}.
 * The multipart/mixed encoding lives in {@code io.github.clickin.batch.engine.multipart}.
 */
package io.github.clickin.batch.engine;
