/**
 * Collaborator contracts for batch writers.
 *
 * <p>The SPI keeps writers independent of the transport and of URI conventions: a writer only
 * sees a {@link io.github.clickin.batch.spi.BatchOutputSink} and an optional
 * {@link io.github.clickin.batch.spi.PayloadUriConverter}. Operation messages handed to callers
 * are defined here as well so that every encoding returns the same types.
 */
package io.github.clickin.batch.spi;
