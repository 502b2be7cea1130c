/**
 * Protocol-centric core for batch payload writers.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Batch protocol constants and the writer state model</li>
 *   <li>The single exception type and its reason codes</li>
 *   <li>Small HTTP helpers (method validation, status reason phrases)</li>
 * </ul>
 *
 * <p>Writers, sinks and encodings live in other modules.
 */
package io.github.clickin.batch.core;
