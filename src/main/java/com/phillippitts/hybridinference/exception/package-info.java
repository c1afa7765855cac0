/**
 * Typed failures of the routing core.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.hybridinference.exception.HybridInferenceException} - Base exception</li>
 *   <li>{@link com.phillippitts.hybridinference.exception.BudgetExceededException} - Policy cost cap
 *       would be crossed; raised before any network call</li>
 *   <li>{@link com.phillippitts.hybridinference.exception.NoProviderAvailableException} - All cloud
 *       backends exhausted or circuit-open</li>
 *   <li>{@link com.phillippitts.hybridinference.exception.LatencyTimeoutException} - On-device call
 *       lost the latency race (drives fallback)</li>
 *   <li>{@link com.phillippitts.hybridinference.exception.LocalInferenceException} - On-device
 *       capability failed</li>
 *   <li>{@link com.phillippitts.hybridinference.exception.CloudProviderException} - A single cloud
 *       backend failed; {@code ProviderNotFoundException} for unknown ids</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 */
package com.phillippitts.hybridinference.exception;
