/**
 * Verification and cleanup logic.
 *
 * <p>
 * Contains {@code IntegrityValidator}, {@code AuditTrailVerifier} and {@code TestDataCleaner},
 * together with the value types they return.
 * </p>
 */
package io.github.yok.phiguard.core;
