/**
 * Database access package for PhiGuard.
 *
 * <p>
 * {@code ConnectionManager} owns the single connection of a test context and
 * {@code QueryExecutor} runs parameterized statements and units of work on it. Backend
 * differences (URL format, session settings, clock expressions, value conversion) are isolated
 * behind {@code DbDialectHandler}, one implementation per {@code BackendKind}.
 * </p>
 */
package io.github.yok.phiguard.db;
