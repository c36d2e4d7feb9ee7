/**
 * Configuration model package for PhiGuard.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources): connection descriptors, audit verification defaults, cleanup marker prefixes and the
 * fixture encryption key.
 * </p>
 *
 * <p>
 * Library callers may construct these objects directly without a Spring context.
 * </p>
 */
package io.github.yok.phiguard.config;
