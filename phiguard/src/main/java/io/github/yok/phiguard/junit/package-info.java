/**
 * JUnit 5 integration.
 *
 * <p>
 * {@code @CleanupTestData} registers {@code TestDataCleanupExtension}, which purges fixtures after
 * each test through a connection registered in {@code ConnectionRegistry}.
 * </p>
 */
package io.github.yok.phiguard.junit;
