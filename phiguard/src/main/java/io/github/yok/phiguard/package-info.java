/**
 * Root package of PhiGuard.
 *
 * <p>
 * PhiGuard verifies what a healthcare application under test leaves in its database: patient data
 * integrity, HIPAA audit entries and the removal of synthetic fixtures. It also encrypts and masks
 * PHI-like fixture values.
 * </p>
 *
 * <p>
 * {@link io.github.yok.phiguard.Main} exposes the checks as a command-line tool; test suites use
 * the {@code core} classes directly or through the {@code junit} extension.
 * </p>
 */
package io.github.yok.phiguard;
