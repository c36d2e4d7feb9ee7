/**
 * Common utilities for masking, identifier checks, table ordering and CLI error reporting.
 */
package io.github.yok.phiguard.util;
