package io.txxt.structure.config;

import java.util.Optional;

/**
 * Source of environment variable values, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
