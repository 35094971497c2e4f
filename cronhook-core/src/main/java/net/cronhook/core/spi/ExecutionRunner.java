package net.cronhook.core.spi;

import net.cronhook.core.model.ExecutionOutcome;

/**
 * Performs one outbound call for a firing. Implementations never throw: every failure is
 * returned as an {@code error} outcome.
 */
@FunctionalInterface
public interface ExecutionRunner {
    ExecutionOutcome execute(String url, String body, String secret);
}
