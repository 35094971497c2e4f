package net.cronhook.core.registry;

import java.time.Instant;

@FunctionalInterface
public interface FireCallback {
    void onFire(String jobId, Instant fireTime);
}
