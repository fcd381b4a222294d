package io.feedrecorder.ingestion.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration pacingDelay,
        boolean runOnStartup
) {
    public static final Duration MIN_PACING_DELAY = Duration.ofSeconds(1);

    /**
     * Pacing delay between two feed requests, never shorter than one second.
     */
    public Duration getEffectivePacingDelay() {
        if (pacingDelay == null || pacingDelay.compareTo(MIN_PACING_DELAY) < 0) {
            return MIN_PACING_DELAY;
        }
        return pacingDelay;
    }
}
