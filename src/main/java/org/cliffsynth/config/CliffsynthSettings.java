package org.cliffsynth.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code cliffsynth} configuration block.
 *
 * @param randomQubits Default qubit count for random circuits.
 * @param randomDepth Default gate count for random circuits.
 * @param randomSeed Default seed for random circuits.
 * @param verifyRoundTrip Whether the CLI converts synthesized circuits back and compares.
 */
public record CliffsynthSettings(int randomQubits, int randomDepth, long randomSeed, boolean verifyRoundTrip) {

    public CliffsynthSettings {
        if (randomQubits < 0 || randomDepth < 0) {
            throw new IllegalArgumentException("Random circuit size must be non-negative");
        }
    }

    /**
     * @param config A resolved configuration containing the {@code cliffsynth} block.
     * @return The settings.
     */
    public static CliffsynthSettings fromConfig(Config config) {
        Config root = config.getConfig("cliffsynth");
        return new CliffsynthSettings(
                root.getInt("random.qubits"),
                root.getInt("random.depth"),
                root.getLong("random.seed"),
                root.getBoolean("synthesis.verify-round-trip"));
    }
}
