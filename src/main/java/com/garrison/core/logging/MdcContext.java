package com.garrison.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Garrison-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSpawnPoint(String strongpoint, String spawnPoint) {
        MDC.put("strongpoint", strongpoint);
        MDC.put("spawnPoint", spawnPoint);
    }

    public static void setWave(int waveNumber) {
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void clear() {
        MDC.remove("strongpoint");
        MDC.remove("spawnPoint");
        MDC.remove("waveNumber");
    }
}
