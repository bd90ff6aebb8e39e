package it.unimib.datai.clout.controlplane.queue;

public enum QueueSaturation {
    HEALTHY,
    DEGRADED,
    CRITICAL;

    static final double DEGRADED_THRESHOLD = 0.80;
    static final double CRITICAL_THRESHOLD = 0.95;

    public static QueueSaturation of(double ratio) {
        if (ratio >= CRITICAL_THRESHOLD) {
            return CRITICAL;
        }
        if (ratio >= DEGRADED_THRESHOLD) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
