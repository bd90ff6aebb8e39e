package it.unimib.datai.clout.controlplane.queue;

import java.util.List;

public record QueueSaturationReport(
        QueueSaturation status,
        long budgetBytes,
        List<Entry> queues
) {
    public record Entry(
            String name,
            int messageCount,
            long totalBytes,
            double saturationPercent,
            QueueSaturation status
    ) {
    }
}
