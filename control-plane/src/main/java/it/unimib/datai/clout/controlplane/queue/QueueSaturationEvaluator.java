package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.model.QueueStats;
import it.unimib.datai.clout.controlplane.config.QueueStorageProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies queue occupancy against a byte budget. Works on stats snapshots only.
 */
@Component
public class QueueSaturationEvaluator {
    private final QueueStatsSource statsSource;
    private final long budgetBytes;

    public QueueSaturationEvaluator(QueueStatsSource statsSource, QueueStorageProperties properties) {
        this.statsSource = statsSource;
        this.budgetBytes = properties.saturationBudgetBytes();
    }

    public QueueSaturationReport evaluate() {
        return evaluate(statsSource.stats(), budgetBytes);
    }

    static QueueSaturationReport evaluate(List<QueueStats> stats, long budgetBytes) {
        QueueSaturation worst = QueueSaturation.HEALTHY;
        List<QueueSaturationReport.Entry> entries = new ArrayList<>(stats.size());
        for (QueueStats queue : stats) {
            double ratio = budgetBytes <= 0 ? 0 : (double) queue.totalBytes() / budgetBytes;
            QueueSaturation status = QueueSaturation.of(ratio);
            if (status.compareTo(worst) > 0) {
                worst = status;
            }
            entries.add(new QueueSaturationReport.Entry(queue.name(), queue.messageCount(), queue.totalBytes(),
                    Math.round(ratio * 10_000) / 100.0, status));
        }
        return new QueueSaturationReport(worst, budgetBytes, List.copyOf(entries));
    }
}
