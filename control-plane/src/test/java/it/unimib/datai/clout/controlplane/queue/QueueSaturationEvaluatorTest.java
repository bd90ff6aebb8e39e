package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.model.QueueStats;
import it.unimib.datai.clout.controlplane.config.QueueStorageProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueSaturationEvaluatorTest {

    @Test
    void emptyStats_areHealthy() {
        QueueSaturationReport report = QueueSaturationEvaluator.evaluate(List.of(), 1000);

        assertEquals(QueueSaturation.HEALTHY, report.status());
        assertTrue(report.queues().isEmpty());
    }

    @Test
    void thresholds_classifyEachQueue() {
        QueueSaturationReport report = QueueSaturationEvaluator.evaluate(List.of(
                new QueueStats("low", 1, 100),
                new QueueStats("warm", 8, 800),
                new QueueStats("hot", 10, 960)), 1000);

        assertEquals(QueueSaturation.CRITICAL, report.status());
        assertEquals(QueueSaturation.HEALTHY, report.queues().get(0).status());
        assertEquals(QueueSaturation.DEGRADED, report.queues().get(1).status());
        assertEquals(QueueSaturation.CRITICAL, report.queues().get(2).status());
        assertEquals(96.0, report.queues().get(2).saturationPercent());
    }

    @Test
    void overallStatus_isWorstQueue() {
        QueueSaturationReport report = QueueSaturationEvaluator.evaluate(List.of(
                new QueueStats("a", 1, 10),
                new QueueStats("b", 5, 850)), 1000);

        assertEquals(QueueSaturation.DEGRADED, report.status());
        assertEquals(1000, report.budgetBytes());
    }

    @Test
    void evaluate_readsFromStatsSource() {
        QueueStatsSource source = () -> List.of(new QueueStats("q", 2, 50));
        QueueStorageProperties properties = new QueueStorageProperties("unused", null, null, null, null, null, 100L);

        QueueSaturationReport report = new QueueSaturationEvaluator(source, properties).evaluate();

        assertEquals(QueueSaturation.HEALTHY, report.status());
        assertEquals(50.0, report.queues().get(0).saturationPercent());
    }
}
