package it.unimib.datai.clout.controlplane.trigger;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffCalculatorTest {

    @Test
    void withoutJitter_delayDoublesUntilCapped() {
        BackoffCalculator calculator = new BackoffCalculator(100, 1000, 0.0);

        assertEquals(Duration.ofMillis(100), calculator.calculate(1));
        assertEquals(Duration.ofMillis(200), calculator.calculate(2));
        assertEquals(Duration.ofMillis(400), calculator.calculate(3));
        assertEquals(Duration.ofMillis(800), calculator.calculate(4));
        assertEquals(Duration.ofMillis(1000), calculator.calculate(5));
        assertEquals(Duration.ofMillis(1000), calculator.calculate(500));
    }

    @Test
    void jitter_staysWithinBounds() {
        BackoffCalculator calculator = new BackoffCalculator(Duration.ofMillis(100), Duration.ofSeconds(10), 0.5);

        for (int i = 0; i < 200; i++) {
            long delay = calculator.calculate(2).toMillis();
            assertTrue(delay >= 200 && delay <= 300, "delay out of range: " + delay);
        }
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 10, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(100, 10, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(10, 100, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(10, 100, 0.1).calculate(0));
    }
}
