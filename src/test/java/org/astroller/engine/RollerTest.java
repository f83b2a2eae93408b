package org.astroller.engine;

import org.astroller.dsl.RollExpression;
import org.astroller.dsl.RollParser;
import org.astroller.dsl.RollSyntaxException;
import org.astroller.engine.execution.RandomSource;
import org.astroller.engine.result.ListExpansionResult;
import org.astroller.engine.result.ResultNode;
import org.astroller.engine.result.ScalarResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RollerTest {

    @Test
    void sameSeedGivesSameTrace() {
        String first = new Roller(RandomSource.seeded(42)).roll("2 2d20 kh1 + 8").render();
        String second = new Roller(RandomSource.seeded(42)).roll("2 2d20 kh1 + 8").render();
        assertEquals(first, second);
    }

    @Test
    void defaultRollerRollsWithinRange() {
        ScalarResult result = (ScalarResult) new Roller().roll("3d6 + 2");
        assertTrue(result.value() >= 5 && result.value() <= 20, "Out of range: " + result.value());
    }

    @Test
    void parsedExpressionCanBeRolledAgain() {
        Roller roller = new Roller(RandomSource.seeded(3));
        RollExpression expression = RollParser.parse("4 1d100");
        ResultNode first = roller.roll(expression);
        ResultNode second = roller.roll(expression);
        assertNotSame(first, second);
        assertSame(first.expression(), second.expression());
    }

    @Test
    void failuresPropagateToCaller() {
        assertThrows(RollSyntaxException.class, () -> new Roller().roll("2d"));
    }

    @Test
    void expressionTreeIsSharedAcrossThreads() throws Exception {
        RollExpression expression = RollParser.parse("10 2d6 kh1");
        Roller roller = new Roller(RandomSource.threadLocal());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<ResultNode>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> roller.roll(expression)));
            }
            for (Future<ResultNode> future : futures) {
                ListExpansionResult result = (ListExpansionResult) future.get();
                assertEquals(10, result.repetitions().size());
                for (long value : result.scalarValues()) {
                    assertTrue(value >= 1 && value <= 6, "Out of range: " + value);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
