package org.astroller.engine;

import org.astroller.dsl.RollExpression;
import org.astroller.dsl.RollParser;
import org.astroller.engine.execution.Evaluator;
import org.astroller.engine.execution.RandomSource;
import org.astroller.engine.result.ResultNode;

/**
 * Parses and evaluates roll strings in one call.
 *
 * <pre>
 * Roller roller = new Roller(RandomSource.threadLocal());
 * System.out.println(roller.roll("2 2d20 kh1 + 8").render());
 * </pre>
 */
public class Roller {

    private final Evaluator evaluator;

    public Roller() {
        this(RandomSource.threadLocal());
    }

    public Roller(RandomSource random) {
        this.evaluator = new Evaluator(random);
    }

    /**
     * @param rollString The roll string, e.g. "2d20 kh1 + 8"
     * @return The evaluated result tree
     * @throws org.astroller.dsl.RollException if parsing or evaluation fails
     */
    public ResultNode roll(String rollString) {
        return roll(RollParser.parse(rollString));
    }

    /**
     * Evaluates an already parsed expression; the expression can be rolled repeatedly.
     */
    public ResultNode roll(RollExpression expression) {
        return evaluator.evaluate(expression);
    }
}
