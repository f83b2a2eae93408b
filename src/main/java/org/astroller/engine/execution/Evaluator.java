package org.astroller.engine.execution;

import org.astroller.dsl.BinaryOp;
import org.astroller.dsl.Constant;
import org.astroller.dsl.DiceTerm;
import org.astroller.dsl.ListExpansion;
import org.astroller.dsl.Modifier;
import org.astroller.dsl.RollEvaluationException;
import org.astroller.dsl.RollExpression;
import org.astroller.dsl.RollExpressionVisitor;
import org.astroller.dsl.ScalarExpression;
import org.astroller.dsl.Sequence;
import org.astroller.engine.result.BinaryOpResult;
import org.astroller.engine.result.ConstantResult;
import org.astroller.engine.result.DiceTermResult;
import org.astroller.engine.result.ListExpansionResult;
import org.astroller.engine.result.ModifierResult;
import org.astroller.engine.result.ResultNode;
import org.astroller.engine.result.Roll;
import org.astroller.engine.result.ScalarResult;
import org.astroller.engine.result.SequenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an expression tree into a result tree of the same shape.
 *
 * Every dice term draws fresh rolls from the {@link RandomSource}; nothing is
 * cached between nodes or between calls. Operands are evaluated left before
 * right so traces are reproducible with a scripted source.
 *
 * Arithmetic is exact 64-bit integer arithmetic. Division truncates toward
 * zero; dividing by zero or overflowing raises
 * {@link RollEvaluationException}.
 */
public class Evaluator implements RollExpressionVisitor<ResultNode> {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final RandomSource random;

    public Evaluator(RandomSource random) {
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
    }

    /**
     * Evaluates an expression.
     *
     * @param expression The expression to evaluate
     * @return A fresh result tree
     * @throws RollEvaluationException if evaluation fails; no partial result is returned
     */
    public ResultNode evaluate(RollExpression expression) {
        return expression.accept(this);
    }

    /**
     * Evaluates an expression known to produce a single value.
     */
    public ScalarResult evaluate(ScalarExpression expression) {
        // Every scalar variant is visited by a method returning a ScalarResult
        return (ScalarResult) expression.accept(this);
    }

    // ========================================
    // SCALARS
    // ========================================

    @Override
    public ConstantResult visitConstant(Constant constant) {
        return new ConstantResult(constant);
    }

    @Override
    public DiceTermResult visitDiceTerm(DiceTerm diceTerm) {
        int lower = diceTerm.lowerBound();
        int upper = diceTerm.upperBound();
        List<Roll> rolls = new ArrayList<>(diceTerm.count());
        for (int i = 0; i < diceTerm.count(); i++) {
            int value = random.nextInt(lower, upper);
            if (value < lower || value > upper) {
                throw new IllegalStateException(
                        "Random source returned " + value + " outside [" + lower + ", " + upper + "]");
            }
            rolls.add(new Roll(value, diceTerm.sides()));
        }
        log.debug("Rolled {} -> {}", diceTerm.toNotation(), rolls);
        return new DiceTermResult(diceTerm, rolls);
    }

    /**
     * Orders a copy of the rolls by value (descending when the modifier picks
     * the highest), ties staying in roll order, then keeps the first
     * {@code count} positions, or everything after them for drop modifiers.
     */
    @Override
    public ModifierResult visitModifier(Modifier modifier) {
        DiceTermResult dice = visitDiceTerm(modifier.dice());
        List<Roll> rolls = dice.rolls();

        List<Integer> order = new ArrayList<>(rolls.size());
        for (int i = 0; i < rolls.size(); i++) {
            order.add(i);
        }
        Comparator<Integer> byValue = Comparator.comparingInt(index -> rolls.get(index).value());
        // List.sort is stable, so equal rolls keep their original order
        order.sort(modifier.kind().highest() ? byValue.reversed() : byValue);

        List<Integer> kept = modifier.kind().keep()
                ? order.subList(0, modifier.count())
                : order.subList(modifier.count(), order.size());
        return new ModifierResult(modifier, dice, kept);
    }

    @Override
    public BinaryOpResult visitBinaryOp(BinaryOp binaryOp) {
        ScalarResult left = evaluate(binaryOp.left());
        ScalarResult right = evaluate(binaryOp.right());
        long value = apply(binaryOp, left.value(), right.value());
        return new BinaryOpResult(binaryOp, left, right, value);
    }

    private static long apply(BinaryOp binaryOp, long left, long right) {
        try {
            return switch (binaryOp.operator()) {
                case ADD -> Math.addExact(left, right);
                case SUB -> Math.subtractExact(left, right);
                case MUL -> Math.multiplyExact(left, right);
                case DIV -> divide(binaryOp, left, right);
            };
        } catch (ArithmeticException e) {
            throw new RollEvaluationException(
                    "Integer overflow evaluating " + left + " " + binaryOp.operator().symbol() + " " + right, e);
        }
    }

    private static long divide(BinaryOp binaryOp, long left, long right) {
        if (right == 0) {
            throw new RollEvaluationException(
                    "Division by zero: " + binaryOp.right().toNotation() + " evaluated to 0 in "
                            + binaryOp.toNotation());
        }
        if (left == Long.MIN_VALUE && right == -1) {
            throw new ArithmeticException("long overflow");
        }
        return left / right;
    }

    // ========================================
    // LISTS
    // ========================================

    @Override
    public ListExpansionResult visitListExpansion(ListExpansion listExpansion) {
        List<ResultNode> repetitions = new ArrayList<>(listExpansion.count());
        for (int i = 0; i < listExpansion.count(); i++) {
            repetitions.add(evaluate(listExpansion.body()));
        }
        return new ListExpansionResult(listExpansion, repetitions);
    }

    @Override
    public SequenceResult visitSequence(Sequence sequence) {
        List<ResultNode> items = new ArrayList<>(sequence.items().size());
        for (RollExpression item : sequence.items()) {
            items.add(evaluate(item));
        }
        return new SequenceResult(sequence, items);
    }
}
