package org.astroller.dsl.antlr;

import org.astroller.dsl.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for turning roll strings into evaluation trees.
 */
class RollAstBuilderTest {

    private static RollExpression parse(String rollString) {
        return org.astroller.dsl.RollParser.parse(rollString);
    }

    // ========================================
    // Constants & Dice
    // ========================================

    @Nested
    @DisplayName("Constants and dice terms")
    class TermTests {
        @Test
        void integerConstant() {
            assertEquals(new Constant(867), parse("867"));
        }

        @Test
        void negativeConstant() {
            assertEquals(new Constant(-530), parse("-530"));
        }

        @Test
        void diceTerm() {
            assertEquals(DiceTerm.of(3, 6), parse("3d6"));
        }

        @Test
        void implicitSingleDie() {
            DiceTerm dice = (DiceTerm) parse("d20");
            assertEquals(1, dice.count());
            assertEquals(20, dice.sides());
            assertEquals("1d20", dice.toNotation());
        }

        @Test
        void upperCaseDiceLetter() {
            assertEquals(DiceTerm.of(2, 8), parse("2D8"));
        }

        @Test
        void fudgeDice() {
            assertEquals(DiceTerm.fudge(4), parse("4df"));
            assertEquals(DiceTerm.fudge(1), parse("dF"));
            assertEquals("4dF", parse("4df").toNotation());
        }

        @Test
        void surroundingWhitespaceIsIgnored() {
            assertEquals(DiceTerm.of(1, 20), parse("  1d20  "));
        }
    }

    // ========================================
    // Modifiers
    // ========================================

    @Nested
    @DisplayName("Keep and drop modifiers")
    class ModifierTests {
        @Test
        void keepHighestWithSpace() {
            assertEquals(new Modifier(Modifier.Kind.KEEP_HIGHEST, 1, DiceTerm.of(2, 20)), parse("2d20 kh1"));
        }

        @Test
        void keepLowestWithoutSpace() {
            assertEquals(new Modifier(Modifier.Kind.KEEP_LOWEST, 2, DiceTerm.of(4, 6)), parse("4d6kl2"));
        }

        @Test
        void dropModifiersAreCaseInsensitive() {
            assertEquals(new Modifier(Modifier.Kind.DROP_LOWEST, 1, DiceTerm.of(4, 6)), parse("4d6 DL1"));
            assertEquals(new Modifier(Modifier.Kind.DROP_HIGHEST, 2, DiceTerm.of(6, 10)), parse("6d10 dh2"));
        }

        @Test
        void modifierOnFudgeDice() {
            assertEquals(new Modifier(Modifier.Kind.KEEP_LOWEST, 2, DiceTerm.fudge(4)), parse("4dF kl2"));
        }

        @Test
        void keepAllDiceIsAllowed() {
            Modifier modifier = (Modifier) parse("3d6 kh3");
            assertEquals(3, modifier.count());
        }

        @Test
        void notationPutsModifierAfterDice() {
            assertEquals("2d20 kh1", parse("2d20KH1").toNotation());
        }
    }

    // ========================================
    // Arithmetic
    // ========================================

    @Nested
    @DisplayName("Arithmetic")
    class ArithmeticTests {
        @Test
        void addition() {
            assertEquals(new BinaryOp(BinaryOp.Operator.ADD, new Constant(3), new Constant(4)), parse("3+4"));
        }

        @Test
        void multiplicationBindsTighterThanAddition() {
            BinaryOp expected = new BinaryOp(BinaryOp.Operator.ADD,
                    new Constant(3),
                    new BinaryOp(BinaryOp.Operator.MUL, new Constant(4), new Constant(2)));
            assertEquals(expected, parse("3 + 4 * 2"));
        }

        @Test
        void parenthesesOverridePrecedence() {
            BinaryOp expected = new BinaryOp(BinaryOp.Operator.MUL,
                    new BinaryOp(BinaryOp.Operator.ADD, new Constant(3), new Constant(4)),
                    new Constant(2));
            assertEquals(expected, parse("(3 + 4) * 2"));
        }

        @Test
        void subtractionIsLeftAssociative() {
            BinaryOp expected = new BinaryOp(BinaryOp.Operator.SUB,
                    new BinaryOp(BinaryOp.Operator.SUB, new Constant(10), new Constant(2)),
                    new Constant(3));
            assertEquals(expected, parse("10 - 2 - 3"));
        }

        @Test
        void division() {
            assertEquals(new BinaryOp(BinaryOp.Operator.DIV, new Constant(8), new Constant(2)), parse("8/2"));
        }

        @Test
        void negativeOperand() {
            assertEquals(new BinaryOp(BinaryOp.Operator.MUL, new Constant(5), new Constant(-2)), parse("5 * -2"));
        }

        @Test
        void numberFollowedByMinusIsSubtraction() {
            assertEquals(new BinaryOp(BinaryOp.Operator.SUB, new Constant(5), new Constant(3)), parse("5 -3"));
        }

        @Test
        void modifiedDiceAsOperand() {
            BinaryOp expected = new BinaryOp(BinaryOp.Operator.ADD,
                    new Modifier(Modifier.Kind.KEEP_HIGHEST, 1, DiceTerm.of(2, 20)),
                    new Constant(8));
            assertEquals(expected, parse("2d20 kh1 + 8"));
        }

        @Test
        void nestedParentheses() {
            BinaryOp expected = new BinaryOp(BinaryOp.Operator.ADD,
                    new Constant(5),
                    new BinaryOp(BinaryOp.Operator.ADD, new Constant(4), new Constant(3)));
            assertEquals(expected, parse("(5+(4+(3)))"));
        }

        @Test
        void notationParenthesizesEveryOperation() {
            assertEquals("((1d6 + 2) * 3)", parse("(1d6+2)*3").toNotation());
        }
    }

    // ========================================
    // Lists & Sequences
    // ========================================

    @Nested
    @DisplayName("List expansion and sequences")
    class ListTests {
        @Test
        void leadingCountRepeatsRemainder() {
            ListExpansion expected = new ListExpansion(2, new BinaryOp(BinaryOp.Operator.ADD,
                    new Modifier(Modifier.Kind.KEEP_HIGHEST, 1, DiceTerm.of(2, 20)),
                    new Constant(8)));
            assertEquals(expected, parse("2 2d20 kh1 + 8"));
        }

        @Test
        void countBeforeParentheses() {
            ListExpansion list = (ListExpansion) parse("3 (1d6 + 1)");
            assertEquals(3, list.count());
            assertInstanceOf(BinaryOp.class, list.body());
        }

        @Test
        void countBeforeImplicitDie() {
            assertEquals(new ListExpansion(2, DiceTerm.of(1, 20)), parse("2 d20"));
        }

        @Test
        void countBeforeConstant() {
            assertEquals(new ListExpansion(5, new Constant(3)), parse("5 3"));
        }

        @Test
        void nestedListExpansion() {
            assertEquals(new ListExpansion(2, new ListExpansion(3, DiceTerm.of(1, 6))), parse("2 3 1d6"));
        }

        @Test
        void parenthesizedTopLevelList() {
            assertEquals(new ListExpansion(2, DiceTerm.of(1, 6)), parse("(2 1d6)"));
        }

        @Test
        void commaSeparatedSequence() {
            Sequence expected = new Sequence(List.of(
                    DiceTerm.of(2, 6),
                    new ListExpansion(3, DiceTerm.of(1, 4))));
            assertEquals(expected, parse("2d6, 3 1d4"));
            assertEquals("2d6, 3 1d4", expected.toNotation());
        }
    }
}
