package org.astroller.dsl;

import java.util.Objects;

/**
 * Keeps or drops a subset of a dice term's rolls, e.g. 2d20 kh1 or 4d6 dl1.
 *
 * @param kind  Which rolls to keep or drop
 * @param count How many rolls the directive selects, between 1 and the dice count
 * @param dice  The dice whose rolls are filtered
 */
public record Modifier(Kind kind, int count, DiceTerm dice) implements ScalarExpression {

    public enum Kind {
        KEEP_HIGHEST("kh", true, true),
        KEEP_LOWEST("kl", false, true),
        DROP_HIGHEST("dh", true, false),
        DROP_LOWEST("dl", false, false);

        private final String code;
        private final boolean highest;
        private final boolean keep;

        Kind(String code, boolean highest, boolean keep) {
            this.code = code;
            this.highest = highest;
            this.keep = keep;
        }

        public String code() {
            return code;
        }

        /**
         * @return true when the directive selects from the highest rolls
         */
        public boolean highest() {
            return highest;
        }

        /**
         * @return true when selected rolls are kept, false when they are dropped
         */
        public boolean keep() {
            return keep;
        }

        public static Kind fromCode(String code) {
            for (Kind kind : values()) {
                if (kind.code.equalsIgnoreCase(code)) {
                    return kind;
                }
            }
            throw new RollSemanticException("Unknown dice modifier: " + code);
        }
    }

    public Modifier {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(dice, "Dice cannot be null");
        if (count < 1) {
            throw new RollSemanticException(
                    "Modifier " + kind.code() + " count must be positive, got " + count);
        }
        if (count > dice.count()) {
            throw new RollSemanticException(
                    "Modifier " + kind.code() + count + " selects more dice than " + dice.toNotation() + " rolls");
        }
    }

    @Override
    public String toNotation() {
        return dice.toNotation() + " " + kind.code() + count;
    }

    @Override
    public <T> T accept(RollExpressionVisitor<T> visitor) {
        return visitor.visitModifier(this);
    }
}
