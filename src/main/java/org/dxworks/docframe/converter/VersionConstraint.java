package org.dxworks.docframe.converter;

import org.dxworks.docframe.exception.ConfigurationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A comma-separated list of version comparisons, e.g. {@code ">=5.0,<6"}. All clauses must hold.
 * Versions compare numerically component by component, with no limit on a component's size;
 * missing components count as zero and qualifiers such as {@code -beta} are ignored.
 */
public final class VersionConstraint {

    private static final Pattern CLAUSE = Pattern.compile("^(>=|<=|==|!=|>|<)?\\s*(\\d+(?:\\.\\d+)*)\\S*$");
    private static final Pattern LEADING_NUMBERS = Pattern.compile("^\\D*(\\d+(?:\\.\\d+)*)");

    private enum Operator {
        GE(">="), LE("<="), EQ("=="), NE("!="), GT(">"), LT("<");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException(symbol);
        }

        boolean test(int comparison) {
            return switch (this) {
                case GE -> comparison >= 0;
                case LE -> comparison <= 0;
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
                case GT -> comparison > 0;
                case LT -> comparison < 0;
            };
        }
    }

    private static final class Clause {
        final Operator operator;
        final BigInteger[] version;

        Clause(Operator operator, BigInteger[] version) {
            this.operator = operator;
            this.version = version;
        }
    }

    private final String text;
    private final List<Clause> clauses;

    private VersionConstraint(String text, List<Clause> clauses) {
        this.text = text;
        this.clauses = clauses;
    }

    /**
     * @throws ConfigurationException when a clause is not a comparison against a dotted number
     */
    public static VersionConstraint parse(String text) {
        List<Clause> clauses = new ArrayList<>();
        for (String raw : text.split(",")) {
            String clause = raw.trim();
            if (clause.isEmpty()) {
                continue;
            }
            Matcher matcher = CLAUSE.matcher(clause);
            if (!matcher.matches()) {
                throw new ConfigurationException("Invalid version constraint '" + text + "': cannot parse '" + clause + "'");
            }
            Operator operator = matcher.group(1) == null ? Operator.EQ : Operator.fromSymbol(matcher.group(1));
            clauses.add(new Clause(operator, components(matcher.group(2))));
        }
        if (clauses.isEmpty()) {
            throw new ConfigurationException("Invalid version constraint '" + text + "': no clauses");
        }
        return new VersionConstraint(text, List.copyOf(clauses));
    }

    /**
     * Whether {@code version} satisfies every clause. A version without any digits never does.
     */
    public boolean isSatisfiedBy(String version) {
        Matcher matcher = LEADING_NUMBERS.matcher(version.trim());
        if (!matcher.find()) {
            return false;
        }
        BigInteger[] installed = components(matcher.group(1));
        for (Clause clause : clauses) {
            if (!clause.operator.test(compare(installed, clause.version))) {
                return false;
            }
        }
        return true;
    }

    static int compare(BigInteger[] left, BigInteger[] right) {
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            BigInteger l = i < left.length ? left[i] : BigInteger.ZERO;
            BigInteger r = i < right.length ? right[i] : BigInteger.ZERO;
            int comparison = l.compareTo(r);
            if (comparison != 0) {
                return comparison;
            }
        }
        return 0;
    }

    private static BigInteger[] components(String dotted) {
        String[] parts = dotted.split("\\.");
        BigInteger[] result = new BigInteger[parts.length];
        for (int i = 0; i < parts.length; i++) {
            result[i] = new BigInteger(parts[i]);
        }
        return result;
    }

    @Override
    public String toString() {
        return text;
    }
}
