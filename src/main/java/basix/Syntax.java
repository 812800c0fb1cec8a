package basix;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Syntax of propositional formulas: the operators, the classification of root symbols and
 * the immutable formula tree.
 * <p/>
 * The set of node kinds is closed: variables, the constants {@code T} and {@code F},
 * applications of the unary {@code ~} and applications of the binary operators
 * {@code &, |, ->, +, <->, -&, -|}. Every transformation builds new trees, formulas are never
 * changed after their construction and can therefore be shared freely between trees.
 */
public class Syntax {

    /**
     * The constants and operators with their textual symbol
     */
    public enum Operator {
        TRUE("T", 0),
        FALSE("F", 0),
        NOT("~", 1),
        AND("&", 2),
        OR("|", 2),
        IMPLIES("->", 2),
        XOR("+", 2),
        IFF("<->", 2),
        NAND("-&", 2),
        NOR("-|", 2);

        public final String symbol;
        public final int arity;

        Operator(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        private static final Map<String, Operator> operatorPerSymbol;

        static {
            ImmutableMap.Builder<String, Operator> builder = ImmutableMap.builder();
            for (Operator operator : values()) {
                builder.put(operator.symbol, operator);
            }
            operatorPerSymbol = builder.build();
        }

        /**
         * @throws UnknownOperatorError if no constant or operator has this symbol
         */
        public static Operator fromSymbol(String symbol) {
            Operator operator = operatorPerSymbol.get(symbol);
            if (operator == null) {
                throw new UnknownOperatorError(symbol);
            }
            return operator;
        }

        public boolean isConstant() {
            return arity == 0;
        }

        public boolean isUnary() {
            return arity == 1;
        }

        public boolean isBinary() {
            return arity == 2;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    public static boolean isVariable(String symbol) {
        if (symbol == null || symbol.isEmpty() || symbol.charAt(0) < 'p' || symbol.charAt(0) > 'z') {
            return false;
        }
        for (int i = 1; i < symbol.length(); i++) {
            if (!Character.isDigit(symbol.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isConstant(String symbol) {
        return Operator.TRUE.symbol.equals(symbol) || Operator.FALSE.symbol.equals(symbol);
    }

    public static boolean isUnary(String symbol) {
        return Operator.NOT.symbol.equals(symbol);
    }

    public static boolean isBinary(String symbol) {
        return Operator.operatorPerSymbol.containsKey(symbol) && Operator.operatorPerSymbol.get(symbol).isBinary();
    }

    /**
     * Visitor with one method per node kind, there is no fallback for unknown kinds.
     */
    public interface FormulaVisitor<R> {

        R visit(VariableNode variable);

        R visit(ConstantNode constant);

        R visit(UnaryOperatorNode unaryOperator);

        R visit(BinaryOperatorNode binaryOperator);
    }

    /**
     * An immutable propositional formula
     */
    public static abstract class Formula {

        Formula() {
        }

        /**
         * Variable name, constant symbol or operator symbol
         */
        public abstract String root();

        public abstract <R> R accept(FormulaVisitor<R> visitor);

        public abstract List<Formula> children();

        /**
         * Names of the variables in the order of their first occurrence (pre-order, left to right)
         */
        public ImmutableSet<String> variables() {
            ImmutableSet.Builder<String> builder = ImmutableSet.builder();
            walk(f -> {
                if (f instanceof VariableNode) {
                    builder.add(((VariableNode) f).name);
                }
            });
            return builder.build();
        }

        /**
         * Constants and operators in the order of their first occurrence (pre-order, left to right)
         */
        public ImmutableSet<Operator> operators() {
            ImmutableSet.Builder<Operator> builder = ImmutableSet.builder();
            walk(f -> {
                if (!(f instanceof VariableNode)) {
                    builder.add(Operator.fromSymbol(f.root()));
                }
            });
            return builder.build();
        }

        /**
         * Number of nodes
         */
        public int size() {
            int size = 1;
            for (Formula child : children()) {
                size += child.size();
            }
            return size;
        }

        /**
         * Pre-order walk that visits a subtree which occurs several times in the tree only once
         */
        private void walk(Consumer<Formula> consumer) {
            walk(consumer, Collections.newSetFromMap(new IdentityHashMap<>()));
        }

        private void walk(Consumer<Formula> consumer, Set<Formula> alreadyVisited) {
            if (!alreadyVisited.add(this)) {
                return;
            }
            consumer.accept(this);
            for (Formula child : children()) {
                child.walk(consumer, alreadyVisited);
            }
        }

        /**
         * Rebuilds the tree bottom up: the children of a node are transformed first, then the
         * replacement is applied to the node with the transformed children. The result of the
         * replacement is not visited again.
         */
        public Formula transform(Function<Formula, Formula> replacement) {
            return transform(replacement, new IdentityHashMap<>());
        }

        /**
         * @param replacedMap results for the subtrees that are already transformed
         */
        private Formula transform(Function<Formula, Formula> replacement, Map<Formula, Formula> replacedMap) {
            Formula replaced = replacedMap.get(this);
            if (replaced != null) {
                return replaced;
            }
            replaced = replacement.apply(accept(new FormulaVisitor<Formula>() {
                @Override
                public Formula visit(VariableNode variable) {
                    return variable;
                }

                @Override
                public Formula visit(ConstantNode constant) {
                    return constant;
                }

                @Override
                public Formula visit(UnaryOperatorNode unaryOperator) {
                    return new UnaryOperatorNode(unaryOperator.operator,
                            unaryOperator.first.transform(replacement, replacedMap));
                }

                @Override
                public Formula visit(BinaryOperatorNode binaryOperator) {
                    return new BinaryOperatorNode(binaryOperator.operator,
                            binaryOperator.first.transform(replacement, replacedMap),
                            binaryOperator.second.transform(replacement, replacedMap));
                }
            }));
            replacedMap.put(this, replaced);
            return replaced;
        }

        /**
         * Replaces every occurrence of a variable that is a key of the map by the associated formula
         */
        public Formula substituteVariables(Map<String, Formula> substitutionMap) {
            for (String name : substitutionMap.keySet()) {
                if (!isVariable(name)) {
                    throw new BasixException(String.format("Cannot substitute %s, it is not a variable", name));
                }
            }
            return transform(f -> {
                if (f instanceof VariableNode && substitutionMap.containsKey(f.root())) {
                    return substitutionMap.get(f.root());
                }
                return f;
            });
        }

        /**
         * Replaces every occurrence of an operator that is a key of the map by the associated template.
         * Templates of unary operators use the variable {@code p} for the operand, templates of
         * binary operators {@code p} and {@code q} for the first and the second operand,
         * templates of constants have no variables. Operators introduced by a template are kept.
         */
        public Formula substituteOperators(Map<Operator, Formula> substitutionMap) {
            substitutionMap.forEach((operator, template) -> {
                Set<String> allowed = operator.isConstant() ? Collections.emptySet() :
                        (operator.isUnary() ? Collections.singleton("p") : ImmutableSet.of("p", "q"));
                if (!allowed.containsAll(template.variables())) {
                    throw new BasixException(String.format("Template %s for %s may only use the variables %s",
                            template, operator, allowed));
                }
            });
            return transform(f -> {
                if (f instanceof VariableNode) {
                    return f;
                }
                Formula template = substitutionMap.get(Operator.fromSymbol(f.root()));
                if (template == null) {
                    return f;
                }
                List<Formula> children = f.children();
                if (children.isEmpty()) {
                    return template;
                }
                Map<String, Formula> operands = new HashMap<>();
                operands.put("p", children.get(0));
                if (children.size() > 1) {
                    operands.put("q", children.get(1));
                }
                return template.substituteVariables(operands);
            });
        }
    }

    /**
     * A propositional variable
     */
    public static final class VariableNode extends Formula {
        public final String name;

        public VariableNode(String name) {
            if (!isVariable(name)) {
                throw new BasixException(String.format("%s is not a valid variable name", name));
            }
            this.name = name;
        }

        @Override
        public String root() {
            return name;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Formula> children() {
            return ImmutableList.of();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof VariableNode && ((VariableNode) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * {@code T} or {@code F}
     */
    public static final class ConstantNode extends Formula {
        public final Operator constant;

        public ConstantNode(Operator constant) {
            if (!constant.isConstant()) {
                throw new UnknownOperatorError(constant.symbol, "constant");
            }
            this.constant = constant;
        }

        public boolean value() {
            return constant == Operator.TRUE;
        }

        @Override
        public String root() {
            return constant.symbol;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Formula> children() {
            return ImmutableList.of();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof ConstantNode && ((ConstantNode) obj).constant == constant;
        }

        @Override
        public int hashCode() {
            return constant.hashCode();
        }

        @Override
        public String toString() {
            return constant.symbol;
        }
    }

    /**
     * An unary operator application
     */
    public static final class UnaryOperatorNode extends Formula {
        public final Operator operator;
        public final Formula first;

        public UnaryOperatorNode(Operator operator, Formula first) {
            if (!operator.isUnary()) {
                throw new UnknownOperatorError(operator.symbol, "unary operator");
            }
            this.operator = operator;
            this.first = Objects.requireNonNull(first);
        }

        @Override
        public String root() {
            return operator.symbol;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Formula> children() {
            return ImmutableList.of(first);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof UnaryOperatorNode)) {
                return false;
            }
            UnaryOperatorNode other = (UnaryOperatorNode) obj;
            return other.operator == operator && other.first.equals(first);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, first);
        }

        @Override
        public String toString() {
            return operator.symbol + first;
        }
    }

    /**
     * A binary operator application, the order of the operands matters
     */
    public static final class BinaryOperatorNode extends Formula {
        public final Operator operator;
        public final Formula first;
        public final Formula second;

        public BinaryOperatorNode(Operator operator, Formula first, Formula second) {
            if (!operator.isBinary()) {
                throw new UnknownOperatorError(operator.symbol, "binary operator");
            }
            this.operator = operator;
            this.first = Objects.requireNonNull(first);
            this.second = Objects.requireNonNull(second);
        }

        @Override
        public String root() {
            return operator.symbol;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Formula> children() {
            return ImmutableList.of(first, second);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof BinaryOperatorNode)) {
                return false;
            }
            BinaryOperatorNode other = (BinaryOperatorNode) obj;
            return other.operator == operator && other.first.equals(first) && other.second.equals(second);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, first, second);
        }

        @Override
        public String toString() {
            return String.format("(%s%s%s)", first, operator.symbol, second);
        }
    }

    public static VariableNode variable(String name) {
        return new VariableNode(name);
    }

    public static ConstantNode constant(Operator constant) {
        return new ConstantNode(constant);
    }

    public static ConstantNode constant(String symbol) {
        return new ConstantNode(Operator.fromSymbol(symbol));
    }

    public static ConstantNode t() {
        return new ConstantNode(Operator.TRUE);
    }

    public static ConstantNode f() {
        return new ConstantNode(Operator.FALSE);
    }

    public static UnaryOperatorNode unary(String symbol, Formula first) {
        return new UnaryOperatorNode(Operator.fromSymbol(symbol), first);
    }

    public static UnaryOperatorNode not(Formula first) {
        return new UnaryOperatorNode(Operator.NOT, first);
    }

    public static BinaryOperatorNode binary(Operator operator, Formula first, Formula second) {
        return new BinaryOperatorNode(operator, first, second);
    }

    public static BinaryOperatorNode binary(String symbol, Formula first, Formula second) {
        return new BinaryOperatorNode(Operator.fromSymbol(symbol), first, second);
    }

    public static BinaryOperatorNode and(Formula first, Formula second) {
        return binary(Operator.AND, first, second);
    }

    public static BinaryOperatorNode or(Formula first, Formula second) {
        return binary(Operator.OR, first, second);
    }

    public static BinaryOperatorNode implies(Formula first, Formula second) {
        return binary(Operator.IMPLIES, first, second);
    }

    public static BinaryOperatorNode xor(Formula first, Formula second) {
        return binary(Operator.XOR, first, second);
    }

    public static BinaryOperatorNode iff(Formula first, Formula second) {
        return binary(Operator.IFF, first, second);
    }

    public static BinaryOperatorNode nand(Formula first, Formula second) {
        return binary(Operator.NAND, first, second);
    }

    public static BinaryOperatorNode nor(Formula first, Formula second) {
        return binary(Operator.NOR, first, second);
    }

    /**
     * An operator symbol that is unknown or not supported at the place it occurs
     */
    public static class UnknownOperatorError extends BasixException {

        public final String symbol;

        public UnknownOperatorError(String symbol) {
            super(String.format("Unknown operator: %s", symbol));
            this.symbol = symbol;
        }

        public UnknownOperatorError(String symbol, String expected) {
            super(String.format("Unexpected operator: %s, expected a %s", symbol, expected));
            this.symbol = symbol;
        }
    }
}
