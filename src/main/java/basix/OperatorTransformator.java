package basix;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.Ordering;

import static basix.Syntax.*;

/**
 * Converts formulas into equivalent formulas that only use the operators of a specific basis.
 * <p/>
 * All conversions first eliminate the constants and every binary operator besides {@code &} and
 * {@code |}, the result is then rewritten into the target basis. Every conversion works bottom up,
 * the children of a node are converted before the node itself.
 */
public class OperatorTransformator {

    public static final Logger LOG = Logger.getLogger("Transformation");

    private final String defaultVariable;

    private final Config.WitnessChoice witnessChoice;

    public OperatorTransformator(String defaultVariable, Config.WitnessChoice witnessChoice) {
        if (!isVariable(defaultVariable)) {
            throw new BasixException(String.format("Default variable \"%s\" is not a variable name", defaultVariable));
        }
        this.defaultVariable = defaultVariable;
        this.witnessChoice = witnessChoice;
    }

    public OperatorTransformator(Config config) {
        this(config.defaultVariable(), config.witnessChoice());
    }

    private static OperatorTransformator instance;

    /**
     * Transformator that uses the settings of {@link Config#get()}
     */
    public static synchronized OperatorTransformator get() {
        if (instance == null) {
            instance = new OperatorTransformator(Config.get());
        }
        return instance;
    }

    public static Formula toNotAndOr(Formula formula) {
        return get().notAndOr(formula);
    }

    public static Formula toNotAnd(Formula formula) {
        return get().notAnd(formula);
    }

    public static Formula toNand(Formula formula) {
        return get().nand(formula);
    }

    public static Formula toImpliesNot(Formula formula) {
        return get().impliesNot(formula);
    }

    public static Formula toImpliesFalse(Formula formula) {
        return get().impliesFalse(formula);
    }

    /**
     * Variable used for the tautology or contradiction that replaces the constants of the formula
     */
    String witness(Formula formula) {
        if (formula.variables().isEmpty()) {
            return defaultVariable;
        }
        switch (witnessChoice) {
            case LEAST:
                return Ordering.<String>natural().min(formula.variables());
            case FIRST:
            default:
                return formula.variables().iterator().next();
        }
    }

    /**
     * Equivalent formula without constants and without operators besides {@code ~, &, |}
     */
    public Formula notAndOr(Formula formula) {
        VariableNode witness = variable(witness(formula));
        FormulaVisitor<Formula> replacement = new FormulaVisitor<Formula>() {
            @Override
            public Formula visit(VariableNode variable) {
                return variable;
            }

            @Override
            public Formula visit(ConstantNode constant) {
                if (constant.value()) {
                    return or(witness, not(witness));
                }
                return and(witness, not(witness));
            }

            @Override
            public Formula visit(UnaryOperatorNode unaryOperator) {
                return unaryOperator;
            }

            @Override
            public Formula visit(BinaryOperatorNode binaryOperator) {
                Formula a = binaryOperator.first;
                Formula b = binaryOperator.second;
                switch (binaryOperator.operator) {
                    case AND:
                    case OR:
                        return binaryOperator;
                    case IMPLIES:
                        return or(not(a), b);
                    case XOR:
                        return or(and(a, not(b)), and(not(a), b));
                    case IFF:
                        return or(and(a, b), and(not(a), not(b)));
                    case NAND:
                        return not(and(a, b));
                    case NOR:
                        return not(or(a, b));
                    default:
                        throw new UnknownOperatorError(binaryOperator.root());
                }
            }
        };
        return log(Basis.NOT_AND_OR, formula, formula.transform(node -> node.accept(replacement)));
    }

    /**
     * Equivalent formula without constants and without operators besides {@code ~, &}
     */
    public Formula notAnd(Formula formula) {
        return log(Basis.NOT_AND, formula, notAndFromNotAndOr(notAndOr(formula)));
    }

    /**
     * Equivalent formula without constants and without operators besides {@code -&}
     */
    public Formula nand(Formula formula) {
        return log(Basis.NAND, formula, nandFromNotAndOr(notAndOr(formula)));
    }

    /**
     * Equivalent formula without constants and without operators besides {@code ->, ~}
     */
    public Formula impliesNot(Formula formula) {
        return log(Basis.IMPLIES_NOT, formula, impliesNotFromNotAndOr(notAndOr(formula)));
    }

    /**
     * Equivalent formula without operators besides {@code ->} and the constant {@code F}
     */
    public Formula impliesFalse(Formula formula) {
        return log(Basis.IMPLIES_FALSE, formula, impliesFalseFromImpliesNot(impliesNot(formula)));
    }

    static Formula notAndFromNotAndOr(Formula formula) {
        return new Rewriting(Basis.NOT_AND_OR) {
            @Override
            public Formula visit(UnaryOperatorNode unaryOperator) {
                return unaryOperator;
            }

            @Override
            public Formula visit(BinaryOperatorNode binaryOperator) {
                switch (binaryOperator.operator) {
                    case AND:
                        return binaryOperator;
                    case OR:
                        return not(and(not(binaryOperator.first), not(binaryOperator.second)));
                    default:
                        return super.visit(binaryOperator);
                }
            }
        }.apply(formula);
    }

    static Formula nandFromNotAndOr(Formula formula) {
        return new Rewriting(Basis.NOT_AND_OR) {
            @Override
            public Formula visit(UnaryOperatorNode unaryOperator) {
                return Syntax.nand(unaryOperator.first, unaryOperator.first);
            }

            @Override
            public Formula visit(BinaryOperatorNode binaryOperator) {
                Formula a = binaryOperator.first;
                Formula b = binaryOperator.second;
                switch (binaryOperator.operator) {
                    case AND:
                        Formula n = Syntax.nand(a, b);
                        return Syntax.nand(n, n);
                    case OR:
                        return Syntax.nand(Syntax.nand(a, a), Syntax.nand(b, b));
                    default:
                        return super.visit(binaryOperator);
                }
            }
        }.apply(formula);
    }

    static Formula impliesNotFromNotAndOr(Formula formula) {
        return new Rewriting(Basis.NOT_AND_OR) {
            @Override
            public Formula visit(UnaryOperatorNode unaryOperator) {
                return unaryOperator;
            }

            @Override
            public Formula visit(BinaryOperatorNode binaryOperator) {
                Formula a = binaryOperator.first;
                Formula b = binaryOperator.second;
                switch (binaryOperator.operator) {
                    case OR:
                        return implies(not(a), b);
                    case AND:
                        return not(implies(a, not(b)));
                    default:
                        return super.visit(binaryOperator);
                }
            }
        }.apply(formula);
    }

    static Formula impliesFalseFromImpliesNot(Formula formula) {
        return new Rewriting(Basis.IMPLIES_NOT) {
            @Override
            public Formula visit(ConstantNode constant) {
                if (constant.value()) {
                    return implies(f(), f());
                }
                return constant;
            }

            @Override
            public Formula visit(UnaryOperatorNode unaryOperator) {
                return implies(unaryOperator.first, f());
            }

            @Override
            public Formula visit(BinaryOperatorNode binaryOperator) {
                if (binaryOperator.operator == Operator.IMPLIES) {
                    return binaryOperator;
                }
                return super.visit(binaryOperator);
            }
        }.apply(formula);
    }

    private Formula log(Basis basis, Formula formula, Formula result) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s in %s → %s", formula, basis, result));
        }
        return result;
    }

    /**
     * Replacement of a single node whose children are already converted. Variables are kept,
     * every other node is rejected unless a subclass handles it.
     */
    private static abstract class Rewriting implements FormulaVisitor<Formula> {

        /** basis of the formulas this rewriting accepts */
        private final Basis source;

        Rewriting(Basis source) {
            this.source = source;
        }

        @Override
        public Formula visit(VariableNode variable) {
            return variable;
        }

        @Override
        public Formula visit(ConstantNode constant) {
            throw unexpected(constant);
        }

        @Override
        public Formula visit(UnaryOperatorNode unaryOperator) {
            throw unexpected(unaryOperator);
        }

        @Override
        public Formula visit(BinaryOperatorNode binaryOperator) {
            throw unexpected(binaryOperator);
        }

        UnknownOperatorError unexpected(Formula node) {
            return new UnknownOperatorError(node.root(), "formula over " + source);
        }

        Formula apply(Formula formula) {
            return formula.transform(node -> node.accept(this));
        }
    }
}
