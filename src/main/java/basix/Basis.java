package basix;

import java.util.function.BiFunction;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableSet;

import static basix.Syntax.*;

/**
 * The functionally complete sets of operators that formulas can be converted into
 */
public enum Basis {
    NOT_AND_OR(OperatorTransformator::notAndOr, Operator.NOT, Operator.AND, Operator.OR),
    NOT_AND(OperatorTransformator::notAnd, Operator.NOT, Operator.AND),
    NAND(OperatorTransformator::nand, Operator.NAND),
    IMPLIES_NOT(OperatorTransformator::impliesNot, Operator.IMPLIES, Operator.NOT),
    IMPLIES_FALSE(OperatorTransformator::impliesFalse, Operator.IMPLIES, Operator.FALSE);

    public final ImmutableSet<Operator> operators;

    private final BiFunction<OperatorTransformator, Formula, Formula> reduction;

    Basis(BiFunction<OperatorTransformator, Formula, Formula> reduction, Operator... operators) {
        this.reduction = reduction;
        this.operators = ImmutableSet.copyOf(operators);
    }

    /**
     * Convert the formula with the default transformator
     */
    public Formula reduce(Formula formula) {
        return reduce(OperatorTransformator.get(), formula);
    }

    public Formula reduce(OperatorTransformator transformator, Formula formula) {
        return reduction.apply(transformator, formula);
    }

    /**
     * Does the formula only use constants and operators of this basis?
     */
    public boolean contains(Formula formula) {
        return operators.containsAll(formula.operators());
    }

    @Override
    public String toString() {
        return operators.stream().map(o -> o.symbol).collect(Collectors.joining(", ", "{", "}"));
    }
}
