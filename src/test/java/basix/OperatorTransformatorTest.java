package basix;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static basix.OperatorTransformator.*;
import static basix.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class OperatorTransformatorTest {

    static final VariableNode p = variable("p");
    static final VariableNode q = variable("q");
    static final VariableNode r = variable("r");
    static final VariableNode s = variable("s");

    static Stream<Formula> formulas() {
        return Stream.of(
                p,
                t(),
                f(),
                not(t()),
                and(p, q),
                or(p, q),
                implies(p, q),
                xor(p, q),
                iff(p, q),
                nand(p, q),
                nor(p, q),
                not(not(p)),
                implies(and(p, t()), or(q, f())),
                iff(xor(p, q), nand(r, not(s))),
                nor(implies(iff(p, f()), q), xor(t(), and(r, p))),
                and(nand(nor(p, p), xor(q, q)), implies(not(iff(r, s)), t())),
                xor(xor(xor(p, q), r), iff(s, nor(t(), f()))));
    }

    static Stream<Arguments> formulasAndBases() {
        return formulas().flatMap(formula -> Stream.of(Basis.values()).map(basis -> Arguments.of(formula, basis)));
    }

    @ParameterizedTest
    @MethodSource("formulasAndBases")
    public void testEquivalentAndInBasis(Formula formula, Basis basis) {
        Formula reduced = basis.reduce(formula);
        assertTrue(basis.contains(reduced), () -> String.format("%s should only use %s", reduced, basis));
        assertTrue(Semantics.equivalent(formula, reduced), () -> String.format("%s should be equivalent to %s", reduced, formula));
    }

    @ParameterizedTest
    @MethodSource("formulasAndBases")
    public void testReducingTwiceKeepsBasis(Formula formula, Basis basis) {
        Formula twice = basis.reduce(basis.reduce(formula));
        assertTrue(basis.contains(twice));
        assertTrue(Semantics.equivalent(formula, twice));
    }

    @ParameterizedTest
    @MethodSource("formulas")
    public void testNotAndOrIsIdempotent(Formula formula) {
        Formula reduced = toNotAndOr(formula);
        assertEquals(reduced, toNotAndOr(reduced));
    }

    @ParameterizedTest
    @MethodSource("formulas")
    public void testInputIsUnchanged(Formula formula) {
        String before = formula.toString();
        Formula copy = formula.transform(node -> node);
        for (Basis basis : Basis.values()) {
            basis.reduce(formula);
        }
        assertEquals(before, formula.toString());
        assertEquals(copy, formula);
    }

    @Nested
    public class NotAndOrTest {

        @Test
        public void testImplies() {
            Formula reduced = toNotAndOr(implies(p, q));
            assertEquals(or(not(p), q), reduced);
            assertEquals("(~p|q)", reduced.toString());
            assertTrue(Semantics.equivalent(implies(p, q), reduced));
        }

        @Test
        public void testBinaryOperators() {
            assertEquals("(p&q)", toNotAndOr(and(p, q)).toString());
            assertEquals("(p|q)", toNotAndOr(or(p, q)).toString());
            assertEquals("((p&~q)|(~p&q))", toNotAndOr(xor(p, q)).toString());
            assertEquals("((p&q)|(~p&~q))", toNotAndOr(iff(p, q)).toString());
            assertEquals("~(p&q)", toNotAndOr(nand(p, q)).toString());
            assertEquals("~(p|q)", toNotAndOr(nor(p, q)).toString());
        }

        @Test
        public void testChildrenAreReducedFirst() {
            assertEquals("(~(~p|q)|((r&~s)|(~r&s)))", toNotAndOr(implies(implies(p, q), xor(r, s))).toString());
            assertEquals("~~(q&(q|~q))", toNotAndOr(not(not(and(q, t())))).toString());
        }

        @Test
        public void testConstantsWithoutVariables() {
            Formula tautology = toNotAndOr(t());
            assertEquals("(p|~p)", tautology.toString());
            assertTrue(Semantics.constants(tautology).isEmpty());
            assertTrue(Semantics.isTautology(tautology));

            Formula contradiction = toNotAndOr(f());
            assertEquals("(p&~p)", contradiction.toString());
            assertTrue(Semantics.constants(contradiction).isEmpty());
            assertTrue(Semantics.isContradiction(contradiction));
        }

        @Test
        public void testWitnessIsFirstVariable() {
            assertEquals("(q&(q|~q))", toNotAndOr(and(q, t())).toString());
            assertEquals("((r|s)&(r&~r))", toNotAndOr(and(or(r, s), f())).toString());
        }

        @Test
        public void testWitnessIsLeastVariable() {
            OperatorTransformator transformator = new OperatorTransformator("p", Config.WitnessChoice.LEAST);
            assertEquals("((s|r)&(r|~r))", transformator.notAndOr(and(or(s, r), t())).toString());
        }

        @Test
        public void testDefaultVariable() {
            OperatorTransformator transformator = new OperatorTransformator("z", Config.WitnessChoice.FIRST);
            assertEquals("(z&~z)", transformator.notAndOr(f()).toString());
            assertEquals("((q|~q)|q)", transformator.notAndOr(or(t(), q)).toString());
        }

        @Test
        public void testInvalidDefaultVariable() {
            assertThrows(BasixException.class, () -> new OperatorTransformator("a", Config.WitnessChoice.FIRST));
        }
    }

    @Nested
    public class NotAndTest {

        @Test
        public void testOr() {
            assertEquals("~(~p&~q)", toNotAnd(or(p, q)).toString());
        }

        @Test
        public void testNested() {
            assertEquals("~(~~p&~(q&r))", toNotAnd(implies(p, and(q, r))).toString());
        }

        @Test
        public void testRejectsOtherOperators() {
            UnknownOperatorError error = assertThrows(UnknownOperatorError.class,
                    () -> notAndFromNotAndOr(implies(p, q)));
            assertEquals("->", error.symbol);
            assertThrows(UnknownOperatorError.class, () -> notAndFromNotAndOr(and(p, t())));
        }
    }

    @Nested
    public class NandTest {

        @Test
        public void testAnd() {
            Formula reduced = toNand(and(p, q));
            assertEquals("((p-&q)-&(p-&q))", reduced.toString());
            assertEquals(Basis.NAND.operators, reduced.operators());
            assertTrue(Semantics.equivalent(and(p, q), reduced));
        }

        @Test
        public void testNotAndOr() {
            assertEquals("(p-&p)", toNand(not(p)).toString());
            assertEquals("((p-&p)-&(q-&q))", toNand(or(p, q)).toString());
        }

        @Test
        public void testRejectsOtherOperators() {
            assertThrows(UnknownOperatorError.class, () -> nandFromNotAndOr(t()));
            assertThrows(UnknownOperatorError.class, () -> nandFromNotAndOr(nand(p, q)));
        }
    }

    @Nested
    public class ImpliesNotTest {

        @Test
        public void testIff() {
            Formula reduced = toImpliesNot(iff(p, q));
            assertTrue(Basis.IMPLIES_NOT.contains(reduced));
            assertTrue(Semantics.equivalent(iff(p, q), reduced));
            assertEquals("(~~(p->~q)->~(~p->~~q))", reduced.toString());
        }

        @Test
        public void testAndOr() {
            assertEquals("(~p->q)", toImpliesNot(or(p, q)).toString());
            assertEquals("~(p->~q)", toImpliesNot(and(p, q)).toString());
            assertEquals("~p", toImpliesNot(not(p)).toString());
        }

        @Test
        public void testRejectsOtherOperators() {
            assertThrows(UnknownOperatorError.class, () -> impliesNotFromNotAndOr(xor(p, q)));
        }
    }

    @Nested
    public class ImpliesFalseTest {

        @Test
        public void testNot() {
            assertEquals("(p->F)", toImpliesFalse(not(p)).toString());
        }

        @Test
        public void testTrue() {
            Formula reduced = toImpliesFalse(t());
            assertEquals("((p->F)->(p->F))", reduced.toString());
            assertTrue(Semantics.isTautology(reduced));
        }

        @Test
        public void testConstantsOfImpliesNot() {
            assertEquals("(F->F)", impliesFalseFromImpliesNot(t()).toString());
            assertEquals(f(), impliesFalseFromImpliesNot(f()));
            assertEquals("((p->F)->(F->F))", impliesFalseFromImpliesNot(implies(not(p), t())).toString());
        }

        @Test
        public void testRejectsOtherOperators() {
            UnknownOperatorError error = assertThrows(UnknownOperatorError.class,
                    () -> impliesFalseFromImpliesNot(and(p, q)));
            assertEquals("&", error.symbol);
            assertTrue(error.getMessage().contains("&"));
        }
    }
}
