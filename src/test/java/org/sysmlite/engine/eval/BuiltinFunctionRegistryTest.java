package org.sysmlite.engine.eval;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinFunctionRegistryTest {

    private static final BuiltinFunction ONE = (expression, target, evaluator) -> List.of(1L);
    private static final BuiltinFunction TWO = (expression, target, evaluator) -> List.of(2L);

    @Test
    void findsByQualifiedAndSimpleName() {
        BuiltinFunctionRegistry registry = new BuiltinFunctionRegistry();
        registry.register("Pkg", "f", ONE);

        assertSame(ONE, registry.find("Pkg::f").orElseThrow());
        assertSame(ONE, registry.find("f").orElseThrow());
        assertSame(ONE, registry.find(FunctionKey.of("Pkg", "f")).orElseThrow());
        assertTrue(registry.find("Other::f").isEmpty());
    }

    @Test
    void sharedSimpleNameIsOnlyReachableQualified() {
        BuiltinFunctionRegistry registry = new BuiltinFunctionRegistry();
        registry.register("A", "f", ONE);
        registry.register("B", "f", TWO);

        assertTrue(registry.find("f").isEmpty());
        assertSame(ONE, registry.find("A::f").orElseThrow());
        assertSame(TWO, registry.find("B::f").orElseThrow());
    }

    @Test
    void reRegisteringReplacesTheFunction() {
        BuiltinFunctionRegistry registry = new BuiltinFunctionRegistry();
        registry.register("A", "f", ONE);
        registry.register("A", "f", TWO);

        assertSame(TWO, registry.find("f").orElseThrow());
        assertEquals(1, registry.functions().size());
    }

    @Test
    void operatorNamesAreQuoted() {
        assertEquals("DataFunctions::'+'", FunctionKey.of("DataFunctions", "+").qualifiedName());
        assertEquals("SequenceFunctions::size", FunctionKey.of("SequenceFunctions", "size").toString());
        assertThrows(NullPointerException.class, () -> FunctionKey.of(null, "size"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"+", "-", "*", "/", "%", "**", "^", "<", ">", "<=", ">=", "..", "not", "xor",
            "==", "!=", "===", "!==", "istype", "hastype", "as", "@", "#", ",", "if", "??", "and", "or",
            "implies", "."})
    void everyOperatorHasABuiltin(String operator) {
        FunctionKey key = Operators.functionFor(operator).orElseThrow();
        assertTrue(BuiltinFunctionRegistry.withBuiltins().find(key).isPresent(), key::toString);
    }

    @Test
    void unknownOperator() {
        assertFalse(Operators.isOperator("<=>"));
        assertTrue(Operators.functionFor("<=>").isEmpty());
    }
}
