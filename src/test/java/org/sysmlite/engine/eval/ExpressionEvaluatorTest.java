package org.sysmlite.engine.eval;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.expression.Infinity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for model-level expression evaluation against the bundled library.
 */
class ExpressionEvaluatorTest extends AbstractModelTest {

    @Nested
    @DisplayName("Operators")
    class OperatorTests {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', value = {
                "1 + 2                      | [3]",
                "10 / 5                     | [2]",
                "7 / 2                      | [3.5]",
                "5 % 2                      | [1]",
                "2 ** 3                     | [8]",
                "2 ** 3 ** 2                | [512]",
                "1 + 2 * 3                  | [7]",
                "(1 + 2) * 3                | [9]",
                "-3                         | [-3]",
                "1.5 * 2                    | [3.0]",
                "\"s1\" + \"s2\"            | [s1s2]",
                "1 < 2                      | [true]",
                "2.5 >= 3                   | [false]",
                "\"a\" < \"b\"              | [true]",
                "1 == 1.0                   | [true]",
                "1 === 1.0                  | [false]",
                "1 != 2                     | [true]",
                "not (1 == 1)               | [false]",
                "true and false             | [false]",
                "true or false              | [true]",
                "true xor true              | [false]",
                "false implies false        | [true]",
                "true & false               | [false]",
                "if 1 < 2 ? \"yes\" else \"no\" | [yes]",
                "null ?? 5                  | [5]",
                "(1, 2, 3)                  | [1, 2, 3]",
                "(1, 2, 3)#(2)              | [2]",
                "()                         | []",
        })
        void evaluates(String expression, String expected) {
            assertEquals(expected, values(expression).toString());
        }

        @Test
        void unusedBranchesAreNotEvaluated() {
            assertEquals(List.of(1L), values("if true ? 1 else 1 / 0"));
            assertEquals(List.of(false), values("false and 1 / 0 == 1"));
            assertEquals(List.of(true), values("true or 1 / 0 == 1"));
            assertEquals(List.of(7L), values("7 ?? 1 / 0"));
        }

        @Test
        void infinityLiteral() {
            EvaluationResult result = evaluate("*");
            assertEquals(List.of(Infinity.INSTANCE), result.values());
            assertEquals(List.of("*"), result.toDebugList());
        }

        @Test
        void rangeIsLazy() {
            List<Object> range = values("1..4");
            RangeSequence sequence = assertInstanceOf(RangeSequence.class, range);
            assertEquals(1L, sequence.start());
            assertEquals(List.of(1L, 2L, 3L, 4L), range);
            assertEquals(List.of(1000000000L), values("(1..1000000000)->SequenceFunctions::size()"));
        }

        @Test
        void powersOfTrivialBasesFinish() {
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                assertEquals(List.of(1L), values("1 ** 9000000000000000000"));
                assertEquals(List.of(0L), values("0 ** 9000000000000000000"));
                assertEquals(List.of(-1L), values("(-1) ** 9000000000000000001"));
                assertEquals(List.of(1L), values("(-1) ** 9000000000000000000"));
            });
            assertEquals(List.of(1L), values("0 ** 0"));
            assertEquals(List.of(4611686018427387904L), values("2 ** 62"));
            assertEquals(List.of(-27L), values("(-3) ** 3"));
        }

        @Test
        void rangesBeyondIntSize() {
            assertEquals(List.of(3000000001L), values("SequenceFunctions::size(0..3000000000)"));
            assertEquals(List.of(3000000000L), values("(1..3000000000)#(3000000000)"));
            assertEquals(List.of(3000000000L), values("(1..3000000000)->SequenceFunctions::last()"));

            EvaluationResult result = evaluate("1..3000000000");
            assertFalse(result.isError());
            RangeSequence range = assertInstanceOf(RangeSequence.class, result.values());
            assertEquals(3000000000L, range.count());
            assertEquals(Integer.MAX_VALUE, result.values().size());
            assertFalse(result.values().isEmpty());
        }

        @ParameterizedTest(name = "{0} fails with ''{1}''")
        @CsvSource(delimiter = '|', value = {
                "1 / 0                      | Cannot divide by 0",
                "5 % 0                      | Cannot use modulo operation on 0",
                "1 + \"a\"                  | Mismatched argument types",
                "\"a\" * \"b\"              | Cannot evaluate binary strings",
                "9223372036854775807 + 1    | Integer overflow",
                "not 1                      | Not a boolean",
                "(1, 2) + 1                 | Too many values, expected 1",
                "(1, 2)#(3)                 | Index 3 out of bounds for sequence of size 2",
                "(1, 2)#(1, 1)              | Cannot use multi-dimensional index on a one-dimensional sequence",
                "1..\"x\"                   | Not an integer",
                "2 ** 63                    | Integer overflow",
                "-9223372036854775807..9223372036854775807 | Range -9223372036854775807..9223372036854775807 is too large",
                "(1..3000000000, 0)         | Sequence is too large to concatenate",
        })
        void reportsErrors(String expression, String message) {
            assertEquals(message, error(expression));
        }

        @Test
        void errorCarriesExpressionStack() {
            EvaluationResult result = evaluate("1 + 1 / 0");
            assertTrue(result.isError());
            assertEquals(List.of(), result.values());
            assertFalse(result.error().stack().isEmpty());
            assertThrows(IllegalStateException.class, result::toDebugList);
        }
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', value = {
                "1 istype ScalarValues::Real                  | [true]",
                "1 istype ScalarValues::String                | [false]",
                "\"a\" istype ScalarValues::String            | [true]",
                "1 hastype ScalarValues::Integer              | [true]",
                "1 hastype ScalarValues::Real                 | [false]",
                "(1, \"a\", 2) as ScalarValues::Integer       | [1, 2]",
                "(1.5, \"a\") @ ScalarValues::Real            | [true]",
        })
        void classifiesValues(String expression, String expected) {
            assertEquals(expected, values(expression).toString());
        }

        @Test
        void classifiesElements() {
            SourceDocument document = build("""
                    package P {
                        class A;
                        class B specializes A;
                        feature isA = B istype A;
                        feature hasA = B hastype A;
                    }
                    """);
            assertEquals(List.of(true), evaluate(document, "P::isA").values());
            assertEquals(List.of(false), evaluate(document, "P::hasA").values());
        }
    }

    @Nested
    @DisplayName("Library functions")
    class FunctionTests {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', value = {
                "SequenceFunctions::size((1, 2, 3))               | [3]",
                "(1, 2, 3)->SequenceFunctions::size()             | [3]",
                "SequenceFunctions::isEmpty(())                   | [true]",
                "SequenceFunctions::notEmpty(null)                | [false]",
                "(1, 2, 3)->SequenceFunctions::includes(2)        | [true]",
                "(1..10)->SequenceFunctions::includes(11)         | [false]",
                "(1, 2, 3)->SequenceFunctions::excludes(2.0)      | [false]",
                "SequenceFunctions::head((4, 5, 6))               | [4]",
                "SequenceFunctions::tail((4, 5, 6))               | [5, 6]",
                "SequenceFunctions::last((4, 5, 6))               | [6]",
                "StringFunctions::Length(\"hello\")               | [5]",
                "StringFunctions::Substring(\"hello\", 2, 4)      | [ell]",
                "NumericalFunctions::sum((1, 2, 3))               | [6]",
                "NumericalFunctions::sum((1, 2.5))                | [3.5]",
                "NumericalFunctions::sum(())                      | [0]",
                "NumericalFunctions::product((2, 3, 4))           | [24]",
                "NumericalFunctions::max((3, 7.5, 1))             | [7.5]",
                "NumericalFunctions::min(2..9)                    | [2]",
                "NumericalFunctions::max(())                      | []",
        })
        void callsBuiltin(String expression, String expected) {
            assertEquals(expected, values(expression).toString());
        }

        @Test
        void substringBoundsAreChecked() {
            assertEquals("End 9 is out of bounds for string of size 5",
                    error("StringFunctions::Substring(\"hello\", 2, 9)"));
            assertEquals("Start 0 is out of bounds", error("StringFunctions::Substring(\"hello\", 0, 2)"));
        }

        @Test
        void invocationWithoutBuiltinFails() {
            SourceDocument document = build("""
                    package P {
                        function f;
                        feature x = f(1);
                    }
                    """);
            EvaluationResult result = evaluate(document, "P::x");
            assertEquals("No associated builtin function found for 'f'", result.error().message());
        }
    }

    @Nested
    @DisplayName("Feature values")
    class FeatureTests {

        @Test
        void referencedFeatureEvaluatesToItsValue() {
            SourceDocument document = build("""
                    package P {
                        feature a = 40;
                        feature b = a + 2;
                    }
                    """);
            assertEquals(List.of(42L), evaluate(document, "P::b").values());
        }

        @Test
        void referenceToClassEvaluatesToTheElement() {
            SourceDocument document = build("""
                    package P {
                        class A;
                        feature f = A;
                    }
                    """);
            EvaluationResult result = evaluate(document, "P::f");
            assertSame(find(document, "P::A"), result.values().get(0));
            assertEquals(List.of(Map.of("qualifiedName", "P::A")), result.toDebugList());
        }

        @Test
        void featureWithoutValueEvaluatesToItself() {
            SourceDocument document = build("""
                    package P {
                        feature a;
                        feature b = a;
                    }
                    """);
            assertEquals(List.of(find(document, "P::a")), evaluate(document, "P::b").values());
        }

        @Test
        void redefiningValueTakesPrecedence() {
            SourceDocument document = build("""
                    package P {
                        class Vehicle {
                            feature mass default = 1000;
                            feature total = mass + 100;
                        }
                        class Truck specializes Vehicle {
                            :>> mass = 5000;
                        }
                    }
                    """);
            assertNoErrors(document);
            assertEquals(List.of(1100L), evaluate(document, "P::Vehicle::total").values());

            Feature total = find(document, "P::Vehicle::total", Feature.class);
            Type truck = find(document, "P::Truck", Type.class);
            assertEquals(List.of(5100L), workspace.evaluator().evaluate(total.value(), truck).values());
        }

        @Test
        void navigatesFeatureChains() {
            SourceDocument document = build("""
                    package P {
                        class Engine {
                            feature power = 150;
                        }
                        class Car {
                            feature engine : Engine;
                        }
                        feature car : Car;
                        feature p = car.engine.power;
                    }
                    """);
            assertEquals(List.of(150L), evaluate(document, "P::p").values());
        }

        @Test
        void circularValuesFail() {
            SourceDocument document = build("""
                    package P {
                        feature a = b;
                        feature b = a;
                    }
                    """);
            EvaluationResult result = evaluate(document, "P::a");
            assertTrue(result.isError());
            assertTrue(result.error().message().startsWith("Circular value of feature"), result.error().message());
        }

        @Test
        void selfIsTheTarget() {
            SourceDocument document = build("""
                    package P {
                        class A {
                            feature me = self;
                        }
                    }
                    """);
            assertEquals(List.of(find(document, "P::A")), evaluate(document, "P::A::me").values());
        }
    }

    @Nested
    @DisplayName("Collections")
    class CollectionTests {

        private static final String ARRAY = """
                package P {
                    feature arr : Collections::Array {
                        :>> dimensions = (2, 3);
                        :>> elements = (1, 2, 3, 4, 5, 6);
                    }
                    feature last = arr#(2, 3);
                    feature middle = arr#(2, 1);
                    feature outside = arr#(3, 1);
                    feature flat = arr#(1);
                }
                """;

        @Test
        void indexesArraysRowMajor() {
            SourceDocument document = build(ARRAY);
            assertEquals(List.of(6L), evaluate(document, "P::last").values());
            assertEquals(List.of(4L), evaluate(document, "P::middle").values());
        }

        @Test
        void rejectsBadArrayIndices() {
            SourceDocument document = build(ARRAY);
            assertEquals("Index at dimension 0 is out of bounds (3 > 2)",
                    evaluate(document, "P::outside").error().message());
            assertEquals("Array and index dimensions do not match: 2 != 1",
                    evaluate(document, "P::flat").error().message());
        }

        @Test
        void rejectsOverflowingArrayOffset() {
            SourceDocument document = build("""
                    package P {
                        feature arr : Collections::Array {
                            :>> dimensions = (3, 4611686018427387904);
                            :>> elements = (1, 2, 3);
                        }
                        feature far = arr#(3, 1);
                    }
                    """);
            assertEquals("Array index overflow at dimension 1", evaluate(document, "P::far").error().message());
        }

        @Test
        void indexesOrderedCollections() {
            SourceDocument document = build("""
                    package P {
                        feature list : Collections::List {
                            :>> elements = ("a", "b", "c");
                        }
                        feature second = list#(2);
                    }
                    """);
            assertEquals(List.of("b"), evaluate(document, "P::second").values());
        }
    }

    @Nested
    @DisplayName("Without standard library")
    class WithoutLibraryTests {

        @Test
        void functionsResolveBySimpleName() {
            SourceDocument document = workspace.update(URI, "package P { feature x = size((1, 2)); }");
            workspace.build(withoutLibrary());
            assertEquals(List.of(2L), evaluate(document, "P::x").values());
        }

        @Test
        void classificationNeedsTheLibrary() {
            SourceDocument document = workspace.update(URI, "package P { feature x = 1 istype ScalarValues::Real; }");
            workspace.build(withoutLibrary());
            assertEquals("Error computing type argument", evaluate(document, "P::x").error().message());
        }
    }
}
