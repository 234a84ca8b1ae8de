package org.sysmlite.kerml.dsl.antlr;

import org.sysmlite.kerml.dsl.KerMLParseException;
import org.sysmlite.kerml.dsl.Note;
import org.sysmlite.kerml.dsl.ParseResult;
import org.sysmlite.kerml.dsl.ReferenceSyntax;
import org.sysmlite.kerml.dsl.SyntaxKind;
import org.sysmlite.kerml.dsl.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ANTLR-based KerML front end: syntax tree shape, error
 * collection and hidden-channel notes.
 */
class KerMLParserAdapterTest {

    private static SyntaxNode only(SyntaxNode node) {
        assertEquals(1, node.children().size(), "Expected a single child in " + node);
        return node.children().get(0);
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        void packageWithClass() {
            SyntaxNode root = KerMLParserAdapter.parseStrict("""
                    package Vehicles {
                        class Car;
                    }
                    """);
            SyntaxNode pkg = only(root);
            assertEquals(SyntaxKind.PACKAGE, pkg.kind());
            assertEquals("Vehicles", pkg.attribute("name"));

            SyntaxNode car = only(pkg);
            assertEquals(SyntaxKind.TYPE, car.kind());
            assertEquals("class", car.attribute("keyword"));
            assertEquals("Car", car.attribute("name"));
        }

        @Test
        void standardLibraryPackageFlags() {
            SyntaxNode pkg = only(KerMLParserAdapter.parseStrict("standard library package Base;"));
            assertTrue(pkg.hasFlag("library"));
            assertTrue(pkg.hasFlag("standard"));
        }

        @Test
        void shortAndDeclaredName() {
            SyntaxNode type = only(KerMLParserAdapter.parseStrict("type <T> Thing;"));
            assertEquals("T", type.attribute("shortName"));
            assertEquals("Thing", type.attribute("name"));
        }

        @Test
        void unrestrictedNameIsUnquoted() {
            SyntaxNode function = only(KerMLParserAdapter.parseStrict("function '+';"));
            assertEquals("+", function.attribute("name"));
        }

        @Test
        void sysmlDefinitionKeyword() {
            SyntaxNode def = only(KerMLParserAdapter.parseStrict("part def Engine;"));
            assertEquals("part def", def.attribute("keyword"));
        }

        @Test
        void visibilityIsRecorded() {
            SyntaxNode pkg = only(KerMLParserAdapter.parseStrict("package P { private class Hidden; }"));
            assertEquals("private", only(pkg).attribute("visibility"));
        }

        @Test
        void specializationReferenceKeepsSegments() {
            SyntaxNode pkg = only(KerMLParserAdapter.parseStrict("package P { class A specializes Q::B; }"));
            SyntaxNode type = only(pkg);
            SyntaxNode specifier = type.child(SyntaxKind.SPECIFIER).orElseThrow();
            assertEquals("specializes", specifier.attribute("relation"));
            ReferenceSyntax reference = specifier.firstReference("target").orElseThrow();
            assertEquals("B", reference.lastName());
        }
    }

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        private SyntaxNode value(String expression) {
            SyntaxNode feature = only(KerMLParserAdapter.parseStrict("feature x = " + expression + ";"));
            SyntaxNode value = feature.child(SyntaxKind.FEATURE_VALUE).orElseThrow();
            return value.children().stream().filter(c -> c.kind().isExpression()).findFirst().orElseThrow();
        }

        @Test
        void multiplicationBindsTighterThanAddition() {
            SyntaxNode sum = value("1 + 2 * 3");
            assertEquals(SyntaxKind.OPERATOR_EXPRESSION, sum.kind());
            assertEquals("+", sum.attribute("operator"));
            assertEquals("*", sum.children().get(1).attribute("operator"));
        }

        @Test
        void exponentIsRightAssociative() {
            SyntaxNode power = value("2 ** 3 ** 2");
            assertEquals("**", power.attribute("operator"));
            assertEquals(SyntaxKind.LITERAL_INTEGER, power.children().get(0).kind());
            assertEquals("**", power.children().get(1).attribute("operator"));
        }

        @Test
        void emptySequenceIsNull() {
            assertEquals(SyntaxKind.NULL_EXPRESSION, value("()").kind());
        }

        @Test
        void parenthesizedExpressionIsUnwrapped() {
            assertEquals(SyntaxKind.LITERAL_INTEGER, value("(42)").kind());
        }

        @Test
        void sequenceBecomesCommaOperator() {
            SyntaxNode sequence = value("(1, 2, 3)");
            assertEquals(",", sequence.attribute("operator"));
            assertEquals(3, sequence.children().size());
        }

        @Test
        void multiDimensionalIndexIsOneTupleArgument() {
            SyntaxNode index = value("a#(1, 2)");
            assertEquals("#", index.attribute("operator"));
            assertEquals(2, index.children().size());
            assertEquals(",", index.children().get(1).attribute("operator"));
        }

        @Test
        void conditionalHasThreeOperands() {
            SyntaxNode conditional = value("if true ? 1 else 2");
            assertEquals("if", conditional.attribute("operator"));
            assertEquals(3, conditional.children().size());
        }

        @Test
        void arrowInvocationTakesSourceAsFirstArgument() {
            SyntaxNode invocation = value("(1, 2)->size()");
            assertEquals(SyntaxKind.INVOCATION_EXPRESSION, invocation.kind());
            assertTrue(invocation.hasFlag("arrow"));
            assertEquals(",", invocation.children().get(0).attribute("operator"));
        }

        @Test
        void stringLiteralIsUnquoted() {
            assertEquals("abc", value("\"abc\"").attribute("value"));
        }
    }

    @Nested
    @DisplayName("Errors and notes")
    class ErrorTests {

        @Test
        void parseCollectsErrorsWithoutThrowing() {
            ParseResult result = KerMLParserAdapter.parse("""
                    package P {
                        class A
                    """);
            assertTrue(result.hasErrors());
            assertNotNull(result.root());
        }

        @Test
        void strictParseReportsLocation() {
            KerMLParseException exception = assertThrows(KerMLParseException.class,
                    () -> KerMLParserAdapter.parseStrict("""
                            package P {
                                class A;
                                class B specializes ;
                            }
                            """));
            assertTrue(exception.hasLocation());
            assertEquals(3, exception.getLine());
        }

        @Test
        void notesGoToHiddenChannel() {
            ParseResult result = KerMLParserAdapter.parse("""
                    // leading note
                    class A; //* block note */
                    """);
            assertFalse(result.hasErrors());
            List<Note> notes = result.notes();
            assertEquals(2, notes.size());
            assertEquals("leading note", notes.get(0).text());
            assertFalse(notes.get(0).block());
            assertEquals("block note", notes.get(1).text());
            assertTrue(notes.get(1).block());
        }

        @Test
        void regularCommentIsPartOfTheModel() {
            SyntaxNode root = KerMLParserAdapter.parseStrict("/* a comment */");
            assertEquals(SyntaxKind.COMMENT, only(root).kind());
        }
    }
}
