package org.sysmlite.kerml.m3;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.workspace.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the metamodel element layer, built from text without a standard
 * library so that only written relationships are present.
 */
class MetamodelTest extends AbstractModelTest {

    @Override
    protected BuildOptions options() {
        return withoutLibrary();
    }

    @Nested
    @DisplayName("Names and ownership")
    class OwnershipTests {

        @Test
        void qualifiedNameFollowsOwningNamespaces() {
            SourceDocument document = build("""
                    package Vehicles {
                        class Car {
                            feature wheels;
                        }
                    }
                    """);
            Feature wheels = find(document, "Vehicles::Car::wheels", Feature.class);
            assertEquals("Vehicles::Car::wheels", wheels.qualifiedName());
            assertEquals(find(document, "Vehicles::Car"), wheels.owningType());
        }

        @Test
        void nonIdentifierNamesAreQuoted() {
            SourceDocument document = build("""
                    package Ops {
                        function '+';
                        class 'two words';
                    }
                    """);
            assertEquals("Ops::'+'", find(document, "Ops::+").qualifiedName());
            assertEquals("Ops::'two words'", find(document, "Ops::two words").qualifiedName());
        }

        @Test
        void shortNameIsAlsoAMemberName() {
            SourceDocument document = build("package P { class <V> Vehicle; }");
            assertSame(find(document, "P::Vehicle"), find(document, "P::V"));
        }

        @Test
        void unnamedRedefinitionTakesRedefinedName() {
            SourceDocument document = build("""
                    package P {
                        class A { feature x; }
                        class B specializes A { :>> x; }
                    }
                    """);
            Type b = find(document, "P::B", Type.class);
            Feature redefining = b.ownedFeatures().get(0);
            assertNull(redefining.name());
            assertEquals("x", redefining.effectiveName());
        }

        @Test
        void elementCannotHaveTwoOwners() {
            SourceDocument document = build("package P { class A; class B; }");
            Type a = find(document, "P::A", Type.class);
            Type b = find(document, "P::B", Type.class);
            assertThrows(IllegalStateException.class, () -> b.addChild(ChildRole.MEMBER_ELEMENT, a));
        }

        @Test
        void ownershipCycleIsRejected() {
            SourceDocument document = build("package P { class A; }");
            Element pkg = find(document, "P");
            Type a = find(document, "P::A", Type.class);
            pkg.parent().removeChild(pkg);
            assertThrows(IllegalStateException.class, () -> a.addChild(ChildRole.MEMBER_ELEMENT, pkg));
        }

        @Test
        void descendantsAreInDocumentOrder() {
            SourceDocument document = build("package P { class A; class B; }");
            List<Element> named = document.root().descendants().stream()
                    .filter(e -> e.name() != null)
                    .toList();
            assertEquals(List.of("P", "A", "B"), named.stream().map(Element::name).toList());
        }
    }

    @Nested
    @DisplayName("Specialization closure")
    class ClosureTests {

        @Test
        void allTypesIsTransitive() {
            SourceDocument document = build("""
                    package P {
                        class A;
                        class B specializes A;
                        class C specializes B;
                    }
                    """);
            Type a = find(document, "P::A", Type.class);
            Type b = find(document, "P::B", Type.class);
            Type c = find(document, "P::C", Type.class);
            assertEquals(List.of(c, b, a), c.allTypes());
            assertTrue(c.specializes(a));
            assertFalse(a.specializes(c));
            assertFalse(a.specializes(a));
            assertTrue(a.conforms(a));
            assertTrue(c.conforms("P::A"));
        }

        @Test
        void cyclicSpecializationTerminates() {
            SourceDocument document = build("""
                    package P {
                        class A specializes B;
                        class B specializes A;
                    }
                    """);
            Type a = find(document, "P::A", Type.class);
            Type b = find(document, "P::B", Type.class);
            assertEquals(List.of(a, b), a.allTypes());
            assertEquals(List.of(b, a), b.allTypes());
            assertEquals(1, a.allSpecializations().size());
        }

        @Test
        void standaloneSpecializationIsAddedToItsSource() {
            SourceDocument document = build("""
                    package P {
                        class A;
                        class B;
                        specialization Gen subtype B specializes A;
                    }
                    """);
            Type b = find(document, "P::B", Type.class);
            assertTrue(b.specializes(find(document, "P::A", Type.class)));
        }

        @Test
        void conjugatedTypeInheritsFromItsOriginal() {
            SourceDocument document = build("""
                    package P {
                        class Original { feature x; }
                        class Conjugate ~ Original;
                    }
                    """);
            Type conjugate = find(document, "P::Conjugate", Type.class);
            assertTrue(conjugate.isConjugated());
            assertEquals(List.of("x"), conjugate.allFeatures().stream().map(Feature::name).toList());
        }

        @Test
        void typingContributesToFeatureTypes() {
            SourceDocument document = build("""
                    package P {
                        class Wheel;
                        class Car {
                            feature wheels : Wheel [4];
                            feature spare subsets wheels;
                        }
                    }
                    """);
            Type wheel = find(document, "P::Wheel", Type.class);
            Feature spare = find(document, "P::Car::spare", Feature.class);
            assertEquals(List.of(), spare.typings());
            assertEquals(List.of(wheel), spare.allTypings());
        }
    }

    @Nested
    @DisplayName("Features")
    class FeatureTests {

        @Test
        void redefinedFeaturesAreHidden() {
            SourceDocument document = build("""
                    package P {
                        class A { feature x; feature y; }
                        class B specializes A { feature x2 redefines x; }
                    }
                    """);
            Type b = find(document, "P::B", Type.class);
            assertEquals(List.of("x2", "y"), b.allFeatures().stream().map(Feature::name).toList());
        }

        @Test
        void redefinitionShadowsNameWithoutResolving() {
            SourceDocument document = build("""
                    package P {
                        class A { feature x; }
                        class B specializes A { :>> x; }
                    }
                    """);
            Namespace b = find(document, "P::B", Namespace.class);
            assertTrue(b.redefinitionShadows().containsKey("x"));
        }

        @Test
        void parameterMembershipImpliesDirection() {
            SourceDocument document = build("""
                    package P {
                        function f { in a; out b; feature c; }
                    }
                    """);
            assertEquals(FeatureDirection.IN, find(document, "P::f::a", Feature.class).direction());
            assertEquals(FeatureDirection.OUT, find(document, "P::f::b", Feature.class).direction());
            assertEquals(FeatureDirection.NONE, find(document, "P::f::c", Feature.class).direction());
        }

        @Test
        void modifiersAreRecorded() {
            SourceDocument document = build("""
                    package P {
                        class A { readonly derived feature x [0..*] ordered nonunique; }
                    }
                    """);
            Feature x = find(document, "P::A::x", Feature.class);
            assertTrue(x.isReadonly());
            assertTrue(x.isDerived());
            assertTrue(x.isOrdered());
            assertFalse(x.isUnique());
        }

        @Test
        void featureValueKinds() {
            SourceDocument document = build("""
                    package P {
                        feature a = 1;
                        feature b default = 2;
                        feature c := 3;
                        feature d;
                    }
                    """);
            assertFalse(find(document, "P::a", Feature.class).valueMembership().isDefault());
            assertTrue(find(document, "P::b", Feature.class).valueMembership().isDefault());
            assertTrue(find(document, "P::c", Feature.class).valueMembership().isInitial());
            assertNull(find(document, "P::d", Feature.class).value());
        }

        @Test
        void binaryConnectorHasTwoRelatedFeatures() {
            SourceDocument document = build("""
                    package P {
                        class A {
                            feature left;
                            feature right;
                            connector link from left to right;
                        }
                    }
                    """);
            Connector connector = find(document, "P::A::link", Connector.class);
            assertTrue(connector.isBinary());
            assertEquals(List.of(find(document, "P::A::left"), find(document, "P::A::right")),
                    connector.relatedFeatures());
        }
    }

    @Nested
    @DisplayName("Multiplicity")
    class MultiplicityTests {

        @ParameterizedTest
        @CsvSource({
                "[1],        [1]",
                "[*],        [*]",
                "[0..*],     [*]",
                "[2..5],     [2..5]",
                "[1..*],     [1..*]",
        })
        void boundsAreEvaluated(String written, String expected) {
            SourceDocument document = build("package P { feature x " + written + "; }");
            MultiplicityRange multiplicity = find(document, "P::x", Feature.class).multiplicity();
            assertNotNull(multiplicity.bounds(), () -> multiplicity.boundsError());
            assertEquals(expected, multiplicity.bounds().toString());
        }

        @Test
        void boundsFromFeatureValue() {
            SourceDocument document = build("""
                    package P {
                        feature n = 3;
                        feature x [n];
                    }
                    """);
            assertEquals(new Bounds(3, 3L), find(document, "P::x", Feature.class).multiplicity().bounds());
        }

        @Test
        void invertedBoundsAreAnError() {
            SourceDocument document = build("package P { feature x [5..2]; }");
            MultiplicityRange multiplicity = find(document, "P::x", Feature.class).multiplicity();
            assertNull(multiplicity.bounds());
            assertEquals("Upper bound 2 is less than lower bound 5", multiplicity.boundsError());
        }

        @Test
        void boundsWithin() {
            assertTrue(new Bounds(1, 2L).within(Bounds.MANY));
            assertFalse(Bounds.MANY.within(new Bounds(0, 5L)));
            assertThrows(IllegalArgumentException.class, () -> new Bounds(-1, null));
        }
    }

    @Nested
    @DisplayName("Relationship kinds")
    class RelationshipKindTests {

        @Test
        void subkindsAnswerForTheirParents() {
            assertTrue(RelationshipKind.REDEFINITION.isKind(RelationshipKind.SUBSETTING));
            assertTrue(RelationshipKind.REDEFINITION.isKind(RelationshipKind.SPECIALIZATION));
            assertFalse(RelationshipKind.SUBSETTING.isKind(RelationshipKind.REDEFINITION));
            assertTrue(RelationshipKind.CONJUGATION.isHeritage());
            assertFalse(RelationshipKind.DISJOINING.isHeritage());
        }

        @Test
        void elementKindsHaveMultipleParents() {
            assertTrue(ElementKind.CONNECTION_USAGE.isKind(ElementKind.CONNECTOR));
            assertTrue(ElementKind.CONNECTION_USAGE.isKind(ElementKind.PART_USAGE));
            assertFalse(ElementKind.PART_USAGE.isKind(ElementKind.CONNECTOR));
        }
    }
}
