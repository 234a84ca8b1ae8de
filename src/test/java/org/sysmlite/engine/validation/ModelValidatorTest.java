package org.sysmlite.engine.validation;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.Severity;
import org.sysmlite.engine.workspace.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the validation checks, each run on a model built with the
 * bundled standard library.
 */
class ModelValidatorTest extends AbstractModelTest {

    private BuildOptions options = BuildOptions.defaults();

    @Override
    protected BuildOptions options() {
        return options;
    }

    private static List<String> messages(SourceDocument document, String check) {
        return diagnostics(document, check).stream().map(Diagnostic::message).toList();
    }

    @Nested
    @DisplayName("Namespaces")
    class NamespaceTests {

        @Test
        void duplicateNamesAreReportedOnEachMember() {
            SourceDocument document = build("""
                    package P {
                        class A;
                        class A;
                        class B;
                    }
                    """);
            List<Diagnostic> duplicates = diagnostics(document, ModelValidator.NAMESPACE_DISTINGUISHABILITY);
            assertEquals(2, duplicates.size());
            assertEquals("Duplicate of another member named A.", duplicates.get(0).message());
            assertEquals(Severity.WARNING, duplicates.get(0).severity());
        }

        @Test
        void shortNamesTakePartInDistinguishability() {
            SourceDocument document = build("""
                    package P {
                        class <A> Alpha;
                        class A;
                    }
                    """);
            assertEquals(2, diagnostics(document, ModelValidator.NAMESPACE_DISTINGUISHABILITY).size());
        }

        @Test
        void userPackageMustNotBeStandard() {
            SourceDocument document = build("""
                    standard library package Mine;
                    library package Fine;
                    """);
            assertEquals(List.of("User library packages should not be marked as standard."),
                    messages(document, ModelValidator.LIBRARY_PACKAGE_NOT_STANDARD));
        }

        @Test
        void bundledLibraryHasNoStandardPackageErrors() {
            build("package P;");
            workspace.libraryDocuments().forEach(library ->
                    assertEquals(List.of(), diagnostics(library, ModelValidator.LIBRARY_PACKAGE_NOT_STANDARD)));
        }
    }

    @Nested
    @DisplayName("Types")
    class TypeTests {

        @Test
        void specializationCycleIsAnError() {
            SourceDocument document = build("""
                    package P {
                        class A specializes B;
                        class B specializes A;
                    }
                    """);
            List<Diagnostic> cycles = diagnostics(document, ModelValidator.TYPE_SPECIALIZATION_CYCLE);
            assertEquals(2, cycles.size());
            assertEquals("Specialization cycle: P::A -> P::B -> P::A.", cycles.get(0).message());
            assertTrue(cycles.get(0).isError());
        }

        @Test
        void conjugatedTypeCannotSpecialize() {
            SourceDocument document = build("""
                    package P {
                        type Original;
                        type Other;
                        type Conjugate ~ Original specializes Other;
                    }
                    """);
            assertEquals(List.of("Conjugated type cannot be a specialized type."),
                    messages(document, ModelValidator.SPECIALIZATION_SPECIFIC_NOT_CONJUGATED));
        }

        @Test
        void atMostOneConjugator() {
            SourceDocument document = build("""
                    package P {
                        type A;
                        type B;
                        type C ~ A ~ B;
                    }
                    """);
            assertEquals(2, diagnostics(document, ModelValidator.TYPE_AT_MOST_ONE_CONJUGATOR).size());
        }

        @Test
        void dataTypeMustNotSpecializeClass() {
            SourceDocument document = build("""
                    package P {
                        class K;
                        datatype D specializes K;
                    }
                    """);
            assertEquals(List.of("A DataType must not specialize a Class or an Association."),
                    messages(document, ModelValidator.DATATYPE_SPECIALIZATION));
        }

        @Test
        void classMustNotSpecializeDataType() {
            SourceDocument document = build("""
                    package P {
                        datatype D;
                        class K specializes D;
                        struct S specializes D;
                    }
                    """);
            assertEquals(List.of("A Class must not specialize a DataType or an Association.",
                            "A Class must not specialize a DataType or an Association."),
                    messages(document, ModelValidator.CLASS_SPECIALIZATION));
        }

        @Test
        void associationStructureMustNotSpecializeDataType() {
            SourceDocument document = build("""
                    package P {
                        datatype D;
                        assoc struct L specializes D {
                            end feature a;
                            end feature b;
                        }
                    }
                    """);
            assertEquals(List.of("An AssociationStructure must not specialize a DataType."),
                    messages(document, ModelValidator.CLASS_SPECIALIZATION));
        }

        @Test
        void compatibleSpecializationsPass() {
            SourceDocument document = build("""
                    package P {
                        datatype D;
                        datatype E specializes D;
                        class K;
                        struct S specializes K;
                    }
                    """);
            assertEquals(List.of(), diagnostics(document, ModelValidator.DATATYPE_SPECIALIZATION));
            assertEquals(List.of(), diagnostics(document, ModelValidator.CLASS_SPECIALIZATION));
            assertNoErrors(document);
        }
    }

    @Nested
    @DisplayName("Features")
    class FeatureTests {

        @Test
        void multiplicityMustConform() {
            SourceDocument document = build("""
                    package P {
                        class A {
                            feature x [0..2];
                            feature y [1..*];
                        }
                        class B specializes A {
                            feature x2 [0..5] subsets x;
                            :>> y [0..*];
                        }
                    }
                    """);
            assertEquals(List.of("Subsetting feature should not have larger multiplicity upper bound (5) "
                            + "than subsetted feature (2)"),
                    messages(document, ModelValidator.SUBSETTING_MULTIPLICITY_CONFORMANCE));
            assertEquals(List.of("Redefining feature should not have smaller multiplicity lower bound (0) "
                            + "than redefined feature (1)"),
                    messages(document, ModelValidator.REDEFINITION_MULTIPLICITY_CONFORMANCE));
        }

        @Test
        void nonuniqueMustNotSubsetUnique() {
            SourceDocument document = build("""
                    package P {
                        class A {
                            feature x [*];
                        }
                        class B specializes A {
                            feature z [*] nonunique subsets x;
                        }
                    }
                    """);
            assertEquals(List.of("Subsetting feature cannot be nonunique if subsetted feature is unique"),
                    messages(document, ModelValidator.SUBSETTING_UNIQUENESS_CONFORMANCE));
        }

        @Test
        void redefinitionTypeMustConform() {
            SourceDocument document = build("""
                    package P {
                        class T;
                        class U;
                        class V specializes T;
                        class A {
                            feature x : T;
                            feature w : T;
                        }
                        class B specializes A {
                            :>> x : U;
                            :>> w : V;
                        }
                    }
                    """);
            assertEquals(List.of("Redefining feature type should conform to the redefined feature type 'P::T'."),
                    messages(document, ModelValidator.REDEFINITION_TYPE_CONFORMANCE));
        }

        @Test
        void nonDefaultValueCannotBeOverridden() {
            SourceDocument document = build("""
                    package P {
                        class A {
                            feature fixed = 1;
                            feature preset default = 1;
                        }
                        class B specializes A {
                            :>> fixed = 2;
                            :>> preset = 2;
                        }
                    }
                    """);
            assertEquals(List.of("Cannot override a non-default feature value."),
                    messages(document, ModelValidator.FEATURE_VALUE_OVERRIDING));
        }

        @Test
        void failingValueIsReported() {
            SourceDocument document = build("""
                    package P {
                        feature ok = 1 + 1;
                        feature bad = 1 / 0;
                    }
                    """);
            assertEquals(List.of("Feature value could not be evaluated: Cannot divide by 0"),
                    messages(document, ModelValidator.FEATURE_VALUE_EVALUATION));
        }

        @Test
        void unresolvedValueIsLeftToLinking() {
            SourceDocument document = build("package P { feature v = missing + 1; }");
            assertEquals(List.of(), diagnostics(document, ModelValidator.FEATURE_VALUE_EVALUATION));
            assertEquals(1, diagnostics(document, Diagnostic.LINKING_ERROR).size());
        }

        @Test
        void multiplicityBoundsMustBeNaturals() {
            SourceDocument document = build("""
                    package P {
                        feature f [("many")];
                        feature g [(1 + 1)];
                    }
                    """);
            assertEquals(List.of("The results of the bound Expression(s) of a MultiplicityRange must be Naturals."),
                    messages(document, ModelValidator.MULTIPLICITY_RANGE_BOUND_RESULT_TYPES));
        }

        @Test
        void bindingConnectorMustBeBinary() {
            SourceDocument document = build("""
                    package P {
                        feature x;
                        feature y;
                        binding ok of x = y;
                        binding broken;
                    }
                    """);
            assertEquals(List.of("A BindingConnector must be binary."),
                    messages(document, ModelValidator.BINDING_CONNECTOR_IS_BINARY));
        }

        @Test
        void libraryFeaturesProvideTyping() {
            SourceDocument document = build("package P { feature f; }");
            assertEquals(List.of(), diagnostics(document, ModelValidator.FEATURE_TYPING));
        }
    }

    @Nested
    @DisplayName("Feature typing without a complete library")
    class TypingTests {

        @TempDir
        Path libraryDir;

        @Test
        void untypedFeatureIsReported() throws IOException {
            Files.writeString(libraryDir.resolve("Base.kerml"), """
                    standard library package Base {
                        abstract classifier Anything;
                    }
                    """);
            options = BuildOptions.defaults().withLocalLibrary(libraryDir).withIgnoreMetamodelErrors(true);
            SourceDocument document = build("""
                    package P {
                        feature f;
                        feature g : Base::Anything;
                    }
                    """);
            List<Diagnostic> typing = diagnostics(document, ModelValidator.FEATURE_TYPING);
            assertEquals(1, typing.size());
            assertEquals("A Feature must be typed by at least one type.", typing.get(0).message());
            assertSame(find(document, "P::f"), typing.get(0).element());
        }
    }

    @Nested
    @DisplayName("Check selection")
    class SelectionTests {

        private static final String MODEL = """
                package P {
                    class A specializes B;
                    class B specializes A;
                    feature bad = 1 / 0;
                }
                """;

        @Test
        void onlySelectedChecksRun() {
            options = BuildOptions.defaults()
                    .withValidationChecks(ValidationChecks.of(ModelValidator.FEATURE_VALUE_EVALUATION));
            SourceDocument document = build(MODEL);
            assertEquals(1, diagnostics(document, ModelValidator.FEATURE_VALUE_EVALUATION).size());
            assertEquals(List.of(), diagnostics(document, ModelValidator.TYPE_SPECIALIZATION_CYCLE));
        }

        @Test
        void noChecksRunWhenDisabled() {
            options = BuildOptions.defaults().withValidationChecks(ValidationChecks.NONE);
            SourceDocument document = build(MODEL);
            assertTrue(document.diagnostics().stream().noneMatch(d -> ModelValidator.CHECK_NAMES.contains(d.code())));
        }

        @Test
        void validatorIgnoresMissingRoot() {
            ModelValidator validator = new ModelValidator(BuildOptions.defaults(), workspace.evaluator());
            assertEquals(List.of(), validator.validate(null));
        }
    }
}
