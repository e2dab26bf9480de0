package com.mathtex.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Formula nodes are implemented as immutable records</li>
 *   <li>The node model stays independent of conversion and I/O</li>
 *   <li>The markup writer does not know about delimiters, documents or configuration</li>
 *   <li>Conversion failures are checked exceptions</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.mathtex.core");
    }

    /**
     * Verifies all formula nodes in the model package are implemented as Java records.
     * The node interface and its visitor are the only exceptions.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on conversion, reading or configuration.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..texify..", "..generator..", "..reader..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies the symbol table is usable without the markup writer.
     */
    @Test
    void symbols_shouldNotDependOnConversion() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..symbol..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..texify..", "..generator..", "..reader..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies the markup writer only produces bare markup.
     */
    @Test
    void texify_shouldNotDependOnOuterLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..texify..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..generator..", "..reader..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies conversion failures are checked exceptions callers must handle.
     */
    @Test
    void errors_shouldBeCheckedExceptions() {
        ArchRule rule = classes()
            .that().resideInAPackage("..error..")
            .should().beAssignableTo(Exception.class)
            .andShould().notBeAssignableTo(RuntimeException.class);

        rule.check(classes);
    }
}
