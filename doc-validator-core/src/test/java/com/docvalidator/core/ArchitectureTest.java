package com.docvalidator.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records with no service dependencies</li>
 *   <li>Rule implementations extend the rule base class</li>
 *   <li>Pipeline stages do not reach back into the engine</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docvalidator.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beAssignableTo(Record.class);

        rule.check(classes);
    }

    /**
     * Verifies the model layer depends on nothing but itself and the JDK.
     */
    @Test
    void models_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..terminology..", "..crossref..", "..rules..", "..engine..", "..report..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies every rule implementation goes through the common base class.
     */
    @Test
    void rules_shouldExtendAbstractValidationRule() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rules.impl..")
            .and().areTopLevelClasses()
            .should().beAssignableTo("com.docvalidator.core.rules.AbstractValidationRule");

        rule.check(classes);
    }

    /**
     * Verifies pipeline stages never depend on the engine that orchestrates them.
     */
    @Test
    void pipelineStages_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..parser..", "..terminology..", "..crossref..", "..rules..")
            .should().dependOnClassesThat().resideInAPackage("..core.engine..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay free of domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage("..model..", "..engine..", "..rules..");

        rule.check(classes);
    }
}
