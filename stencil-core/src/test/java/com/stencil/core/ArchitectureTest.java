package com.stencil.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate package dependencies of the compiler core.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The node model depends on no other core package</li>
 *   <li>The renderer works on the model alone, without I/O or configuration</li>
 *   <li>Model types are immutable records</li>
 *   <li>Output writers are registered through the SPI interface</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.stencil.core");
    }

    @Test
    void model_shouldNotDependOnOtherCorePackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.renderer..", "..core.io..", "..core.output..", "..core.config..", "..core.util..");

        rule.check(classes);
    }

    @Test
    void renderer_shouldNotDependOnIoOutputOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.io..", "..core.output..", "..core.config..");

        rule.check(classes);
    }

    /**
     * Model classes carry no serialization annotations; the node-tree reader decodes them by hand.
     */
    @Test
    void model_shouldNotDependOnJackson() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat()
            .resideInAPackage("com.fasterxml.jackson..");

        rule.check(classes);
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void writers_shouldImplementOutputWriter() {
        ArchRule rule = classes()
            .that().resideInAPackage("..output.impl..")
            .and().haveSimpleNameEndingWith("Writer")
            .should().implement("com.stencil.core.output.OutputWriter");

        rule.check(classes);
    }

    @Test
    void utilities_shouldNotDependOnOtherCorePackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.model..", "..core.renderer..", "..core.io..", "..core.output..", "..core.config..");

        rule.check(classes);
    }
}
