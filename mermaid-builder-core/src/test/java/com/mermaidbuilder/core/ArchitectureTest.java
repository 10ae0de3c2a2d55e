package com.mermaidbuilder.core;

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
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model layer depends on nothing else in the project</li>
 *   <li>The graph protocol does not know about dialect builders or renderers</li>
 *   <li>Base classes don't depend on implementations</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.mermaidbuilder.core");
    }

    /**
     * Verifies all descriptors in the model package are implemented as Java records.
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

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "com.mermaidbuilder.core.graph..",
                "com.mermaidbuilder.core.builder..",
                "com.mermaidbuilder.core.renderer..",
                "com.mermaidbuilder.core.config..",
                "com.mermaidbuilder.core.util..");

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnBuildersOrRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.mermaidbuilder.core.builder..",
                "com.mermaidbuilder.core.renderer..",
                "com.mermaidbuilder.core.config..");

        rule.check(classes);
    }

    @Test
    void baseRenderers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer.base..")
            .should().dependOnClassesThat().resideInAPackage("..renderer.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay low-level and reusable.
     */
    @Test
    void utilClasses_shouldNotDependOnRenderersOrGraph() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.mermaidbuilder.core.renderer..",
                "com.mermaidbuilder.core.graph..");

        rule.check(classes);
    }
}
