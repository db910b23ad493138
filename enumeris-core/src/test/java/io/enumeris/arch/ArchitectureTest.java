package io.enumeris.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void kernelShouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.enumeris.kernel..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.enumeris.core..", "io.enumeris.registry..");
        rule.check(importedMainClasses());
    }

    @Test
    void coreShouldNotDependOnRegistry() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.enumeris.core..")
                .should().dependOnClassesThat().resideInAPackage("io.enumeris.registry..");
        rule.check(importedMainClasses());
    }

    @Test
    void kernelShouldNotLog() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.enumeris.kernel..")
                .should().dependOnClassesThat().resideInAPackage("org.slf4j..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat()
                .resideInAnyPackage("..testutil..", "io.enumeris.logging..", "org.junit..", "org.assertj..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.enumeris..");
    }
}
