package com.cfclient;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: request building, signing, transport and decoding stay independent of the
 * client facade and of Spring configuration.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.cfclient");
    }

    @Test
    void domain_must_not_depend_on_other_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.cfclient.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.cfclient.common..", "com.cfclient.endpoint..",
                        "com.cfclient.auth..", "com.cfclient.transport..", "com.cfclient.decode..",
                        "com.cfclient.client..", "com.cfclient.config..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.cfclient.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.cfclient.domain..", "com.cfclient.endpoint..",
                        "com.cfclient.auth..", "com.cfclient.transport..", "com.cfclient.decode..",
                        "com.cfclient.client..", "com.cfclient.config..");
        rule.check(classes);
    }

    @Test
    void endpoint_must_stay_pure() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.cfclient.endpoint..")
                .should().dependOnClassesThat().resideInAnyPackage("com.cfclient.auth..", "com.cfclient.transport..",
                        "com.cfclient.decode..", "com.cfclient.client..", "com.cfclient.config..",
                        "org.springframework..", "reactor..");
        rule.check(classes);
    }

    @Test
    void auth_must_not_do_io() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.cfclient.auth..")
                .should().dependOnClassesThat().resideInAnyPackage("com.cfclient.transport..", "com.cfclient.decode..",
                        "com.cfclient.client..", "com.cfclient.config..", "org.springframework..", "reactor..");
        rule.check(classes);
    }

    @Test
    void transport_and_decode_must_not_depend_on_client_or_config() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.cfclient.transport..", "com.cfclient.decode..")
                .should().dependOnClassesThat().resideInAnyPackage("com.cfclient.client..", "com.cfclient.config..",
                        "com.cfclient.auth..");
        rule.check(classes);
    }

    @Test
    void client_must_not_depend_on_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.cfclient.client..")
                .should().dependOnClassesThat().resideInAPackage("com.cfclient.config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.cfclient.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
