package com.vestpod;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Module dependency rules: common and domain at the bottom, pricing above them, price update and alerts
 * above pricing, jobs on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.vestpod");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..config..", "..pricing..", "..priceupdate..", "..alert..", "..job..");
        rule.check(classes);
    }

    @Test
    void domain_must_not_depend_on_services() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..config..", "..pricing..", "..priceupdate..", "..alert..", "..job..");
        rule.check(classes);
    }

    @Test
    void pricing_must_not_depend_on_consumers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..pricing..")
                .should().dependOnClassesThat().resideInAnyPackage("..priceupdate..", "..alert..", "..job..");
        rule.check(classes);
    }

    @Test
    void alert_must_not_depend_on_pricing_or_price_update() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..alert..")
                .should().dependOnClassesThat().resideInAnyPackage("..pricing..", "..priceupdate..", "..job..");
        rule.check(classes);
    }

    @Test
    void price_update_must_not_depend_on_alert_or_jobs() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..priceupdate..")
                .should().dependOnClassesThat().resideInAnyPackage("..alert..", "..job..");
        rule.check(classes);
    }

    @Test
    void providers_must_not_depend_on_coordinator_wiring() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..pricing.provider..")
                .should().dependOnClassesThat().resideInAnyPackage("..pricing.config..", "..pricing.budget..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.vestpod.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
