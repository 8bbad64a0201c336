package io.waypoint.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module: layering between matcher, pipeline and router, and no
 * dependency on host adapters or on a logging backend.
 */
@AnalyzeClasses(
        packages = "io.waypoint.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule routerIsTheCompositionRoot = noClasses()
            .that()
            .resideOutsideOfPackage("io.waypoint.core.router..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.waypoint.core.router..")
            .because("only the router composes the matcher and the navigation pipeline");

    @ArchTest
    static final ArchRule matchingLayersStayIndependent = classes()
            .that()
            .resideInAnyPackage("io.waypoint.core.pattern..", "io.waypoint.core.cache..")
            .should()
            .onlyDependOnClassesThat()
            .resideInAnyPackage(
                    "io.waypoint.core.pattern..", "io.waypoint.core.cache..", "io.waypoint.core.error..", "java..")
            .because("pattern compilation and caching know nothing about navigation");

    @ArchTest
    static final ArchRule noAdapterDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.waypoint.standalone..")
            .because("the core must stay independent of host adapters");

    @ArchTest
    static final ArchRule noLoggingBackend = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("the core logs through the SLF4J API only");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");
}
