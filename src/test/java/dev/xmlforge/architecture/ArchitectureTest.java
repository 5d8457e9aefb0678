package dev.xmlforge.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;
import static org.assertj.core.api.Assertions.assertThat;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ArchitectureTest {

  private static JavaClasses classes;

  @BeforeAll
  static void importClasses() {
    classes =
        new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("dev.xmlforge");
  }

  // Feature packages should not depend on the MCP adapter
  private static final ArchRule features_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAnyPackage("..tree..", "..source..", "..split..", "..hierarchy..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..mcp..");

  // The split and hierarchy pipelines share only the tree model
  private static final ArchRule pipelines_should_be_independent =
      noClasses()
          .that()
          .resideInAPackage("..hierarchy..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..split..", "..source..");

  private static final ArchRule split_should_not_depend_on_hierarchy =
      noClasses()
          .that()
          .resideInAnyPackage("..split..", "..source..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..hierarchy..");

  // The tree model and the exceptions sit at the bottom
  private static final ArchRule tree_should_not_depend_on_pipelines =
      noClasses()
          .that()
          .resideInAnyPackage("..tree..", "..exception..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..source..", "..split..", "..hierarchy..");

  // No cyclic dependencies between top-level packages
  private static final ArchRule no_package_cycles =
      slices().matching("dev.xmlforge.(*)..").should().beFreeOfCycles();

  @Test
  void featuresDoNotDependOnAdapters() {
    features_should_not_depend_on_adapters.check(classes);
  }

  @Test
  void hierarchyIsIndependentOfSplitting() {
    pipelines_should_be_independent.check(classes);
  }

  @Test
  void splittingIsIndependentOfHierarchy() {
    split_should_not_depend_on_hierarchy.check(classes);
  }

  @Test
  void treeModelDoesNotDependOnPipelines() {
    tree_should_not_depend_on_pipelines.check(classes);
  }

  @Test
  void packagesAreFreeOfCycles() {
    no_package_cycles.check(classes);
  }

  @Test
  void importsTheProductionClasses() {
    assertThat(classes.containPackage("dev.xmlforge.tree")).isTrue();
    assertThat(classes.containPackage("dev.xmlforge.hierarchy")).isTrue();
  }
}
