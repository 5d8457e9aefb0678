package dev.xmlforge.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class HierarchyPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfig.class);

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          HierarchyOptions options =
              context.getBean(HierarchyProperties.class).toOptions("Product");
          assertThat(options.idAttr()).isEqualTo("id");
          assertThat(options.parentAttr()).isEqualTo("parent_id");
          assertThat(options.rootTag()).isEqualTo("root");
          assertThat(options.orphanPolicy()).isEqualTo(OrphanPolicy.DROP);
          assertThat(options.duplicateIdPolicy()).isEqualTo(DuplicateIdPolicy.LAST_WINS);
          assertThat(context.getBean(HierarchyProperties.class).containerTag())
              .isEqualTo("flattened");
        });
  }

  @Test
  void idGeneratorUsesTheConfiguredLength() {
    contextRunner
        .withPropertyValues("xmlforge.hierarchy.id-length=12")
        .run(context -> assertThat(context.getBean(IdGenerator.class).nextId()).hasSize(12));
  }

  @Test
  void bindsPolicies() {
    contextRunner
        .withPropertyValues(
            "xmlforge.hierarchy.orphan-policy=FAIL",
            "xmlforge.hierarchy.duplicate-id-policy=FAIL",
            "xmlforge.hierarchy.parent-attr=parentRef")
        .run(
            context -> {
              HierarchyOptions options =
                  context.getBean(HierarchyProperties.class).toOptions("Product");
              assertThat(options.orphanPolicy()).isEqualTo(OrphanPolicy.FAIL);
              assertThat(options.duplicateIdPolicy()).isEqualTo(DuplicateIdPolicy.FAIL);
              assertThat(options.parentAttr()).isEqualTo("parentRef");
            });
  }

  @Test
  void rejectsIdLengthBelowFour() {
    contextRunner
        .withPropertyValues("xmlforge.hierarchy.id-length=2")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties(HierarchyProperties.class)
  @Import(HierarchyConfig.class)
  static class TestConfig {}
}
