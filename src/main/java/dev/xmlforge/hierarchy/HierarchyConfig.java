package dev.xmlforge.hierarchy;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the {@link IdGenerator} used by {@link HierarchyLinearizer}. */
@Configuration
public class HierarchyConfig {

  @Bean
  @ConditionalOnMissingBean
  public IdGenerator idGenerator(HierarchyProperties properties) {
    return new RandomIdGenerator(properties.idLength());
  }
}
