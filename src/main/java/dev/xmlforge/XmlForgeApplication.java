package dev.xmlforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the xmlforge application.
 *
 * <p>Supports two Spring profiles: the default one (MCP stdio transport, no web server) and
 * {@code web} (MCP SSE on port 8080).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class XmlForgeApplication {
  public static void main(String[] args) {
    SpringApplication.run(XmlForgeApplication.class, args);
  }
}
