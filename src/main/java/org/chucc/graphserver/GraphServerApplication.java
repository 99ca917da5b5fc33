package org.chucc.graphserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the versioned property graph server.
 */
@SpringBootApplication
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class GraphServerApplication {

  /**
   * Application entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(GraphServerApplication.class, args);
  }
}
