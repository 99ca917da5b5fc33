package org.chucc.graphserver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the graph API.
 */
@Configuration
public class OpenApiConfig {

  /**
   * Configures the OpenAPI specification.
   *
   * @return the configured OpenAPI instance
   */
  @Bean
  public OpenAPI customOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title("Versioned Property Graph API")
            .description("""
                **Versioned property graph with branch isolation**

                Objects (typed nodes) and relationships (typed directed edges) are versioned: \
                every write creates an immutable version (`id`) of a stable entity \
                (`canonical_id`). Versions form a chain through `supersedes_id`.

                ## Branches

                - Writes carry an optional `branch_id`; absent means `main`.
                - A branch sees its parent's entities until it writes its own version.
                - `POST /api/graph/branches/{targetBranchId}/merge` classifies every entity \
                as `unchanged`, `added`, `fast_forward` or `conflict`, and applies the \
                non-conflicting ones when `execute=true`.

                ## Concurrency

                - `If-Match: <version id>` on PATCH/DELETE/restore fails with \
                `409 version_conflict` when the head moved.
                - Keys are unique per (type, branch); a duplicate create fails with \
                `409 key_conflict`.

                ## Error Handling

                All errors use RFC 7807 `application/problem+json` with a machine-readable \
                `code`.
                """)
            .version("1.0.0")
            .license(new License()
                .name("Apache 2.0")
                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
        .addServersItem(new Server()
            .url("http://localhost:8080")
            .description("Development server"));
  }
}
