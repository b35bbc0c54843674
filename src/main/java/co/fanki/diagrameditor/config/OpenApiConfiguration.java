package co.fanki.diagrameditor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger description of the editor endpoints.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${spring.application.name:diagram-editor-engine}")
    private String applicationName;

    /**
     * Describes the API.
     *
     * @return the OpenAPI description
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName + " API")
                        .description("""
                                Parses and edits diagram markup while keeping the author's text intact.

                                ## Features
                                - **Flowcharts**: nodes, edges, shapes, arrows, groups and style overlays
                                - **Dialects**: class, entity relationship, state and sequence diagrams \
                                through one adapter contract; pie, mindmap, timeline, context, git graph \
                                and quadrant charts for reading and appending
                                - **Gantt**: dependency resolution, cycles, slack, critical path, \
                                conflicts and risk flags, plus task and section edits

                                Every request carries the full diagram text. Edits answer with the new \
                                text and whether it changed.
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
