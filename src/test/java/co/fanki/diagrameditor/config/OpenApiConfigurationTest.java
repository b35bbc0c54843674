package co.fanki.diagrameditor.config;

import io.swagger.v3.oas.models.OpenAPI;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link OpenApiConfiguration}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class OpenApiConfigurationTest {

    @Test
    void whenDescribingApi_givenPortAndName_shouldUseThem() {
        final OpenApiConfiguration configuration = new OpenApiConfiguration();
        ReflectionTestUtils.setField(configuration, "serverPort", 9090);
        ReflectionTestUtils.setField(configuration, "applicationName",
                "diagram-editor-engine");

        final OpenAPI api = configuration.openAPI();

        assertEquals("diagram-editor-engine API", api.getInfo().getTitle());
        assertEquals("http://localhost:9090", api.getServers().get(0).getUrl());
    }

}
