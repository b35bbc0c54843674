package co.fanki.diagrameditor.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link HealthController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthControllerTest {

    @Test
    void whenCheckingHealth_shouldAnswerUp() {
        assertEquals("up", new HealthController().health());
    }

}
