package co.fanki.diagrameditor.config;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for the editor host. The engine has no backing
 * store, so being able to answer is being healthy.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    /** Answered while the engine is running. */
    static final String UP = "up";

    /**
     * Returns health status.
     *
     * @return {@value #UP}
     */
    @GetMapping("/health")
    public String health() {
        return UP;
    }

}
