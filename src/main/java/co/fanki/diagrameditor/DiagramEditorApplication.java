package co.fanki.diagrameditor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Diagram Editor Engine Application.
 *
 * <p>Serves the parsing and editing engine behind the diagram editor.
 * Every request carries the diagram text and every edit answers with the
 * new text; the engine keeps no document state between calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class DiagramEditorApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(DiagramEditorApplication.class, args);
    }

}
