package co.fanki.tracegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Trace Graph Application.
 *
 * <p>Main entry point for the traceability engine. It loads a tree of
 * requirement documents, builds the item graph and validates it. With
 * {@code tracegraph.check-on-startup=true} the process exits with the
 * result of the check.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class TraceGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(TraceGraphApplication.class, args)));
    }

}
