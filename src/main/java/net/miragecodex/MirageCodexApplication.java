/**
 * Main application class for MirageCodex
 *
 * Features:
 * - Loads a local .env file into system properties before the context starts
 * - Serves the search-and-generate API over Spring MVC
 * - Schedules the sweep of expired credit holds
 * - Leaves schema management to db/schema.sql (no automatic SQL initialization)
 */

package net.miragecodex;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MirageCodexApplication {

    private static final Logger log = LoggerFactory.getLogger(MirageCodexApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(MirageCodexApplication.class, args);
    }

    /**
     * Copies entries of a dotenv file into system properties unless the
     * same key is already present in the process environment.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
