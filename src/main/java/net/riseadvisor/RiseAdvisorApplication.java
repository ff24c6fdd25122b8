/**
 * Main application class for the RISE farming advisor image gate
 *
 * Features:
 * - Exposes the image quality gate used before multimodal crop, pest and soil analysis
 * - Loads an optional .env file into system properties before Spring starts
 * - Entry point for Spring Boot application
 */

package net.riseadvisor;

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

@SpringBootApplication
public class RiseAdvisorApplication {

    private static final Logger log = LoggerFactory.getLogger(RiseAdvisorApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(RiseAdvisorApplication.class, args);
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (!Files.exists(envFile)) {
                return;
            }
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            // Environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
            log.info("Loaded {} entries from .env", props.size());
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
