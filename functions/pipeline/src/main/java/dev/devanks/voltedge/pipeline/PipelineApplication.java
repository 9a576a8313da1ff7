package dev.devanks.voltedge.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. Deployed as a Cloud Function, GcfJarLauncher invokes the bean named by
 * {@code spring.cloud.function.definition} through the Spring Cloud Function catalog.
 */
@SpringBootApplication
public class PipelineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}
