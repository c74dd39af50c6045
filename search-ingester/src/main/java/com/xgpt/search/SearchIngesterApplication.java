package com.xgpt.search;

import com.xgpt.search.cli.SearchCommandLineRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SearchIngesterApplication {

    /** Routes console logging to stderr and quietens it, see logback-spring.xml. */
    static final String JSON_OUTPUT_PROFILE = "json-output";

    public static void main(String[] args) {
        SpringApplication application = create(args);
        if (SearchCommandLineRunner.isSearchCommand(args)) {
            // One-shot command: exit with the command's status.
            ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        }
        application.run(args);
    }

    static SpringApplication create(String[] args) {
        SpringApplication application = new SpringApplication(SearchIngesterApplication.class);
        if (SearchCommandLineRunner.isSearchCommand(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            if (SearchCommandLineRunner.isJsonOutput(args)) {
                // stdout carries the result object and nothing else
                application.setBannerMode(Banner.Mode.OFF);
                application.setAdditionalProfiles(JSON_OUTPUT_PROFILE);
            }
        }
        return application;
    }
}
