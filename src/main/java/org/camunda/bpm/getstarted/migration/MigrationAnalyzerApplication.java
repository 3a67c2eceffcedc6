package org.camunda.bpm.getstarted.migration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web entry point exposing the analyzer over HTTP. The command line tool is {@link Main}.
 */
@SpringBootApplication
public class MigrationAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MigrationAnalyzerApplication.class, args);
    }
}
