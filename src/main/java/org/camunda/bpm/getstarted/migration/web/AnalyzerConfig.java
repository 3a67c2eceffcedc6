package org.camunda.bpm.getstarted.migration.web;

import org.camunda.bpm.getstarted.migration.analysis.BpmnMigrationAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyzerConfig {

    @Bean
    public BpmnMigrationAnalyzer bpmnMigrationAnalyzer() {
        return new BpmnMigrationAnalyzer();
    }
}
