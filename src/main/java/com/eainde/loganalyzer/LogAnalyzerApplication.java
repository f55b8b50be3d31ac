package com.eainde.loganalyzer;

import com.eainde.loganalyzer.workflow.AnalysisResult;
import com.eainde.loganalyzer.workflow.LogAnalysisEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@SpringBootApplication
public class LogAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogAnalyzerApplication.class, args);
    }

    /** Runs one analysis at startup when {@code loganalyzer.inputs} lists any files. */
    @Bean
    public ApplicationRunner analyzeOnStartup(LogAnalysisEngine engine,
                                              @Value("${loganalyzer.inputs:}") List<String> inputs) {
        return args -> {
            List<Path> paths = inputs.stream()
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .map(Path::of)
                    .collect(Collectors.toList());
            if (paths.isEmpty()) {
                log.info("No loganalyzer.inputs configured, nothing to analyze");
                return;
            }
            AnalysisResult result = engine.analyze(paths);
            log.info("Wrote {} and {}", result.jsonPath(), result.markdownPath());
            if (!result.newSignatures().isEmpty()) {
                log.info("New error signatures today: {}", result.newSignatures());
            }
        };
    }
}
