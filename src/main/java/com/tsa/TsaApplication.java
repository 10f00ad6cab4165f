package com.tsa;

import com.tsa.adapter.spring.TsaProperties;
import com.tsa.collection.AnalysisRunner;
import com.tsa.collection.ConditionCollection;
import com.tsa.config.AnalysisConfig;
import com.tsa.result.ReportWriter;
import com.tsa.spring.EnableTsa;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the configured analysis and writes its report.
 * <p>
 * Example: {@code --tsa.config-path=analysis.yaml --tsa.intervals-path=intervals.json --tsa.report-path=out/report.json}
 */
@SpringBootApplication
@EnableTsa
public class TsaApplication {

    private static final Logger log = LoggerFactory.getLogger(TsaApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TsaApplication.class, args);
    }

    @Bean
    public CommandLineRunner analysis(AnalysisRunner runner, AnalysisConfig config,
                                      ReportWriter reportWriter, TsaProperties properties) {
        return args -> {
            List<ConditionCollection> collections = runner.run(config, properties.isDryValidate());

            String reportPath = properties.getReportPath();
            if (reportPath != null && !reportPath.isBlank()) {
                reportWriter.write(Path.of(reportPath), config.name(), collections);
            } else {
                log.info("No report path configured, report not written");
                log.debug("Report:\n{}", reportWriter.toJson(config.name(), collections));
            }
        };
    }
}
