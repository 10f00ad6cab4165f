package com.tsa.adapter.spring;

import com.tsa.collection.AnalysisRunner;
import com.tsa.config.AnalysisConfig;
import com.tsa.config.ConfigLoader;
import com.tsa.interval.InMemoryIntervalSource;
import com.tsa.interval.IntervalSource;
import com.tsa.interval.JsonIntervalSource;
import com.tsa.result.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for condition analysis.
 */
@Configuration
@ConditionalOnProperty(prefix = "tsa", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TsaProperties.class)
public class TsaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TsaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AnalysisConfig analysisConfig(TsaProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public IntervalSource intervalSource(TsaProperties properties) {
        String path = properties.getIntervalsPath();
        if (path == null || path.isBlank()) {
            log.warn("No interval data configured, every block will be without data");
            return new InMemoryIntervalSource();
        }
        return JsonIntervalSource.load(path);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisRunner analysisRunner(IntervalSource intervalSource) {
        log.info("Creating AnalysisRunner with {}", intervalSource.getClass().getSimpleName());
        return new AnalysisRunner(intervalSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportWriter reportWriter() {
        return new ReportWriter();
    }
}
