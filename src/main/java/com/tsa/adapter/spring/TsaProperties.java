package com.tsa.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for condition analysis.
 */
@ConfigurationProperties(prefix = "tsa")
public class TsaProperties {

    /**
     * Whether analysis beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the analysis definition file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:tsa-analysis.yaml";

    /**
     * Path to a JSON file of block intervals; blank for no interval data.
     */
    private String intervalsPath = "";

    /**
     * Where to write the JSON report; blank to skip it.
     */
    private String reportPath = "";

    /**
     * Only compile and cross-check conditions, without analyzing intervals.
     */
    private boolean dryValidate = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getIntervalsPath() {
        return intervalsPath;
    }

    public void setIntervalsPath(String intervalsPath) {
        this.intervalsPath = intervalsPath;
    }

    public String getReportPath() {
        return reportPath;
    }

    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }

    public boolean isDryValidate() {
        return dryValidate;
    }

    public void setDryValidate(boolean dryValidate) {
        this.dryValidate = dryValidate;
    }
}
