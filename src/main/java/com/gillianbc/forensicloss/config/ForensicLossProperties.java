package com.gillianbc.forensicloss.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings under {@code forensicloss.*} in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "forensicloss")
public class ForensicLossProperties {

    private String tablesLocation = "classpath:tables/";
    // Name of the discount-rate series used when a case has no discount rate override
    private String discountRateSeries = "treasury-1y";
    private String outputDirectory = "cases";

    public String getTablesLocation() {
        return tablesLocation;
    }

    public void setTablesLocation(String tablesLocation) {
        this.tablesLocation = tablesLocation;
    }

    public String getDiscountRateSeries() {
        return discountRateSeries;
    }

    public void setDiscountRateSeries(String discountRateSeries) {
        this.discountRateSeries = discountRateSeries;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }
}
