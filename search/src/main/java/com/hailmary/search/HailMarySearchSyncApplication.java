package com.hailmary.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HailMary search sync service.
 *
 * <p>Polls the {@code "Company"} and {@code "Prospect"} tables and the
 * {@code company_prospect_view} materialized view, and keeps one Elasticsearch index per
 * relation in step with them.  Sources are declared under {@code hailmary.sources} in
 * {@code application.yaml}.</p>
 */
@SpringBootApplication(scanBasePackages = "com.hailmary")
public class HailMarySearchSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(HailMarySearchSyncApplication.class, args);
    }
}
