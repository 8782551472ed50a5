package com.di.silverline.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * BigQuery client for the configured project, authenticated with Application Default Credentials.
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(SilverlineProperties properties) {
        return BigQueryOptions.newBuilder()
                .setProjectId(properties.getProjectId())
                .setLocation(properties.getLocation())
                .build()
                .getService();
    }
}
