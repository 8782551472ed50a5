package com.di.silverline.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cloud Storage client used to list bronze partitions (ADC).
 */
@Configuration
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage(SilverlineProperties properties) {
        return StorageOptions.newBuilder()
                .setProjectId(properties.getProjectId())
                .build()
                .getService();
    }
}
