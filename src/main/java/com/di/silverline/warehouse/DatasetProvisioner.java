package com.di.silverline.warehouse;

import com.di.silverline.config.SilverlineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the bronze (staging) and silver datasets in the configured location when missing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetProvisioner {

    private final Warehouse warehouse;
    private final SilverlineProperties properties;

    public void ensureDatasets() {
        SilverlineProperties.Datasets datasets = properties.getDatasets();
        warehouse.ensureDataset(datasets.getBronze());
        warehouse.ensureDataset(datasets.getSilver());
        log.debug("[TARGET] datasets ready: {}, {}", datasets.getBronze(), datasets.getSilver());
    }
}
