package com.di.silverline.locate;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.SourceUnavailableException;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link BronzeStore} over the configured GCS bucket.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GcsBronzeStore implements BronzeStore {

    private final Storage storage;
    private final SilverlineProperties properties;

    @Override
    public List<BronzeObject> list(String prefix) {
        String bucket = properties.getBronzeBucket();
        try {
            Page<Blob> page = storage.list(bucket, Storage.BlobListOption.prefix(prefix));
            List<BronzeObject> objects = new ArrayList<>();
            for (Blob blob : page.iterateAll()) {
                if (blob.isDirectory() || blob.getName().endsWith("/")) {
                    continue;
                }
                Instant created = blob.getCreateTimeOffsetDateTime() == null
                        ? null : blob.getCreateTimeOffsetDateTime().toInstant();
                long size = blob.getSize() == null ? 0L : blob.getSize();
                objects.add(new BronzeObject("gs://" + bucket + "/" + blob.getName(), blob.getName(), size, created));
            }
            log.debug("[LOCATE] gs://{}/{} -> {} objects", bucket, prefix, objects.size());
            return objects;
        } catch (StorageException e) {
            throw new SourceUnavailableException(
                    String.format("Cannot list gs://%s/%s: %s", bucket, prefix, e.getMessage()), e);
        }
    }
}
