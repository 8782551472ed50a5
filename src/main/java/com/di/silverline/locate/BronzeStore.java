package com.di.silverline.locate;

import java.util.List;

/**
 * Read-only view of the bronze object store.
 */
public interface BronzeStore {

    /**
     * Lists every object (not directory placeholder) whose name starts with {@code prefix}.
     *
     * @throws com.di.silverline.exception.SourceUnavailableException when the store cannot be reached
     */
    List<BronzeObject> list(String prefix);
}
