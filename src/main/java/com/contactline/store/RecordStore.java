package com.contactline.store;

import com.contactline.error.StoreUnavailableException;

import java.util.Optional;

/**
 * Minimal string key-value capability the phone line needs from its store.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance is shared by every
 *       request for the life of the process.</li>
 *   <li>Every failure to reach or use the backing store is reported as a
 *       {@link StoreUnavailableException}; no other unchecked exception may escape.</li>
 *   <li>There is no compare-and-set; callers composing a read and a write get
 *       no atomicity across the two calls.</li>
 * </ul>
 */
public interface RecordStore extends AutoCloseable {

    /** Short name for logging, e.g. "redis". */
    String storeName();

    /**
     * @return the stored value, or {@link Optional#empty()} if the key was never written
     * @throws StoreUnavailableException if the store cannot be read
     */
    Optional<String> get(String key);

    /**
     * Overwrite {@code key} with {@code value}.
     *
     * @throws StoreUnavailableException if the store cannot be written
     */
    void set(String key, String value);

    @Override
    void close();
}
