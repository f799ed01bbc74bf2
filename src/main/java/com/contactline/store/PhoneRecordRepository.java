package com.contactline.store;

import com.contactline.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the two values that make up a namespace's phone record.
 *
 * <h2>Key layout</h2>
 * <pre>
 *   &lt;namespace&gt;:phone_number   canonical 13-digit number
 *   &lt;namespace&gt;:change_count   successful updates since last reset, base-10 string
 * </pre>
 *
 * <p>The two keys are independent; nothing here spans them atomically. All
 * methods propagate {@link StoreUnavailableException} from the store.
 */
public class PhoneRecordRepository {

    private static final Logger LOG = LoggerFactory.getLogger(PhoneRecordRepository.class);

    static final String PHONE_SUFFIX = ":phone_number";
    static final String COUNT_SUFFIX = ":change_count";

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private final RecordStore store;

    public PhoneRecordRepository(final RecordStore store) {
        this.store = store;
    }

    public Optional<String> findPhone(final String namespace) {
        return store.get(phoneKey(namespace)).filter(v -> !v.isEmpty());
    }

    public void savePhone(final String namespace, final String canonicalNumber) {
        store.set(phoneKey(namespace), canonicalNumber);
    }

    /**
     * The stored counter, read from its leading base-10 digits ({@code "7abc"} is 7).
     * Absent or unparseable values count as 0, and so do negative ones.
     */
    public long getChangeCount(final String namespace) {
        final Optional<String> raw = store.get(countKey(namespace));
        if (raw.isEmpty()) return 0L;

        final Matcher matcher = LEADING_INTEGER.matcher(raw.get());
        if (!matcher.find()) {
            LOG.warn("Ignoring unparseable change counter '{}' in namespace {}", raw.get(), namespace);
            return 0L;
        }
        try {
            final long count = Long.parseLong(matcher.group(1));
            if (count < 0) {
                LOG.warn("Ignoring negative change counter {} in namespace {}", count, namespace);
                return 0L;
            }
            return count;
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring out-of-range change counter '{}' in namespace {}", raw.get(), namespace);
            return 0L;
        }
    }

    public void saveChangeCount(final String namespace, final long count) {
        store.set(countKey(namespace), Long.toString(count));
    }

    /**
     * Read the counter, add one and write it back.
     *
     * <p>This is a plain read followed by a write: two concurrent increments in
     * the same namespace can read the same value and one of them is lost.
     *
     * @return the value written
     */
    public long incrementChangeCount(final String namespace) {
        final long next = getChangeCount(namespace) + 1;
        saveChangeCount(namespace, next);
        return next;
    }

    public String storeName() {
        return store.storeName();
    }

    static String phoneKey(final String namespace) {
        return namespace + PHONE_SUFFIX;
    }

    static String countKey(final String namespace) {
        return namespace + COUNT_SUFFIX;
    }
}
