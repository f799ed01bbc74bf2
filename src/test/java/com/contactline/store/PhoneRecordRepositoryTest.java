package com.contactline.store;

import com.contactline.error.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PhoneRecordRepositoryTest {

    private MemoryRecordStore     store;
    private PhoneRecordRepository repository;

    @BeforeEach
    void setup() {
        store      = new MemoryRecordStore();
        repository = new PhoneRecordRepository(store);
    }

    @Test
    void writesUnderNamespacedKeys() {
        repository.savePhone("tenant", "5491143443600");
        repository.saveChangeCount("tenant", 3);

        assertThat(store.get("tenant:phone_number")).contains("5491143443600");
        assertThat(store.get("tenant:change_count")).contains("3");
    }

    @Test
    void missingValues_readAsEmptyAndZero() {
        assertThat(repository.findPhone("tenant")).isEmpty();
        assertThat(repository.getChangeCount("tenant")).isZero();
    }

    @Test
    void unparseableCounter_readsAsZero() {
        store.set("tenant:change_count", "seven");
        assertThat(repository.getChangeCount("tenant")).isZero();
        assertThat(repository.incrementChangeCount("tenant")).isEqualTo(1L);
    }

    @Test
    void counterWithTrailingGarbage_readsLeadingDigits() {
        store.set("tenant:change_count", " 7abc");
        assertThat(repository.getChangeCount("tenant")).isEqualTo(7L);
        assertThat(repository.incrementChangeCount("tenant")).isEqualTo(8L);
    }

    @Test
    void negativeCounter_readsAsZero() {
        store.set("tenant:change_count", "-3");
        assertThat(repository.getChangeCount("tenant")).isZero();
        assertThat(repository.incrementChangeCount("tenant")).isEqualTo(1L);
    }

    @Test
    void incrementChangeCount_addsOneToStoredValue() {
        store.set("tenant:change_count", "41");
        assertThat(repository.incrementChangeCount("tenant")).isEqualTo(42L);
        assertThat(store.get("tenant:change_count")).contains("42");
    }

    @Test
    void namespacesDoNotSeeEachOther() {
        repository.savePhone("a", "5491111111111");
        repository.incrementChangeCount("a");

        assertThat(repository.findPhone("b")).isEmpty();
        assertThat(repository.getChangeCount("b")).isZero();
    }

    @Test
    void propagatesStoreFailures() {
        final var broken = new PhoneRecordRepository(new UnavailableRecordStore("down"));
        assertThatThrownBy(() -> broken.findPhone("tenant"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("down");
        assertThatThrownBy(() -> broken.saveChangeCount("tenant", 0))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
