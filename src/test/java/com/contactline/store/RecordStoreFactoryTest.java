package com.contactline.store;

import com.contactline.TestConfigs;
import com.contactline.error.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class RecordStoreFactoryTest {

    @Test
    void build_returnsMemoryStore_whenTypeIsMemory() {
        final RecordStore store = RecordStoreFactory.build(TestConfigs.with(Map.of("store.type", "memory")));
        assertThat(store).isInstanceOf(MemoryRecordStore.class);
    }

    @Test
    void build_rejectsUnknownType() {
        assertThatThrownBy(() -> RecordStoreFactory.build(TestConfigs.with(Map.of("store.type", "etcd"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("etcd");
    }

    @Test
    void buildRedis_returnsUnavailableStore_whenUrlMissing() {
        final RecordStore store = RecordStoreFactory.buildRedis(Optional.empty(), 1000);

        assertThat(store).isInstanceOf(UnavailableRecordStore.class);
        assertThatThrownBy(() -> store.set("k", "v"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("not configured");
    }

    @Test
    void buildRedis_returnsUnavailableStore_whenUrlMalformed() {
        final RecordStore store = RecordStoreFactory.buildRedis(Optional.of("not a redis url"), 1000);

        assertThat(store).isInstanceOf(UnavailableRecordStore.class);
        assertThat(((UnavailableRecordStore) store).getReason()).contains("could not be initialized");
    }

    @Test
    void buildRedis_keepsRedisStore_whenServerUnreachable() {
        final RecordStore store = RecordStoreFactory.buildRedis(Optional.of("redis://127.0.0.1:1"), 500);
        try {
            assertThat(store).isInstanceOf(RedisRecordStore.class);
            assertThat(((RedisRecordStore) store).isConnected()).isFalse();

            // each call retries the connection and fails the same recoverable way
            assertThatThrownBy(() -> store.get("ns:phone_number"))
                    .isInstanceOf(StoreUnavailableException.class)
                    .hasMessageContaining("127.0.0.1:1");
            assertThatThrownBy(() -> store.set("ns:change_count", "1"))
                    .isInstanceOf(StoreUnavailableException.class);
        } finally {
            store.close();
        }
    }
}
