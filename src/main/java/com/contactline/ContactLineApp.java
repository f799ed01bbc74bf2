package com.contactline;

import com.contactline.config.LineConfig;
import com.contactline.http.PhoneLineServer;
import com.contactline.line.PhoneLineService;
import com.contactline.store.PhoneRecordRepository;
import com.contactline.store.RecordStore;
import com.contactline.store.RecordStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Contact Line main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Build the record store once (Redis, or an unavailable stand-in)</li>
 *   <li>Start the HTTP server and mark it ready</li>
 *   <li>Register JVM shutdown hook that stops the server and closes the store</li>
 * </ol>
 */
public class ContactLineApp {

    private static final Logger LOG = LoggerFactory.getLogger(ContactLineApp.class);

    public static void main(final String[] args) throws Exception {
        LOG.info("=================================================");
        LOG.info("  Contact Line  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration ──────────────────────────────────────────────────
        final LineConfig config = LineConfig.load();
        LOG.info("Configuration loaded. Store: {}, REDIS_URL present: {}, namespace: {}",
                config.getStoreType(), config.getRedisUrl().isPresent(),
                config.getNamespace().isEmpty() ? "<from host>" : config.getNamespace());

        // ── 2. Record store ───────────────────────────────────────────────────
        final RecordStore store = RecordStoreFactory.build(config);
        LOG.info("Record store ready: {}", store.storeName());

        // ── 3. Core service ───────────────────────────────────────────────────
        final PhoneLineService service = new PhoneLineService(
                new PhoneRecordRepository(store), LineConfig::load);

        // ── 4. HTTP server ────────────────────────────────────────────────────
        final PhoneLineServer server = new PhoneLineServer(
                config.getHttpPort(), config.getHttpPath(), service);
        server.start();
        server.markReady();

        // ── 5. Shutdown hook ──────────────────────────────────────────────────
        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, stopping...");
            server.stop();
            store.close();
            LOG.info("Contact Line shut down cleanly.");
            shutdownLatch.countDown();
        }, "shutdown-hook"));

        LOG.info("Contact Line is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }
}
