package com.contactline.line;

import com.contactline.config.LineConfig;
import com.contactline.error.InvalidCredentialException;
import com.contactline.error.InvalidInputException;
import com.contactline.error.NormalizationAnomalyException;
import com.contactline.error.StoreUnavailableException;
import com.contactline.model.PhoneSnapshot;
import com.contactline.model.PhoneUpdateRequest;
import com.contactline.model.UpdateOutcome;
import com.contactline.namespace.NamespaceResolver;
import com.contactline.namespace.RequestContext;
import com.contactline.phone.PhoneNormalizer;
import com.contactline.store.PhoneRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The three operations on a namespace's phone record: read, update and
 * counter reset.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Read never fails because of the store: an unreachable store degrades
 *       to the configured default number and a counter of 0.</li>
 *   <li>Update and reset check the administrator password first, then the
 *       input, and only then touch the store. Store failures are rethrown as
 *       {@link StoreUnavailableException} with the cause in the message.</li>
 *   <li>Nothing is retried.</li>
 * </ul>
 *
 * <p>Configuration is fetched from the supplier once per operation, never cached.
 */
public class PhoneLineService {

    private static final Logger LOG = LoggerFactory.getLogger(PhoneLineService.class);

    private final PhoneRecordRepository  repository;
    private final Supplier<LineConfig>   configSupplier;

    public PhoneLineService(final PhoneRecordRepository repository, final Supplier<LineConfig> configSupplier) {
        this.repository     = repository;
        this.configSupplier = configSupplier;
    }

    public PhoneSnapshot read(final RequestContext context) {
        final LineConfig config    = configSupplier.get();
        final String     namespace = NamespaceResolver.resolveNamespace(config.getNamespace(), context);

        Optional<String> stored = Optional.empty();
        long changeCount = 0L;
        try {
            stored      = repository.findPhone(namespace);
            changeCount = repository.getChangeCount(namespace);
        } catch (StoreUnavailableException e) {
            LOG.warn("Store read failed for namespace {}, serving defaults: {}", namespace, e.getMessage());
        }

        return new PhoneSnapshot(stored.orElse(config.getDefaultPhone()), config.getMessage(), changeCount);
    }

    /**
     * Dispatch an administrator request to {@link #update} or {@link #reset}.
     */
    public UpdateOutcome apply(final RequestContext context, final PhoneUpdateRequest request) {
        return request.isReset()
                ? reset(context, request.getPassword())
                : update(context, request.getPhone(), request.getPassword());
    }

    public UpdateOutcome update(final RequestContext context, final String rawPhone, final String password) {
        final LineConfig config = configSupplier.get();
        checkCredential(config, password);

        if (rawPhone == null || rawPhone.isEmpty()) {
            throw new InvalidInputException("Phone number required");
        }
        final String normalized = PhoneNormalizer.normalize(rawPhone);
        if (normalized.isEmpty()) {
            throw new InvalidInputException("Invalid phone number. It must have at least "
                    + PhoneNormalizer.MIN_DIGITS + " digits to complete the 13-digit format.");
        }
        if (!PhoneNormalizer.isCanonical(normalized)) {
            LOG.warn("Normalization anomaly: input produced '{}'", normalized);
            throw new NormalizationAnomalyException(normalized);
        }

        final String namespace = NamespaceResolver.resolveNamespace(config.getNamespace(), context);
        try {
            repository.savePhone(namespace, normalized);
            final long changeCount = repository.incrementChangeCount(namespace);
            LOG.info("Phone updated: namespace={} phone={} changeCount={}", namespace, normalized, changeCount);
            return UpdateOutcome.updated(normalized, changeCount);
        } catch (StoreUnavailableException e) {
            LOG.error("Failed to save phone for namespace {} in {}", namespace, repository.storeName(), e);
            throw new StoreUnavailableException("Failed to save the phone number: " + e.getMessage(), e);
        }
    }

    public UpdateOutcome reset(final RequestContext context, final String password) {
        final LineConfig config = configSupplier.get();
        checkCredential(config, password);

        final String namespace = NamespaceResolver.resolveNamespace(config.getNamespace(), context);
        try {
            repository.saveChangeCount(namespace, 0L);
            LOG.info("Change counter reset: namespace={}", namespace);
            return UpdateOutcome.reset();
        } catch (StoreUnavailableException e) {
            LOG.error("Failed to reset change counter for namespace {} in {}", namespace, repository.storeName(), e);
            throw new StoreUnavailableException("Failed to reset the counter: " + e.getMessage(), e);
        }
    }

    private static void checkCredential(final LineConfig config, final String password) {
        if (password == null || !MessageDigest.isEqual(
                password.getBytes(StandardCharsets.UTF_8),
                config.getAdminPassword().getBytes(StandardCharsets.UTF_8))) {
            LOG.warn("Rejected administrator request: incorrect password");
            throw new InvalidCredentialException();
        }
    }
}
