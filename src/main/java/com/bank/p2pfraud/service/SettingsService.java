package com.bank.p2pfraud.service;

import com.bank.p2pfraud.config.FraudPolicyConfig;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.Settings;
import com.bank.p2pfraud.model.VelocityLimits;
import com.bank.p2pfraud.repository.SettingsRepository;
import com.aerospike.client.AerospikeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live fraud policy. Loaded lazily from storage, falling back to the
 * {@code fraud.policy} defaults, and replaced atomically on every admin write
 * so the next decision sees the new values.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final SettingsRepository settingsRepository;
    private final FraudPolicyConfig defaults;
    private final AuditLogService auditLogService;
    private final Clock clock;

    private final AtomicReference<Settings> current = new AtomicReference<>();

    public SettingsService(SettingsRepository settingsRepository,
                           FraudPolicyConfig defaults,
                           AuditLogService auditLogService,
                           Clock clock) {
        this.settingsRepository = settingsRepository;
        this.defaults = defaults;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * @return a copy of the live policy; mutating it has no effect
     */
    public Settings getSettings() {
        Settings cached = current.get();
        if (cached != null) {
            return cached.copy();
        }

        Settings loaded;
        try {
            loaded = settingsRepository.load();
        } catch (AerospikeException e) {
            log.warn("Could not load settings, using defaults for this call: {}", e.getMessage());
            return defaults.toSettings();
        }

        if (loaded == null) {
            log.info("No persisted settings found, using configured defaults");
            loaded = defaults.toSettings();
        }
        current.compareAndSet(null, loaded);
        return current.get().copy();
    }

    public Settings updateSettings(CallerContext caller, Settings requested) {
        caller.requireRole(AccountRole.ADMIN);
        validate(requested);

        Settings toStore = requested.copy();
        settingsRepository.save(toStore, clock.millis());
        current.set(toStore);

        log.info("Settings updated by {}: flag={}, block={}, txLimit={}",
                caller.callerId(), toStore.getFlagThreshold(), toStore.getBlockThreshold(),
                toStore.getTxLimitAmount());
        auditLogService.record(caller.callerId(), "update_settings", AuditLogService.ENTITY_SETTINGS, "system",
                String.format("flag=%.2f block=%.2f txLimit=%.2f maxFailed=%d",
                        toStore.getFlagThreshold(), toStore.getBlockThreshold(),
                        toStore.getTxLimitAmount(), toStore.getMaxFailedAttempts()));
        return toStore.copy();
    }

    /**
     * Store the configured defaults unless a policy already exists. Used by the seeder.
     */
    public void initializeDefaults() {
        if (settingsRepository.load() == null) {
            Settings initial = defaults.toSettings();
            settingsRepository.save(initial, clock.millis());
            current.set(initial);
            log.info("Initialized default settings");
        }
    }

    void validate(Settings s) {
        List<String> errors = new ArrayList<>();

        if (s == null) {
            throw new ValidationException("Settings body is required");
        }
        if (!inUnitRange(s.getFlagThreshold())) {
            errors.add("flagThreshold must be between 0.0 and 1.0");
        }
        if (!inUnitRange(s.getBlockThreshold())) {
            errors.add("blockThreshold must be between 0.0 and 1.0");
        }
        if (s.getFlagThreshold() >= s.getBlockThreshold()) {
            errors.add("flagThreshold must be less than blockThreshold");
        }
        if (!(s.getTxLimitAmount() > 0)) {
            errors.add("txLimitAmount must be positive");
        }
        if (!(s.getDefaultUserBalance() > 0)) {
            errors.add("defaultUserBalance must be positive");
        }
        if (s.getMaxFailedAttempts() < 1) {
            errors.add("maxFailedAttempts must be at least 1");
        }
        if (s.getHighRiskLocations() == null) {
            errors.add("highRiskLocations is required");
        }

        VelocityLimits limits = s.getVelocityLimits();
        if (limits == null) {
            errors.add("velocityLimits is required");
        } else {
            if (!(limits.getMaxAmount1h() > 0)) errors.add("velocityLimits.maxAmount1h must be positive");
            if (!(limits.getMaxAmount24h() > 0)) errors.add("velocityLimits.maxAmount24h must be positive");
            if (limits.getMaxCount1h() < 1) errors.add("velocityLimits.maxCount1h must be at least 1");
            if (limits.getMaxCount24h() < 1) errors.add("velocityLimits.maxCount24h must be at least 1");
            if (limits.getMaxUniqueRecipients24h() < 1) {
                errors.add("velocityLimits.maxUniqueRecipients24h must be at least 1");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
