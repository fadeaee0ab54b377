package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.p2pfraud.config.AerospikeConfig;
import com.bank.p2pfraud.model.Settings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * The policy is a single record keyed {@code system} holding the settings as JSON.
 */
@Repository
public class SettingsRepository {

    private static final Logger log = LoggerFactory.getLogger(SettingsRepository.class);
    private static final String SETTINGS_KEY = "system";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public SettingsRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public Settings load() {
        Record record = client.get(readPolicy, key());
        if (record == null) return null;

        String json = record.getString("policy");
        try {
            return objectMapper.readValue(json, Settings.class);
        } catch (JsonProcessingException e) {
            log.error("Stored settings record is unreadable, ignoring it", e);
            return null;
        }
    }

    public void save(Settings settings, long updatedAt) {
        String json;
        try {
            json = objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings", e);
        }
        client.put(writePolicy, key(),
                new Bin("policy", json),
                new Bin("updatedAt", updatedAt));
    }

    private Key key() {
        return new Key(namespace, AerospikeConfig.SET_SETTINGS, SETTINGS_KEY);
    }
}
