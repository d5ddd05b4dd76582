package com.example.snapshotcache.store;

import com.example.snapshotcache.exception.StorageUnavailableException;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.model.Snapshot;
import com.example.snapshotcache.model.SnapshotMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one Redis hash per resource type ({@code <prefix>:snapshot:<type>}) with the
 * fields {@code version}, {@code payload}, {@code fetchedAt}, {@code checksum} and
 * {@code recordCount}.
 * <p>
 * A commit is a single Lua script, so the version bump and the payload replacement
 * land together; reads are single commands. Extra hash fields added later are ignored
 * by older readers.
 */
public class RedisSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSnapshotStore.class);

    static final String FIELD_VERSION = "version";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_FETCHED_AT = "fetchedAt";
    static final String FIELD_CHECKSUM = "checksum";
    static final String FIELD_RECORD_COUNT = "recordCount";

    private static final RedisScript<Long> COMMIT_SCRIPT = new DefaultRedisScript<>(
            "local v = redis.call('HINCRBY', KEYS[1], 'version', 1)\n"
                    + "redis.call('HSET', KEYS[1], 'payload', ARGV[1], 'fetchedAt', ARGV[2], "
                    + "'checksum', ARGV[3], 'recordCount', ARGV[4])\n"
                    + "return v",
            Long.class);

    private static final TypeReference<List<JsonNode>> RECORDS = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisSnapshotStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                              Clock clock, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<Snapshot> get(ResourceType type) {
        Map<Object, Object> entries;
        try {
            entries = redisTemplate.opsForHash().entries(key(type));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Reading snapshot '" + type.id() + "' failed", e);
        }
        if (entries.isEmpty() || entries.get(FIELD_PAYLOAD) == null) {
            return Optional.empty();
        }
        try {
            List<JsonNode> records = objectMapper.readValue((String) entries.get(FIELD_PAYLOAD), RECORDS);
            return Optional.of(new Snapshot(
                    type,
                    records,
                    Instant.ofEpochMilli(Long.parseLong((String) entries.get(FIELD_FETCHED_AT))),
                    Long.parseLong((String) entries.get(FIELD_VERSION)),
                    emptyToNull((String) entries.get(FIELD_CHECKSUM))));
        } catch (JsonProcessingException | NumberFormatException e) {
            log.warn("Unreadable snapshot for '{}', treating as absent until the next refresh: {}",
                    type.id(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Snapshot commit(ResourceType type, List<JsonNode> records, String sourceChecksum) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Records for '" + type.id() + "' are not serializable", e);
        }
        Instant fetchedAt = clock.instant();
        Long version;
        try {
            version = redisTemplate.execute(
                    COMMIT_SCRIPT,
                    List.of(key(type)),
                    payload,
                    Long.toString(fetchedAt.toEpochMilli()),
                    sourceChecksum == null ? "" : sourceChecksum,
                    Integer.toString(records.size()));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Committing snapshot '" + type.id() + "' failed", e);
        }
        if (version == null) {
            throw new StorageUnavailableException("Commit of snapshot '" + type.id() + "' returned no version", null);
        }
        // Redis keeps millisecond precision; return what readers will see.
        return new Snapshot(type, records, Instant.ofEpochMilli(fetchedAt.toEpochMilli()), version, sourceChecksum);
    }

    @Override
    public Optional<SnapshotMetadata> freshnessOf(ResourceType type) {
        List<Object> values;
        try {
            values = redisTemplate.opsForHash().multiGet(key(type),
                    List.<Object>of(FIELD_VERSION, FIELD_FETCHED_AT, FIELD_CHECKSUM, FIELD_RECORD_COUNT));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Reading freshness of '" + type.id() + "' failed", e);
        }
        if (values == null || values.get(0) == null || values.get(1) == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SnapshotMetadata(
                    type,
                    Instant.ofEpochMilli(Long.parseLong((String) values.get(1))),
                    Long.parseLong((String) values.get(0)),
                    emptyToNull((String) values.get(2)),
                    values.get(3) == null ? 0 : Integer.parseInt((String) values.get(3))));
        } catch (NumberFormatException e) {
            log.warn("Unreadable snapshot metadata for '{}': {}", type.id(), e.getMessage());
            return Optional.empty();
        }
    }

    String key(ResourceType type) {
        return keyPrefix + ":snapshot:" + type.id();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
