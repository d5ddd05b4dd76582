package com.example.snapshotcache.lease;

import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.ResourceType;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Leases shared by every instance pointing at the same Redis. Each lease is a key
 * holding its owner token with a TTL, so a crashed holder blocks refreshes of its
 * type for at most one TTL.
 */
public class RedisRefreshLeaseRegistry implements RefreshLeaseRegistry {

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisRefreshLeaseRegistry(StringRedisTemplate redisTemplate, Clock clock, String keyPrefix, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    @Override
    public Optional<RefreshLease> tryAcquire(ResourceType type) {
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key(type), token, ttl);
        if (!Boolean.TRUE.equals(acquired)) {
            return Optional.empty();
        }
        return Optional.of(new RefreshLease(type, token, clock.instant()));
    }

    @Override
    public void release(RefreshLease lease) {
        redisTemplate.execute(RELEASE_SCRIPT, List.of(key(lease.resourceType())), lease.ownerToken());
    }

    @Override
    public boolean isHeld(ResourceType type) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(type)));
    }

    String key(ResourceType type) {
        return keyPrefix + ":lease:" + type.id();
    }
}
