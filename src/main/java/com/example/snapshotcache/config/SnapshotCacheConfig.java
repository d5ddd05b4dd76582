package com.example.snapshotcache.config;

import com.example.snapshotcache.lease.InMemoryRefreshLeaseRegistry;
import com.example.snapshotcache.lease.RedisRefreshLeaseRegistry;
import com.example.snapshotcache.lease.RefreshLeaseRegistry;
import com.example.snapshotcache.store.InMemorySnapshotStore;
import com.example.snapshotcache.store.RedisSnapshotStore;
import com.example.snapshotcache.store.SnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({SnapshotCacheProperties.class, NotionProperties.class})
public class SnapshotCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "snapshot-cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public SnapshotStore inMemorySnapshotStore(Clock clock) {
        return new InMemorySnapshotStore(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "snapshot-cache", name = "store", havingValue = "redis")
    public SnapshotStore redisSnapshotStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                            Clock clock, SnapshotCacheProperties properties) {
        return new RedisSnapshotStore(redisTemplate, objectMapper, clock, properties.keyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "snapshot-cache.lease", name = "mode", havingValue = "memory", matchIfMissing = true)
    public RefreshLeaseRegistry inMemoryRefreshLeaseRegistry(Clock clock) {
        return new InMemoryRefreshLeaseRegistry(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "snapshot-cache.lease", name = "mode", havingValue = "redis")
    public RefreshLeaseRegistry redisRefreshLeaseRegistry(StringRedisTemplate redisTemplate, Clock clock,
                                                          SnapshotCacheProperties properties) {
        return new RedisRefreshLeaseRegistry(redisTemplate, clock, properties.keyPrefix(), properties.lease().ttl());
    }
}
