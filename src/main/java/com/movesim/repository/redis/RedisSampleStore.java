package com.movesim.repository.redis;

import com.movesim.exception.StoreUnavailableException;
import com.movesim.repository.SampleStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed {@link SampleStore}. Each key is a Redis list: a batch is one {@code RPUSH} of all
 * its payloads, a read is {@code LRANGE key 0 -1}.
 *
 * <p>Every Spring {@link DataAccessException} (connection refused, timeout, command failure) is
 * translated to {@link StoreUnavailableException}.
 */
@Repository
@ConditionalOnProperty(prefix = "movesim.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisSampleStore implements SampleStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSampleStore.class);

    private final RedisTemplate<String, byte[]> sampleRedisTemplate;

    public RedisSampleStore(@Qualifier("sampleRedisTemplate") RedisTemplate<String, byte[]> sampleRedisTemplate) {
        this.sampleRedisTemplate = sampleRedisTemplate;
    }

    @Override
    public void appendBatch(String key, List<byte[]> payloads) {
        if (payloads.isEmpty()) {
            return;
        }
        try {
            Long length = sampleRedisTemplate.opsForList().rightPushAll(key, payloads);
            log.debug("RPUSH {} payloads to {} (list length: {})", payloads.size(), key, length);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to append batch to " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<byte[]> readAll(String key) {
        try {
            List<byte[]> payloads = sampleRedisTemplate.opsForList().range(key, 0, -1);
            return payloads != null ? payloads : List.of();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read " + key + ": " + e.getMessage(), e);
        }
    }
}
