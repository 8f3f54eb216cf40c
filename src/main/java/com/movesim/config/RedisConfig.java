package com.movesim.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the sample store.
 *
 * <p>Payloads are already-encoded JSON documents, so values go through the raw byte-array
 * serializer and the store never re-encodes them. Keys are plain strings.
 *
 * <p>Key schema:
 * <pre>
 *   user.{entityId}.location  → List of Sample JSON payloads (append-only)
 * </pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "movesim.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public RedisTemplate<String, byte[]> sampleRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, byte[]> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(RedisSerializer.byteArray());
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(RedisSerializer.byteArray());

        return redisTemplate;
    }
}
