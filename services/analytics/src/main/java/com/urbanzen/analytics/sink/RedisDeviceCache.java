package com.urbanzen.analytics.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanzen.analytics.exception.AnalyticsException;
import com.urbanzen.analytics.exception.TransientEmissionException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Writes device latest-state entries to Redis as JSON strings with a TTL.
 */
public class RedisDeviceCache implements DeviceCache {

    static final String SINK = "cache";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisDeviceCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(CacheUpdate update) {
        String json;
        try {
            json = objectMapper.writeValueAsString(update.payload());
        } catch (JsonProcessingException e) {
            throw new AnalyticsException("Failed to serialize cache entry " + update.key(), e);
        }
        try {
            redisTemplate.opsForValue().set(update.key(), json, update.ttl());
        } catch (DataAccessException e) {
            throw new TransientEmissionException(SINK, e.getMessage(), e);
        }
    }
}
