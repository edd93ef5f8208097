package com.scorestats.platform.repository.impl;

import com.scorestats.platform.repository.QueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;

/**
 * Redis lists used as queues (LPUSH in, RPOP out) plus pub/sub for events.
 */
@Repository
public class JedisQueueRepository implements QueueRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisQueueRepository.class);

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(32);
            poolConfig.setMaxIdle(8);
            poolConfig.setMinIdle(2);
            poolConfig.setTestOnBorrow(true);

            HostAndPort hostAndPort = new HostAndPort(redisHost, redisPort);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);

            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }

            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, hostAndPort, clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.error("Failed to initialize Redis connection to {}:{}", redisHost, redisPort, e);
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            available = true;
            return true;
        } catch (Exception e) {
            if (available) {
                logger.warn("Redis became unavailable", e);
            }
            available = false;
            return false;
        }
    }

    @Override
    public List<String> pop(String queueName, int maxItems) {
        if (maxItems <= 0) {
            return List.of();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            List<String> items = jedis.rpop(queueName, maxItems);
            return items == null ? List.of() : items;
        }
    }

    @Override
    public void push(String queueName, String payload) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.lpush(queueName, payload);
        }
    }

    @Override
    public void publish(String channel, String payload) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.publish(channel, payload);
        }
    }
}
