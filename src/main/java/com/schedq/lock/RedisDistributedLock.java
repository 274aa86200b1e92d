package com.schedq.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.lettuce.core.RedisURI;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lock backed by Redis {@code SET NX PX}. Release and extension run as Lua scripts that
 * check the stored token first, so only the holder can release or extend a grant.
 */
public class RedisDistributedLock implements DistributedLock, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisDistributedLock.class);

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    static final RedisScript<Long> EXTEND_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('pexpire', KEYS[1], ARGV[2])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String prefix;
    private final String nodeId = resolveNodeId();
    private final Map<String, String> tokens = new ConcurrentHashMap<>();
    private final LettuceConnectionFactory ownedConnectionFactory;

    public RedisDistributedLock(StringRedisTemplate redisTemplate, String prefix) {
        this(redisTemplate, prefix, null);
    }

    private RedisDistributedLock(StringRedisTemplate redisTemplate, String prefix,
                                 LettuceConnectionFactory ownedConnectionFactory) {
        this.redisTemplate = redisTemplate;
        this.prefix = prefix;
        this.ownedConnectionFactory = ownedConnectionFactory;
    }

    /**
     * Connects to the Redis server at {@code url}, e.g. {@code redis://:secret@host:6379/0}.
     * The connection is closed by {@link #close()}.
     */
    public static RedisDistributedLock fromUrl(String url, String prefix) {
        RedisURI uri = RedisURI.create(url);
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        configuration.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            configuration.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null) {
            configuration.setPassword(RedisPassword.of(uri.getPassword()));
        }
        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(configuration);
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        log.info("Using Redis lock backend at {}:{}/{}", uri.getHost(), uri.getPort(), uri.getDatabase());
        return new RedisDistributedLock(new StringRedisTemplate(connectionFactory), prefix, connectionFactory);
    }

    @Override
    public boolean acquire(String key, Duration timeout) {
        String fullKey = prefix + key;
        String token = nodeId + ":" + UUID.randomUUID();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(fullKey, token, timeout);
            if (Boolean.TRUE.equals(acquired)) {
                tokens.put(key, token);
                log.debug("Acquired lock: {}", key);
                return true;
            }
            log.debug("Failed to acquire lock: {} (already held)", key);
            return false;
        } catch (RuntimeException e) {
            log.error("Error acquiring lock {}", key, e);
            return false;
        }
    }

    @Override
    public boolean release(String key) {
        String token = tokens.remove(key);
        if (token == null) {
            log.warn("Attempted to release unheld lock: {}", key);
            return false;
        }
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(prefix + key), token);
            if (deleted != null && deleted > 0) {
                log.debug("Released lock: {}", key);
                return true;
            }
            log.warn("Lock {} expired or was taken over before release", key);
            return false;
        } catch (RuntimeException e) {
            log.error("Error releasing lock {}", key, e);
            return false;
        }
    }

    @Override
    public boolean extend(String key, Duration timeout) {
        String token = tokens.get(key);
        if (token == null) {
            return false;
        }
        try {
            Long extended = redisTemplate.execute(EXTEND_SCRIPT, List.of(prefix + key), token,
                    String.valueOf(timeout.toMillis()));
            return extended != null && extended > 0;
        } catch (RuntimeException e) {
            log.error("Error extending lock {}", key, e);
            return false;
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    @Override
    public void close() {
        if (ownedConnectionFactory != null) {
            ownedConnectionFactory.destroy();
        }
    }

    private static String resolveNodeId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid();
    }
}
