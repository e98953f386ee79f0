package com.smartseller.warranty.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis-based advisory lock using the SET NX EX pattern.
 * Serializes commit-chunk application per batch across application instances.
 *
 * Lock Pattern:
 * - SET key token NX EX: acquire only if nobody holds it, auto-expire if the holder dies
 * - Release runs a compare-and-delete script so only the owner can release
 *
 * Usage:
 * String lockKey = "lock:batch:" + batchId;
 * String token = redisLock.acquireLockWithRetry(lockKey, expiry, timeout, backoff);
 * if (token != null) {
 *     try {
 *         // apply chunk
 *     } finally {
 *         redisLock.releaseLock(lockKey, token);
 *     }
 * }
 *
 * @author Warranty Platform Team
 */
@Service
public class RedisDistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDistributedLock(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Attempt to acquire a lock once.
     *
     * @param lockKey Lock key (e.g. "lock:batch:{batchId}")
     * @param expiry Auto-release duration
     * @return Lock token if acquired, null if held by someone else or Redis is unreachable
     */
    public String acquireLock(String lockKey, Duration expiry) {
        try {
            String lockToken = UUID.randomUUID().toString();
            Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(lockKey, lockToken, expiry);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            logger.debug("Failed to acquire lock (already held): {}", lockKey);
            return null;
        } catch (Exception e) {
            logger.error("Error acquiring lock for key: {}", lockKey, e);
            return null;
        }
    }

    /**
     * Release a lock if the token still owns it.
     *
     * @return true if this call deleted the lock
     */
    public boolean releaseLock(String lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        try {
            Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(lockKey), lockToken);
            if (deleted != null && deleted > 0) {
                logger.debug("Released lock: {} with token: {}", lockKey, lockToken);
                return true;
            }
            logger.warn("Lock {} was not released (expired or owned by another holder)", lockKey);
            return false;
        } catch (Exception e) {
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }

    /**
     * Try to acquire a lock, retrying with exponential backoff until the timeout elapses.
     *
     * @return Lock token if acquired, null on timeout or interruption
     */
    public String acquireLockWithRetry(
            String lockKey,
            Duration lockExpiry,
            Duration retryTimeout,
            Duration initialBackoff
    ) {
        long deadline = System.currentTimeMillis() + retryTimeout.toMillis();
        long backoffMillis = Math.max(1, initialBackoff.toMillis());
        int attempt = 0;

        while (true) {
            attempt++;
            String lockToken = acquireLock(lockKey, lockExpiry);
            if (lockToken != null) {
                return lockToken;
            }
            if (System.currentTimeMillis() >= deadline) {
                break;
            }

            long sleepTime = Math.min(backoffMillis * (1L << Math.min(attempt - 1, 10)), 1000);
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                return null;
            }
        }

        logger.warn("Failed to acquire lock after {}ms and {} attempts: {}",
                retryTimeout.toMillis(), attempt, lockKey);
        return null;
    }
}
