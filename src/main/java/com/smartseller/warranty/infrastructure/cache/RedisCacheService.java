package com.smartseller.warranty.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache service backing the public read paths.
 * Every method degrades to a cache miss on Redis errors; the database stays the source of truth.
 *
 * Cache Keys:
 * - public:validation:{barcode} -> hash of sku (or "*") to validation response JSON
 * - product:{product_id} -> product summary JSON
 *
 * Validation entries for one barcode share a hash so activation or revocation can evict them
 * with a single DEL.
 *
 * @author Warranty Platform Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String VALIDATION_PREFIX = "public:validation:";
    private static final String PRODUCT_PREFIX = "product:";
    private static final String ANY_SKU_FIELD = "*";

    private static final Duration VALIDATION_TTL = Duration.ofMinutes(5);
    private static final Duration PRODUCT_TTL = Duration.ofMinutes(10);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCacheService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a cached public validation response.
     *
     * @param barcodeNumber Barcode string as submitted
     * @param sku Optional SKU filter (null for none)
     * @param type Response type
     * @return Optional containing the cached response
     */
    public <T> Optional<T> getValidation(String barcodeNumber, String sku, Class<T> type) {
        try {
            Object value = redisTemplate.opsForHash().get(VALIDATION_PREFIX + barcodeNumber, skuField(sku));
            if (value == null) {
                logger.debug("Cache miss for validation: {}", barcodeNumber);
                return Optional.empty();
            }
            logger.debug("Cache hit for validation: {}", barcodeNumber);
            return Optional.of(objectMapper.readValue(value.toString(), type));
        } catch (Exception e) {
            logger.error("Error reading validation cache for barcode: {}", barcodeNumber, e);
            return Optional.empty();
        }
    }

    public void putValidation(String barcodeNumber, String sku, Object response) {
        try {
            String key = VALIDATION_PREFIX + barcodeNumber;
            redisTemplate.opsForHash().put(key, skuField(sku), objectMapper.writeValueAsString(response));
            redisTemplate.expire(key, VALIDATION_TTL);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing validation response for barcode: {}", barcodeNumber, e);
        } catch (Exception e) {
            logger.error("Error writing validation cache for barcode: {}", barcodeNumber, e);
        }
    }

    /**
     * Drop every cached validation response for the barcode.
     * Called after activation, revocation and claim consumption.
     */
    public void evictValidation(String barcodeNumber) {
        try {
            redisTemplate.delete(VALIDATION_PREFIX + barcodeNumber);
            logger.debug("Evicted validation cache for barcode: {}", barcodeNumber);
        } catch (Exception e) {
            logger.error("Error evicting validation cache for barcode: {}", barcodeNumber, e);
        }
    }

    public <T> Optional<T> getProduct(String productId, Class<T> type) {
        try {
            String value = redisTemplate.opsForValue().get(PRODUCT_PREFIX + productId);
            if (value == null) {
                logger.debug("Cache miss for product: {}", productId);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, type));
        } catch (Exception e) {
            logger.error("Error reading product cache for product: {}", productId, e);
            return Optional.empty();
        }
    }

    public void putProduct(String productId, Object product) {
        try {
            redisTemplate.opsForValue().set(PRODUCT_PREFIX + productId,
                    objectMapper.writeValueAsString(product), PRODUCT_TTL);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing product {}", productId, e);
        } catch (Exception e) {
            logger.error("Error writing product cache for product: {}", productId, e);
        }
    }

    private static String skuField(String sku) {
        return sku == null || sku.isBlank() ? ANY_SKU_FIELD : sku;
    }
}
