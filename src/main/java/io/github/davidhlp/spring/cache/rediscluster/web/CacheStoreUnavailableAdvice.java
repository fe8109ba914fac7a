package io.github.davidhlp.spring.cache.rediscluster.web;

import io.github.davidhlp.spring.cache.rediscluster.connection.CacheStoreUnavailableException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 缓存存储无法连接时终止当前请求，返回 503。
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CacheStoreUnavailableAdvice {

    static final String BODY = "Error: Cache store connection failed. Try again later";

    @ExceptionHandler(CacheStoreUnavailableException.class)
    public ResponseEntity<String> handleUnavailable(CacheStoreUnavailableException e) {
        log.error("Cache store unavailable, aborting request: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.TEXT_PLAIN)
                .body(BODY);
    }
}
