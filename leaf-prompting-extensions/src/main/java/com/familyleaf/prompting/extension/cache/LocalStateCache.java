/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.familyleaf.prompting.extension.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于 ConcurrentHashMap 的本地缓存，支持按写入时间过期
 *
 * @param <V> 缓存值类型
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class LocalStateCache<V> implements StateCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(LocalStateCache.class);

    private final String name;

    /**
     * 为 null 或非正数时永不过期
     */
    private final Duration ttl;

    private final Clock clock;

    private final ConcurrentMap<String, Entry<V>> entries = new ConcurrentHashMap<>();

    public LocalStateCache(String name, Duration ttl, Clock clock) {
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            logger.debug("缓存条目过期: cache={}, key={}", name, key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, V value) {
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    @Override
    public void invalidate(String key) {
        entries.remove(key);
    }

    @Override
    public void clear() {
        int size = entries.size();
        entries.clear();
        logger.info("清空缓存: cache={}, size={}", name, size);
    }

    public int size() {
        return entries.size();
    }

    public String getName() {
        return name;
    }

    private boolean isExpired(Entry<V> entry) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return !clock.instant().isBefore(entry.storedAt().plus(ttl));
    }

    private record Entry<V>(V value, Instant storedAt) {
    }
}
