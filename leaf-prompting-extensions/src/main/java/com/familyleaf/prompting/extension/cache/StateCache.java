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

import java.util.Optional;

/**
 * 进程内状态缓存
 * <p>
 * 缓存只是性能捷径，存储层才是唯一数据源：任意时刻清空缓存都不影响正确性，只增加重新计算的开销。
 * 不保证多实例之间的一致性。
 * </p>
 *
 * @param <V> 缓存值类型
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface StateCache<V> {

    Optional<V> get(String key);

    void put(String key, V value);

    void invalidate(String key);

    void clear();

    /**
     * 由多段标识拼接缓存键
     */
    static String key(String... parts) {
        return String.join(":", parts);
    }
}
