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
package com.familyleaf.prompting.common.enums;

import java.util.Optional;

/**
 * 带有存储/传输取值的枚举
 * <p>
 * 数据库与 JSON 中统一使用小写取值（如 {@code checkin}），枚举常量名仅在代码中使用
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface ValueEnum {

    /**
     * 存储/传输使用的取值
     */
    String getValue();

    /**
     * 按取值查找枚举常量，忽略大小写
     */
    static <E extends Enum<E> & ValueEnum> Optional<E> find(Class<E> type, String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equalsIgnoreCase(value) || constant.name().equalsIgnoreCase(value)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    /**
     * 按取值解析枚举常量，不存在时抛出 {@link IllegalArgumentException}
     */
    static <E extends Enum<E> & ValueEnum> E parse(Class<E> type, String value) {
        return find(type, value).orElseThrow(() ->
                new IllegalArgumentException("不支持的" + type.getSimpleName() + "取值: " + value));
    }
}
