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
package com.familyleaf.prompting.common.exception;

/**
 * 文本生成服务调用失败（网络、鉴权、非 2xx 响应或响应无法解析）
 * <p>
 * 本层不做重试，由直接调用方决定降级方式
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class AiProviderException extends PromptingException {

    private final String provider;

    public AiProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public AiProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
