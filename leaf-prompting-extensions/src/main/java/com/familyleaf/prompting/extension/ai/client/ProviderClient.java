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
package com.familyleaf.prompting.extension.ai.client;

import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * 文本生成服务客户端
 * <p>
 * 输入按顺序排列的带角色消息，返回生成的文本。各服务商的请求/响应格式在实现类内部转换。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface ProviderClient {

    /**
     * 生成文本
     *
     * @param messages system / user / assistant 消息
     * @return 生成的文本，服务商未返回内容时为空串
     * @throws com.familyleaf.prompting.common.exception.AiProviderException 网络、鉴权、非 2xx 或响应无法解析
     */
    String complete(List<Message> messages);

    String getProvider();

    String getModel();
}
