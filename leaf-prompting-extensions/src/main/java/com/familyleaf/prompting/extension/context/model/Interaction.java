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
package com.familyleaf.prompting.extension.context.model;

import com.familyleaf.prompting.common.enums.EngagementLevel;

/**
 * 更新会话状态时传入的互动
 *
 * @param prompt     提示内容
 * @param response   用户回复，主动提示尚无回复时为空串
 * @param engagement 参与度
 * @author Family Leaf Team
 * @since 1.0.0
 */
public record Interaction(String prompt, String response, EngagementLevel engagement) {

    public Interaction {
        prompt = prompt != null ? prompt : "";
        response = response != null ? response : "";
        engagement = engagement != null ? engagement : EngagementLevel.MEDIUM;
    }
}
