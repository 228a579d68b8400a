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
package com.familyleaf.prompting.extension.family.repository;

import com.familyleaf.prompting.extension.family.model.LeafRecord;

import java.time.Instant;
import java.util.List;

/**
 * 叶子内容存储（只读）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface LeafRepository {

    /**
     * 分支内最近的叶子，按创建时间倒序
     */
    List<LeafRecord> findRecentByBranch(String branchId, int limit);

    /**
     * 某作者在分支内最近的叶子，按创建时间倒序
     */
    List<LeafRecord> findRecentByAuthor(String authorId, String branchId, int limit);

    /**
     * 分支内指定时间之后带里程碑标记的叶子，按创建时间倒序
     */
    List<LeafRecord> findMilestonesSince(String branchId, Instant since);

    /**
     * 作者在指定时间之后是否在分支内发布过内容
     */
    boolean hasAuthoredSince(String authorId, String branchId, Instant since);
}
