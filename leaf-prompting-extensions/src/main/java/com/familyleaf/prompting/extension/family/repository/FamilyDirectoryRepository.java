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

import com.familyleaf.prompting.extension.family.model.BranchInfo;
import com.familyleaf.prompting.extension.family.model.BranchMembership;
import com.familyleaf.prompting.extension.family.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * 用户资料、分支与成员关系查询（只读）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public interface FamilyDirectoryRepository {

    Optional<UserProfile> findProfile(String userId);

    Optional<BranchInfo> findBranch(String branchId);

    /**
     * 所有状态为 active 的成员关系
     */
    List<BranchMembership> findActiveMemberships();

    /**
     * 存在 active 成员的分支ID
     */
    List<String> findBranchesWithActiveMembers();
}
