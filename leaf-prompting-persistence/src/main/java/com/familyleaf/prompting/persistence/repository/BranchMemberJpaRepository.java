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
package com.familyleaf.prompting.persistence.repository;

import com.familyleaf.prompting.persistence.entity.BranchMemberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 分支成员 JPA Repository（只读）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Repository
public interface BranchMemberJpaRepository extends JpaRepository<BranchMemberEntity, String> {

    List<BranchMemberEntity> findByStatusOrderByBranchIdAscUserIdAsc(String status);

    /**
     * 查询存在指定状态成员的分支ID
     */
    @Query("SELECT DISTINCT m.branchId FROM BranchMemberEntity m WHERE m.status = :status ORDER BY m.branchId")
    List<String> findDistinctBranchIdsByStatus(@Param("status") String status);
}
