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

import com.familyleaf.prompting.persistence.entity.SmartPromptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 智能提示 JPA Repository
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Repository
public interface SmartPromptJpaRepository extends JpaRepository<SmartPromptEntity, String> {

    /**
     * 查询用户在分支内指定状态且尚未过期的提示，按创建时间倒序
     */
    @Query("SELECT p FROM SmartPromptEntity p WHERE p.userId = :userId AND p.branchId = :branchId " +
           "AND p.messageType = 'prompt' AND p.status = :status AND p.expiresAt > :now " +
           "ORDER BY p.createdAt DESC")
    List<SmartPromptEntity> findValidByUserIdAndBranchIdAndStatus(
            @Param("userId") String userId,
            @Param("branchId") String branchId,
            @Param("status") String status,
            @Param("now") LocalDateTime now);

    /**
     * 分支内是否存在指定时间之后创建的某类提示
     */
    boolean existsByBranchIdAndPromptTypeAndCreatedAtGreaterThanEqual(
            String branchId, String promptType, LocalDateTime createdAt);

    /**
     * 条件更新状态，仅当当前状态等于 expected 时生效
     */
    @Modifying
    @Query("UPDATE SmartPromptEntity p SET p.status = :status WHERE p.id = :id AND p.status = :expected")
    int updateStatus(
            @Param("id") String id,
            @Param("expected") String expected,
            @Param("status") String status);

    /**
     * 删除过期时间早于指定时间的提示
     */
    @Modifying
    @Query("DELETE FROM SmartPromptEntity p WHERE p.expiresAt < :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
