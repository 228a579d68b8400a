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

import com.familyleaf.prompting.persistence.entity.LeafEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 叶子 JPA Repository（只读）
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Repository
public interface LeafJpaRepository extends JpaRepository<LeafEntity, String> {

    List<LeafEntity> findByBranchIdOrderByCreatedAtDesc(String branchId, Pageable pageable);

    List<LeafEntity> findByAuthorIdAndBranchIdOrderByCreatedAtDesc(
            String authorId, String branchId, Pageable pageable);

    /**
     * 查询分支内指定时间之后带里程碑标记的叶子
     */
    List<LeafEntity> findByBranchIdAndMilestoneTypeIsNotNullAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            String branchId, LocalDateTime since);

    boolean existsByAuthorIdAndBranchIdAndCreatedAtGreaterThanEqual(
            String authorId, String branchId, LocalDateTime since);
}
