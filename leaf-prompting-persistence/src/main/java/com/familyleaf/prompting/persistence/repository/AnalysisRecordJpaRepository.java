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

import com.familyleaf.prompting.persistence.entity.AnalysisRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 回复分析记录 JPA Repository
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Repository
public interface AnalysisRecordJpaRepository extends JpaRepository<AnalysisRecordEntity, String> {

    /**
     * 按创建时间倒序查询用户在分支内的分析记录
     */
    List<AnalysisRecordEntity> findByUserIdAndBranchIdOrderByCreatedAtDesc(
            String userId, String branchId, Pageable pageable);

    long countByUserIdAndBranchId(String userId, String branchId);
}
