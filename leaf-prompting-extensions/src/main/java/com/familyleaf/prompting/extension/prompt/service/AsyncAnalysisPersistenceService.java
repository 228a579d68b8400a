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
package com.familyleaf.prompting.extension.prompt.service;

import com.familyleaf.prompting.extension.analysis.model.AnalysisRecord;
import com.familyleaf.prompting.extension.analysis.repository.AnalysisRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;

import java.util.concurrent.CompletableFuture;

/**
 * 异步回复分析持久化服务
 * <p>
 * 分析记录只用于后续的模式学习，保存失败只记录日志，不影响回复处理流程
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class AsyncAnalysisPersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(AsyncAnalysisPersistenceService.class);

    private final AnalysisRecordRepository analysisRepository;

    public AsyncAnalysisPersistenceService(AnalysisRecordRepository analysisRepository) {
        this.analysisRepository = analysisRepository;
    }

    /**
     * 异步保存分析记录
     *
     * @param record 分析记录
     * @return CompletableFuture
     */
    @Async("analysisPersistenceExecutor")
    public CompletableFuture<Void> saveAsync(AnalysisRecord record) {
        try {
            analysisRepository.save(record);
            logger.debug("异步保存回复分析成功: userId={}, branchId={}", record.getUserId(), record.getBranchId());
        } catch (Exception e) {
            logger.error("异步保存回复分析失败: userId={}, branchId={}", record.getUserId(), record.getBranchId(), e);
        }
        return CompletableFuture.completedFuture(null);
    }
}
