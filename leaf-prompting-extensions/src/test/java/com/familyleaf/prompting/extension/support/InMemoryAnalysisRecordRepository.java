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
package com.familyleaf.prompting.extension.support;

import com.familyleaf.prompting.extension.analysis.model.AnalysisRecord;
import com.familyleaf.prompting.extension.analysis.repository.AnalysisRecordRepository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryAnalysisRecordRepository implements AnalysisRecordRepository {

    private final List<AnalysisRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void save(AnalysisRecord record) {
        records.add(record);
    }

    @Override
    public List<AnalysisRecord> findRecent(String userId, String branchId, int limit) {
        return records.stream()
                .filter(record -> userId.equals(record.getUserId()) && branchId.equals(record.getBranchId()))
                .sorted(Comparator.comparing(AnalysisRecord::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<AnalysisRecord> all() {
        return records;
    }
}
