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

import com.familyleaf.prompting.extension.family.model.LeafRecord;
import com.familyleaf.prompting.extension.family.repository.LeafRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class InMemoryLeafRepository implements LeafRepository {

    private final List<LeafRecord> leaves = new ArrayList<>();

    public void add(LeafRecord leaf) {
        leaves.add(leaf);
    }

    @Override
    public List<LeafRecord> findRecentByBranch(String branchId, int limit) {
        return leaves.stream()
                .filter(leaf -> branchId.equals(leaf.getBranchId()))
                .sorted(Comparator.comparing(LeafRecord::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<LeafRecord> findRecentByAuthor(String authorId, String branchId, int limit) {
        return leaves.stream()
                .filter(leaf -> branchId.equals(leaf.getBranchId()) && authorId.equals(leaf.getAuthorId()))
                .sorted(Comparator.comparing(LeafRecord::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<LeafRecord> findMilestonesSince(String branchId, Instant since) {
        return leaves.stream()
                .filter(leaf -> branchId.equals(leaf.getBranchId()))
                .filter(leaf -> leaf.getMilestoneType() != null && !leaf.getCreatedAt().isBefore(since))
                .sorted(Comparator.comparing(LeafRecord::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasAuthoredSince(String authorId, String branchId, Instant since) {
        return leaves.stream()
                .anyMatch(leaf -> branchId.equals(leaf.getBranchId()) && authorId.equals(leaf.getAuthorId())
                        && !leaf.getCreatedAt().isBefore(since));
    }
}
