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
import com.familyleaf.prompting.persistence.entity.LeafEntity;
import com.familyleaf.prompting.persistence.entity.ProfileEntity;
import com.familyleaf.prompting.persistence.repository.LeafJpaRepository;
import com.familyleaf.prompting.persistence.repository.ProfileJpaRepository;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 基于 JPA 的叶子内容存储，作者姓名批量从 profiles 表补齐
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class JpaLeafRepository implements LeafRepository {

    private final LeafJpaRepository leafJpaRepository;
    private final ProfileJpaRepository profileJpaRepository;

    public JpaLeafRepository(LeafJpaRepository leafJpaRepository, ProfileJpaRepository profileJpaRepository) {
        this.leafJpaRepository = leafJpaRepository;
        this.profileJpaRepository = profileJpaRepository;
    }

    @Override
    public List<LeafRecord> findRecentByBranch(String branchId, int limit) {
        return withAuthors(leafJpaRepository.findByBranchIdOrderByCreatedAtDesc(branchId, PageRequest.of(0, limit)));
    }

    @Override
    public List<LeafRecord> findRecentByAuthor(String authorId, String branchId, int limit) {
        return withAuthors(leafJpaRepository.findByAuthorIdAndBranchIdOrderByCreatedAtDesc(
                authorId, branchId, PageRequest.of(0, limit)));
    }

    @Override
    public List<LeafRecord> findMilestonesSince(String branchId, Instant since) {
        return withAuthors(leafJpaRepository
                .findByBranchIdAndMilestoneTypeIsNotNullAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        branchId, toLocalDateTime(since)));
    }

    @Override
    public boolean hasAuthoredSince(String authorId, String branchId, Instant since) {
        return leafJpaRepository.existsByAuthorIdAndBranchIdAndCreatedAtGreaterThanEqual(
                authorId, branchId, toLocalDateTime(since));
    }

    private List<LeafRecord> withAuthors(List<LeafEntity> leaves) {
        Set<String> authorIds = leaves.stream().map(LeafEntity::getAuthorId).collect(Collectors.toSet());
        Map<String, ProfileEntity> profiles = profileJpaRepository.findAllById(authorIds).stream()
                .collect(Collectors.toMap(ProfileEntity::getId, Function.identity()));
        return leaves.stream()
                .map(leaf -> toRecord(leaf, profiles.get(leaf.getAuthorId())))
                .collect(Collectors.toList());
    }

    private LeafRecord toRecord(LeafEntity entity, ProfileEntity author) {
        return LeafRecord.builder()
                .id(entity.getId())
                .branchId(entity.getBranchId())
                .authorId(entity.getAuthorId())
                .authorFirstName(author != null ? author.getFirstName() : null)
                .authorLastName(author != null ? author.getLastName() : null)
                .content(entity.getContent())
                .milestoneType(entity.getMilestoneType())
                .createdAt(toInstant(entity.getCreatedAt()))
                .build();
    }

    private LocalDateTime toLocalDateTime(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }

    private Instant toInstant(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.atZone(ZoneId.systemDefault()).toInstant();
    }
}
