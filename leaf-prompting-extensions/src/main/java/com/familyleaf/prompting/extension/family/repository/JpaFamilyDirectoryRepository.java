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
import com.familyleaf.prompting.persistence.repository.BranchJpaRepository;
import com.familyleaf.prompting.persistence.repository.BranchMemberJpaRepository;
import com.familyleaf.prompting.persistence.repository.ProfileJpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基于 JPA 的家庭目录查询
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public class JpaFamilyDirectoryRepository implements FamilyDirectoryRepository {

    static final String ACTIVE_STATUS = "active";

    private final ProfileJpaRepository profileJpaRepository;
    private final BranchJpaRepository branchJpaRepository;
    private final BranchMemberJpaRepository memberJpaRepository;

    public JpaFamilyDirectoryRepository(ProfileJpaRepository profileJpaRepository,
                                        BranchJpaRepository branchJpaRepository,
                                        BranchMemberJpaRepository memberJpaRepository) {
        this.profileJpaRepository = profileJpaRepository;
        this.branchJpaRepository = branchJpaRepository;
        this.memberJpaRepository = memberJpaRepository;
    }

    @Override
    public Optional<UserProfile> findProfile(String userId) {
        return profileJpaRepository.findById(userId)
                .map(entity -> UserProfile.builder()
                        .id(entity.getId())
                        .firstName(entity.getFirstName())
                        .lastName(entity.getLastName())
                        .familyRole(entity.getFamilyRole())
                        .build());
    }

    @Override
    public Optional<BranchInfo> findBranch(String branchId) {
        return branchJpaRepository.findById(branchId)
                .map(entity -> new BranchInfo(entity.getId(), entity.getName(), entity.getType()));
    }

    @Override
    public List<BranchMembership> findActiveMemberships() {
        return memberJpaRepository.findByStatusOrderByBranchIdAscUserIdAsc(ACTIVE_STATUS).stream()
                .map(entity -> new BranchMembership(entity.getUserId(), entity.getBranchId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findBranchesWithActiveMembers() {
        return memberJpaRepository.findDistinctBranchIdsByStatus(ACTIVE_STATUS);
    }
}
