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
package com.familyleaf.prompting.start.scheduler;

import com.familyleaf.prompting.extension.config.PromptingProperties;
import com.familyleaf.prompting.extension.family.repository.FamilyDirectoryRepository;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 智能提示周期任务
 * <p>
 * 按配置注册三类定时任务：主动提示调度、里程碑扫描、过期提示清理。
 * 主动提示默认按 schedule.times 中的每个时刻触发，配置 schedule.cron 时以 cron 为准。
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Component
public class PromptingScheduler implements SchedulingConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(PromptingScheduler.class);

    private final ObjectProvider<SmartPromptingEngine> engineProvider;
    private final ObjectProvider<FamilyDirectoryRepository> directoryProvider;
    private final PromptingProperties properties;

    public PromptingScheduler(ObjectProvider<SmartPromptingEngine> engineProvider,
                              ObjectProvider<FamilyDirectoryRepository> directoryProvider,
                              PromptingProperties properties) {
        this.engineProvider = engineProvider;
        this.directoryProvider = directoryProvider;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!properties.isEnabled()) {
            logger.info("PromptingScheduler 智能提示未启用，不注册定时任务");
            return;
        }
        if (properties.getSchedule().isEnabled()) {
            for (String cron : scheduleCrons(properties.getSchedule())) {
                registrar.addCronTask(this::runProactiveSweep, cron);
                logger.info("PromptingScheduler 注册主动提示调度: cron={}", cron);
            }
        }
        if (properties.getMilestoneDetection().isEnabled()) {
            registrar.addCronTask(this::runMilestoneSweep, properties.getMilestoneDetection().getCron());
            logger.info("PromptingScheduler 注册里程碑扫描: cron={}", properties.getMilestoneDetection().getCron());
        }
        if (properties.getCleanup().isEnabled()) {
            registrar.addCronTask(this::runCleanup, properties.getCleanup().getCron());
            logger.info("PromptingScheduler 注册过期提示清理: cron={}", properties.getCleanup().getCron());
        }
    }

    /**
     * 将 HH:mm 时刻转换为每日触发的 cron，非法时刻跳过
     */
    static List<String> scheduleCrons(PromptingProperties.Schedule schedule) {
        List<String> crons = new ArrayList<>();
        if (StringUtils.hasText(schedule.getCron())) {
            crons.add(schedule.getCron().trim());
            return crons;
        }
        if (schedule.getTimes() == null) {
            return crons;
        }
        for (String time : schedule.getTimes()) {
            if (!StringUtils.hasText(time)) {
                continue;
            }
            try {
                LocalTime parsed = LocalTime.parse(time.trim());
                crons.add("0 " + parsed.getMinute() + " " + parsed.getHour() + " * * *");
            } catch (DateTimeParseException e) {
                logger.warn("PromptingScheduler 忽略非法的调度时刻: time={}", time);
            }
        }
        return crons;
    }

    void runProactiveSweep() {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            logger.warn("PromptingScheduler runProactiveSweep SmartPromptingEngine 不可用");
            return;
        }
        try {
            int generated = engine.scheduleProactivePrompts();
            logger.info("PromptingScheduler 主动提示调度结束: generated={}", generated);
        } catch (RuntimeException e) {
            logger.error("PromptingScheduler 主动提示调度失败", e);
        }
    }

    void runMilestoneSweep() {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        FamilyDirectoryRepository directory = directoryProvider.getIfAvailable();
        if (engine == null || directory == null) {
            logger.warn("PromptingScheduler runMilestoneSweep 依赖不满足: engine={}, directory={}",
                    engine != null, directory != null);
            return;
        }
        List<String> branchIds;
        try {
            branchIds = directory.findBranchesWithActiveMembers();
        } catch (RuntimeException e) {
            logger.error("PromptingScheduler 查询活跃分支失败", e);
            return;
        }
        int created = 0;
        for (String branchId : branchIds) {
            try {
                created += engine.checkForMilestones(branchId).size();
            } catch (RuntimeException e) {
                logger.error("PromptingScheduler 里程碑扫描失败: branchId={}", branchId, e);
            }
        }
        logger.info("PromptingScheduler 里程碑扫描结束: branches={}, created={}", branchIds.size(), created);
    }

    void runCleanup() {
        SmartPromptingEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            logger.warn("PromptingScheduler runCleanup SmartPromptingEngine 不可用");
            return;
        }
        try {
            engine.cleanupExpiredPrompts();
        } catch (RuntimeException e) {
            logger.error("PromptingScheduler 过期提示清理失败", e);
        }
    }
}
