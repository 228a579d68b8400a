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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PromptingScheduler 单元测试")
class PromptingSchedulerTest {

    @Mock
    private ObjectProvider<SmartPromptingEngine> engineProvider;

    @Mock
    private ObjectProvider<FamilyDirectoryRepository> directoryProvider;

    @Mock
    private SmartPromptingEngine engine;

    @Mock
    private FamilyDirectoryRepository directory;

    private PromptingProperties properties;
    private PromptingScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new PromptingProperties();
        scheduler = new PromptingScheduler(engineProvider, directoryProvider, properties);
    }

    @Test
    @DisplayName("每日时刻转换为 cron，非法时刻跳过")
    void shouldConvertTimesToCron() {
        PromptingProperties.Schedule schedule = new PromptingProperties.Schedule();
        schedule.setTimes(new ArrayList<>(List.of("09:00", " 19:30 ", "", "25:00", "later")));

        assertThat(PromptingScheduler.scheduleCrons(schedule)).containsExactly("0 0 9 * * *", "0 30 19 * * *");
    }

    @Test
    @DisplayName("配置 cron 时忽略每日时刻")
    void shouldPreferExplicitCron() {
        PromptingProperties.Schedule schedule = new PromptingProperties.Schedule();
        schedule.setCron("0 0 */6 * * *");

        assertThat(PromptingScheduler.scheduleCrons(schedule)).containsExactly("0 0 */6 * * *");
    }

    @Test
    @DisplayName("按配置注册三类定时任务")
    void shouldRegisterConfiguredTasks() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler.configureTasks(registrar);

        List<String> expressions = registrar.getCronTaskList().stream()
                .map(CronTask::getExpression)
                .collect(Collectors.toList());
        assertThat(expressions).containsExactly("0 0 9 * * *", "0 0 19 * * *", "0 */30 * * * *", "0 15 * * * *");
    }

    @Test
    @DisplayName("整体关闭时不注册任务")
    void shouldRegisterNothingWhenDisabled() {
        properties.setEnabled(false);
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler.configureTasks(registrar);

        assertThat(registrar.getCronTaskList()).isEmpty();
    }

    @Test
    @DisplayName("里程碑扫描逐个分支执行，单个分支失败不影响其余分支")
    void shouldSweepEveryBranch() {
        // Given
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(directoryProvider.getIfAvailable()).thenReturn(directory);
        when(directory.findBranchesWithActiveMembers()).thenReturn(List.of("b-1", "b-2"));
        when(engine.checkForMilestones("b-1")).thenThrow(new IllegalStateException("boom"));
        when(engine.checkForMilestones("b-2")).thenReturn(List.of());

        // When
        scheduler.runMilestoneSweep();

        // Then
        verify(engine).checkForMilestones("b-2");
    }

    @Test
    @DisplayName("引擎不可用时跳过调度与清理")
    void shouldSkipWithoutEngine() {
        when(engineProvider.getIfAvailable()).thenReturn(null);

        scheduler.runProactiveSweep();
        scheduler.runCleanup();

        verify(engine, never()).scheduleProactivePrompts();
        verify(engine, never()).cleanupExpiredPrompts();
    }

    @Test
    @DisplayName("调度异常被记录而不向外抛出")
    void shouldContainSweepFailure() {
        when(engineProvider.getIfAvailable()).thenReturn(engine);
        when(engine.scheduleProactivePrompts()).thenThrow(new IllegalStateException("boom"));

        scheduler.runProactiveSweep();

        verify(engine).scheduleProactivePrompts();
    }
}
