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
package com.familyleaf.prompting.extension.config;

import com.familyleaf.prompting.extension.ai.client.AnthropicProviderClient;
import com.familyleaf.prompting.extension.ai.client.OpenAiProviderClient;
import com.familyleaf.prompting.extension.ai.client.ProviderClient;
import com.familyleaf.prompting.extension.ai.service.AiService;
import com.familyleaf.prompting.extension.analysis.repository.AnalysisRecordRepository;
import com.familyleaf.prompting.extension.analysis.repository.JpaAnalysisRecordRepository;
import com.familyleaf.prompting.extension.analysis.service.ResponseAnalyzer;
import com.familyleaf.prompting.extension.cache.LocalStateCache;
import com.familyleaf.prompting.extension.context.repository.ConversationStateRepository;
import com.familyleaf.prompting.extension.context.repository.JpaConversationStateRepository;
import com.familyleaf.prompting.extension.context.service.ConversationContextManager;
import com.familyleaf.prompting.extension.family.repository.FamilyDirectoryRepository;
import com.familyleaf.prompting.extension.family.repository.JpaFamilyDirectoryRepository;
import com.familyleaf.prompting.extension.family.repository.JpaLeafRepository;
import com.familyleaf.prompting.extension.family.repository.LeafRepository;
import com.familyleaf.prompting.extension.leaf.service.LeafEnhancementService;
import com.familyleaf.prompting.extension.personalization.service.PersonalizedPromptingSystem;
import com.familyleaf.prompting.extension.prompt.repository.JpaSmartPromptRepository;
import com.familyleaf.prompting.extension.prompt.repository.SmartPromptRepository;
import com.familyleaf.prompting.extension.prompt.service.AsyncAnalysisPersistenceService;
import com.familyleaf.prompting.extension.prompt.service.DemoResponder;
import com.familyleaf.prompting.extension.prompt.service.EngagementScorer;
import com.familyleaf.prompting.extension.prompt.service.PromptTemplateLibrary;
import com.familyleaf.prompting.extension.prompt.service.SmartPromptingEngine;
import com.familyleaf.prompting.persistence.config.JpaConfig;
import com.familyleaf.prompting.persistence.repository.AnalysisRecordJpaRepository;
import com.familyleaf.prompting.persistence.repository.BranchJpaRepository;
import com.familyleaf.prompting.persistence.repository.BranchMemberJpaRepository;
import com.familyleaf.prompting.persistence.repository.ConversationStateJpaRepository;
import com.familyleaf.prompting.persistence.repository.LeafJpaRepository;
import com.familyleaf.prompting.persistence.repository.ProfileJpaRepository;
import com.familyleaf.prompting.persistence.repository.SmartPromptJpaRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Executor;

/**
 * 智能提示模块自动配置类
 * <p>
 * 依赖的 Repository 不可用时对应 Bean 返回 null 并告警；文本生成服务未配置时以固定话术运行
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@AutoConfiguration(after = JpaConfig.class)
@ConditionalOnProperty(prefix = "family.prompting", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PromptingProperties.class)
public class PromptingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PromptingAutoConfiguration.class);

    public static final String LEAF_ENHANCEMENT_EXECUTOR = "leafEnhancementExecutor";

    @Bean
    @ConditionalOnMissingBean
    public Clock promptingClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public Random promptingRandom(PromptingProperties properties) {
        if (properties.getRandomSeed() != null) {
            log.info("PromptingAutoConfiguration promptingRandom 使用固定随机种子: seed={}", properties.getRandomSeed());
            return new Random(properties.getRandomSeed());
        }
        return new Random();
    }

    // ==================== Repository 适配 ====================

    @Bean
    @ConditionalOnMissingBean
    public ConversationStateRepository conversationStateRepository(
            ObjectProvider<ConversationStateJpaRepository> jpaRepositoryProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            Clock promptingClock) {
        ConversationStateJpaRepository jpaRepository = jpaRepositoryProvider.getIfAvailable();
        if (jpaRepository == null) {
            log.warn("PromptingAutoConfiguration conversationStateRepository ConversationStateJpaRepository 不可用");
            return null;
        }
        return new JpaConversationStateRepository(jpaRepository, objectMapper(objectMapperProvider), promptingClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisRecordRepository analysisRecordRepository(
            ObjectProvider<AnalysisRecordJpaRepository> jpaRepositoryProvider,
            Clock promptingClock) {
        AnalysisRecordJpaRepository jpaRepository = jpaRepositoryProvider.getIfAvailable();
        if (jpaRepository == null) {
            log.warn("PromptingAutoConfiguration analysisRecordRepository AnalysisRecordJpaRepository 不可用");
            return null;
        }
        return new JpaAnalysisRecordRepository(jpaRepository, promptingClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SmartPromptRepository smartPromptRepository(ObjectProvider<SmartPromptJpaRepository> jpaRepositoryProvider,
                                                       Clock promptingClock) {
        SmartPromptJpaRepository jpaRepository = jpaRepositoryProvider.getIfAvailable();
        if (jpaRepository == null) {
            log.warn("PromptingAutoConfiguration smartPromptRepository SmartPromptJpaRepository 不可用");
            return null;
        }
        return new JpaSmartPromptRepository(jpaRepository, promptingClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeafRepository leafRepository(ObjectProvider<LeafJpaRepository> leafProvider,
                                         ObjectProvider<ProfileJpaRepository> profileProvider) {
        LeafJpaRepository leafJpaRepository = leafProvider.getIfAvailable();
        ProfileJpaRepository profileJpaRepository = profileProvider.getIfAvailable();
        if (leafJpaRepository == null || profileJpaRepository == null) {
            log.warn("PromptingAutoConfiguration leafRepository 依赖的 Repository 不可用: leaf={}, profile={}",
                    leafJpaRepository != null, profileJpaRepository != null);
            return null;
        }
        return new JpaLeafRepository(leafJpaRepository, profileJpaRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public FamilyDirectoryRepository familyDirectoryRepository(ObjectProvider<ProfileJpaRepository> profileProvider,
                                                               ObjectProvider<BranchJpaRepository> branchProvider,
                                                               ObjectProvider<BranchMemberJpaRepository> memberProvider) {
        ProfileJpaRepository profileJpaRepository = profileProvider.getIfAvailable();
        BranchJpaRepository branchJpaRepository = branchProvider.getIfAvailable();
        BranchMemberJpaRepository memberJpaRepository = memberProvider.getIfAvailable();
        if (profileJpaRepository == null || branchJpaRepository == null || memberJpaRepository == null) {
            log.warn("PromptingAutoConfiguration familyDirectoryRepository 依赖的 Repository 不可用: profile={}, branch={}, member={}",
                    profileJpaRepository != null, branchJpaRepository != null, memberJpaRepository != null);
            return null;
        }
        return new JpaFamilyDirectoryRepository(profileJpaRepository, branchJpaRepository, memberJpaRepository);
    }

    // ==================== 分析与上下文 ====================

    @Bean
    @ConditionalOnMissingBean
    public ResponseAnalyzer responseAnalyzer() {
        return new ResponseAnalyzer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationContextManager conversationContextManager(
            ObjectProvider<ConversationStateRepository> stateRepositoryProvider,
            ObjectProvider<LeafRepository> leafRepositoryProvider,
            ObjectProvider<FamilyDirectoryRepository> directoryRepositoryProvider,
            PromptingProperties properties,
            Clock promptingClock,
            Random promptingRandom) {
        ConversationStateRepository stateRepository = stateRepositoryProvider.getIfAvailable();
        LeafRepository leafRepository = leafRepositoryProvider.getIfAvailable();
        FamilyDirectoryRepository directoryRepository = directoryRepositoryProvider.getIfAvailable();
        if (stateRepository == null || leafRepository == null || directoryRepository == null) {
            log.warn("PromptingAutoConfiguration conversationContextManager 依赖不满足: state={}, leaf={}, directory={}",
                    stateRepository != null, leafRepository != null, directoryRepository != null);
            return null;
        }
        return new ConversationContextManager(stateRepository, leafRepository, directoryRepository,
                new LocalStateCache<>("conversation-state", properties.getStateCacheTtl(), promptingClock),
                promptingClock, promptingRandom);
    }

    @Bean
    @ConditionalOnMissingBean
    public PersonalizedPromptingSystem personalizedPromptingSystem(
            ObjectProvider<AnalysisRecordRepository> analysisRepositoryProvider,
            ObjectProvider<LeafRepository> leafRepositoryProvider,
            ObjectProvider<FamilyDirectoryRepository> directoryRepositoryProvider,
            PromptingProperties properties,
            Clock promptingClock,
            Random promptingRandom) {
        AnalysisRecordRepository analysisRepository = analysisRepositoryProvider.getIfAvailable();
        LeafRepository leafRepository = leafRepositoryProvider.getIfAvailable();
        FamilyDirectoryRepository directoryRepository = directoryRepositoryProvider.getIfAvailable();
        if (analysisRepository == null || leafRepository == null || directoryRepository == null) {
            log.warn("PromptingAutoConfiguration personalizedPromptingSystem 依赖不满足: analysis={}, leaf={}, directory={}",
                    analysisRepository != null, leafRepository != null, directoryRepository != null);
            return null;
        }
        return new PersonalizedPromptingSystem(analysisRepository, leafRepository, directoryRepository,
                new LocalStateCache<>("user-pattern", properties.getPatternCacheTtl(), promptingClock),
                promptingClock, promptingRandom);
    }

    // ==================== 文本生成 ====================

    @Bean
    @ConditionalOnMissingBean
    public ProviderClient providerClient(PromptingProperties properties,
                                         ObjectProvider<RestTemplate> restTemplateProvider,
                                         ObjectProvider<ObjectMapper> objectMapperProvider) {
        PromptingProperties.Ai ai = properties.getAi();
        if (!ai.isConfigured()) {
            log.info("PromptingAutoConfiguration providerClient 未配置文本生成服务，使用固定话术: provider={}", ai.getProvider());
            return null;
        }
        RestTemplate restTemplate = restTemplateProvider.getIfAvailable(RestTemplate::new);
        String provider = ai.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case OpenAiProviderClient.PROVIDER:
                log.info("PromptingAutoConfiguration providerClient 创建 OpenAI 客户端");
                return new OpenAiProviderClient(restTemplate, objectMapper(objectMapperProvider), ai);
            case AnthropicProviderClient.PROVIDER:
                log.info("PromptingAutoConfiguration providerClient 创建 Anthropic 客户端");
                return new AnthropicProviderClient(restTemplate, objectMapper(objectMapperProvider), ai);
            default:
                log.warn("PromptingAutoConfiguration providerClient 不支持的文本生成服务，使用固定话术: provider={}", provider);
                return null;
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public AiService aiService(ObjectProvider<ProviderClient> providerClientProvider,
                               ResponseAnalyzer responseAnalyzer,
                               ObjectProvider<ObjectMapper> objectMapperProvider,
                               PromptingProperties properties,
                               Clock promptingClock) {
        ProviderClient providerClient = providerClientProvider.getIfAvailable();
        if (providerClient == null) {
            return null;
        }
        return new AiService(providerClient, responseAnalyzer,
                new LocalStateCache<>("conversation-history", properties.getStateCacheTtl(), promptingClock),
                objectMapper(objectMapperProvider), promptingClock, properties.getAi().getHistoryLimit());
    }

    // ==================== 提示引擎 ====================

    @Bean
    @ConditionalOnMissingBean
    public PromptTemplateLibrary promptTemplateLibrary(Random promptingRandom) {
        return new PromptTemplateLibrary(promptingRandom);
    }

    @Bean
    @ConditionalOnMissingBean
    public DemoResponder demoResponder(Random promptingRandom) {
        return new DemoResponder(promptingRandom);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngagementScorer engagementScorer() {
        return new EngagementScorer();
    }

    @Bean
    @ConditionalOnMissingBean
    public AsyncAnalysisPersistenceService asyncAnalysisPersistenceService(
            ObjectProvider<AnalysisRecordRepository> analysisRepositoryProvider) {
        AnalysisRecordRepository analysisRepository = analysisRepositoryProvider.getIfAvailable();
        if (analysisRepository == null) {
            log.warn("PromptingAutoConfiguration asyncAnalysisPersistenceService AnalysisRecordRepository 不可用");
            return null;
        }
        return new AsyncAnalysisPersistenceService(analysisRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeafEnhancementService leafEnhancementService(
            ObjectProvider<AiService> aiServiceProvider,
            @Qualifier(LEAF_ENHANCEMENT_EXECUTOR) ObjectProvider<Executor> executorProvider) {
        Executor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            log.warn("PromptingAutoConfiguration leafEnhancementService 未找到 {}，使用 SimpleAsyncTaskExecutor",
                    LEAF_ENHANCEMENT_EXECUTOR);
            executor = new SimpleAsyncTaskExecutor("leaf-enhance-");
        }
        return new LeafEnhancementService(aiServiceProvider.getIfAvailable(), executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public SmartPromptingEngine smartPromptingEngine(
            ObjectProvider<ConversationContextManager> contextManagerProvider,
            ObjectProvider<PersonalizedPromptingSystem> personalizedSystemProvider,
            ObjectProvider<SmartPromptRepository> promptRepositoryProvider,
            ObjectProvider<LeafRepository> leafRepositoryProvider,
            ObjectProvider<FamilyDirectoryRepository> directoryRepositoryProvider,
            ObjectProvider<AsyncAnalysisPersistenceService> analysisPersistenceProvider,
            ObjectProvider<AiService> aiServiceProvider,
            ResponseAnalyzer responseAnalyzer,
            EngagementScorer engagementScorer,
            PromptTemplateLibrary promptTemplateLibrary,
            DemoResponder demoResponder,
            LeafEnhancementService leafEnhancementService,
            PromptingProperties properties,
            Clock promptingClock) {
        ConversationContextManager contextManager = contextManagerProvider.getIfAvailable();
        PersonalizedPromptingSystem personalizedSystem = personalizedSystemProvider.getIfAvailable();
        SmartPromptRepository promptRepository = promptRepositoryProvider.getIfAvailable();
        LeafRepository leafRepository = leafRepositoryProvider.getIfAvailable();
        FamilyDirectoryRepository directoryRepository = directoryRepositoryProvider.getIfAvailable();
        AsyncAnalysisPersistenceService analysisPersistence = analysisPersistenceProvider.getIfAvailable();
        if (contextManager == null || personalizedSystem == null || promptRepository == null
                || leafRepository == null || directoryRepository == null || analysisPersistence == null) {
            log.warn("PromptingAutoConfiguration smartPromptingEngine 依赖不满足: contextManager={}, personalizedSystem={}, "
                            + "promptRepository={}, leafRepository={}, directoryRepository={}, analysisPersistence={}",
                    contextManager != null, personalizedSystem != null, promptRepository != null,
                    leafRepository != null, directoryRepository != null, analysisPersistence != null);
            return null;
        }

        AiService aiService = aiServiceProvider.getIfAvailable();
        log.info("PromptingAutoConfiguration smartPromptingEngine 创建智能提示引擎: aiConfigured={}", aiService != null);
        return new SmartPromptingEngine(contextManager, personalizedSystem, responseAnalyzer, engagementScorer,
                promptTemplateLibrary, demoResponder, promptRepository, leafRepository, directoryRepository,
                analysisPersistence, leafEnhancementService, aiService, properties, promptingClock);
    }

    private static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return objectMapperProvider.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
    }
}
