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
package com.familyleaf.prompting.persistence.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * 持久化模块 JPA 配置
 * <p>
 * 注册本模块的实体与 Repository，供提示引擎自动配置在其之后装配
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@AutoConfiguration(after = HibernateJpaAutoConfiguration.class)
@EnableTransactionManagement
@EntityScan(basePackages = "com.familyleaf.prompting.persistence.entity")
@EnableJpaRepositories(basePackages = "com.familyleaf.prompting.persistence.repository")
public class JpaConfig {
}
