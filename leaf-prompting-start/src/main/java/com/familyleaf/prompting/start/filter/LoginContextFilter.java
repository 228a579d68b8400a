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
package com.familyleaf.prompting.start.filter;

import com.familyleaf.prompting.common.context.LoginContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 登录上下文过滤器
 * <p>
 * 从 X-User-Id 请求头中提取用户ID，设置到 ThreadLocal 上下文中
 * </p>
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class LoginContextFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(LoginContextFilter.class);

    static final String HEADER_USER_ID = "X-User-Id";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String userId = httpRequest.getHeader(HEADER_USER_ID);

        LoginContext context = new LoginContext();
        context.setUserId(userId);
        LoginContext.set(context);

        if (logger.isDebugEnabled()) {
            logger.debug("设置登录上下文: userId={}, uri={}", userId, httpRequest.getRequestURI());
        }

        try {
            chain.doFilter(request, response);
        } finally {
            LoginContext.clear();
        }
    }
}
