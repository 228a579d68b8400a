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
package com.familyleaf.prompting.extension.analysis.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 关键词/正则文本信号工具，回复分析与模型输出抽取共用
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
public final class TextSignals {

    private static final Pattern CAPITALIZED_WORD = Pattern.compile("\\b([A-Z][a-z]+)\\b");

    private static final Set<String> NON_NAME_WORDS = Set.of("I", "We", "He", "She", "They");

    /**
     * 家庭日常活动词表
     */
    public static final List<String> ACTIVITY_KEYWORDS = List.of("playground", "park", "swimming", "reading",
            "drawing", "playing", "cooking", "baking", "dancing", "singing", "walking", "running");

    private TextSignals() {
    }

    /**
     * 文本是否包含任一关键词（子串匹配）
     */
    public static boolean containsAny(String text, Collection<String> keywords) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 按关键词声明顺序返回文本中出现的关键词
     */
    public static List<String> matchedKeywords(String text, Collection<String> keywords) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    /**
     * 在有序字典中按声明顺序查找第一个命中的键
     */
    public static Optional<String> firstMatchingKey(String text, Map<String, List<String>> dictionary) {
        for (Map.Entry<String, List<String>> entry : dictionary.entrySet()) {
            if (containsAny(text, entry.getValue())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * 返回字典中所有命中的键，保持声明顺序
     */
    public static List<String> matchingKeys(String text, Map<String, List<String>> dictionary) {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : dictionary.entrySet()) {
            if (containsAny(text, entry.getValue())) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }

    /**
     * 提取疑似人名：首字母大写且不在句首的单词
     * <p>
     * 需要传入保留大小写的原始文本
     * </p>
     */
    public static List<String> capitalizedNames(String originalText) {
        Set<String> names = new LinkedHashSet<>();
        if (originalText == null || originalText.isEmpty()) {
            return new ArrayList<>();
        }
        Matcher matcher = CAPITALIZED_WORD.matcher(originalText);
        while (matcher.find()) {
            if (isSentenceStart(originalText, matcher.start())) {
                continue;
            }
            String word = matcher.group(1);
            if (!NON_NAME_WORDS.contains(word)) {
                names.add(word);
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * 收集所有正则的完整匹配，去重并保持出现顺序
     */
    public static List<String> allMatches(String text, List<Pattern> patterns) {
        Set<String> matches = new LinkedHashSet<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                matches.add(matcher.group());
            }
        }
        return new ArrayList<>(matches);
    }

    public static long count(String text, char target) {
        return text == null ? 0 : text.chars().filter(c -> c == target).count();
    }

    private static boolean isSentenceStart(String text, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        char previous = text.charAt(i);
        return previous == '.' || previous == '!' || previous == '?';
    }
}
