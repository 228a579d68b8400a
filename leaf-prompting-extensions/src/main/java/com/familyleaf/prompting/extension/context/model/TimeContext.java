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
package com.familyleaf.prompting.extension.context.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * 时间上下文：时段、星期、季节
 *
 * @author Family Leaf Team
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeContext {

    public static final String MORNING = "morning";
    public static final String AFTERNOON = "afternoon";
    public static final String EVENING = "evening";
    public static final String NIGHT = "night";

    /**
     * morning/afternoon/evening/night
     */
    private String timeOfDay;

    /**
     * 星期英文全称，例如 Sunday
     */
    private String dayOfWeek;

    /**
     * spring/summer/fall/winter
     */
    private String season;

    public static TimeContext of(ZonedDateTime now) {
        return new TimeContext(timeOfDay(now.getHour()), dayName(now.getDayOfWeek()), season(now.getMonthValue()));
    }

    /**
     * 5-12 点 morning，12-17 点 afternoon，17-22 点 evening，其余 night
     */
    public static String timeOfDay(int hour) {
        if (hour >= 5 && hour < 12) {
            return MORNING;
        }
        if (hour >= 12 && hour < 17) {
            return AFTERNOON;
        }
        if (hour >= 17 && hour < 22) {
            return EVENING;
        }
        return NIGHT;
    }

    public static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * 按月份划分季节（北半球）
     */
    public static String season(int month) {
        if (month >= 3 && month <= 5) {
            return "spring";
        }
        if (month >= 6 && month <= 8) {
            return "summer";
        }
        if (month >= 9 && month <= 11) {
            return "fall";
        }
        return "winter";
    }
}
