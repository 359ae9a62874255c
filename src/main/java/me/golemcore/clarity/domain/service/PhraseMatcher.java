package me.golemcore.clarity.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-boundary phrase matching over lower-cased text. A phrase matches only
 * when it is not glued to a letter or digit on either side, so "plan" does
 * not match "planet".
 */
final class PhraseMatcher {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private PhraseMatcher() {
    }

    static boolean contains(String text, String phrase) {
        return pattern(phrase).matcher(text).find();
    }

    static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (contains(text, phrase)) {
                return true;
            }
        }
        return false;
    }

    static int count(String text, String phrase) {
        Matcher matcher = pattern(phrase).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static Pattern pattern(String phrase) {
        return PATTERNS.computeIfAbsent(phrase,
                key -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(key) + "(?![\\p{L}\\p{N}])"));
    }
}
