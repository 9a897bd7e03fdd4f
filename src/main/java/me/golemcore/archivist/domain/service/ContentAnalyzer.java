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

package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.ContentFeatures;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless text analysis shared by scoring, archiving and consolidation:
 * hashing, structural features, business context detection, keywords,
 * summaries and outcome lines.
 */
@Service
public class ContentAnalyzer {

    public static final String GENERAL_CATEGORY = "general";

    private static final int SUMMARY_SCAN_LINES = 20;
    private static final int SUMMARY_MAX_LENGTH = 300;
    private static final int MAX_PROPER_NOUNS = 10;
    private static final int TOPIC_TERMS = 25;

    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+\\S.*");
    private static final Pattern LIST_ITEM = Pattern.compile("^(?:[-*+]|\\d+[.)])\\s+\\S.*");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\|.*\\|$");
    private static final Pattern CODE_FENCE = Pattern.compile("^```.*");
    private static final Pattern LINK = Pattern.compile("\\[[^\\]]+\\]\\([^)]+\\)|https?://\\S+");
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}_-]*");
    private static final Pattern PROPER_NOUN = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b");
    private static final Pattern OUTCOME_LINE = Pattern.compile(
            "^\\s*[*_#>\\s-]*(outcome|result|decision|action)s?\\**\\s*:\\s*\\**\\s*(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Set<String> STRATEGIC_KEYWORDS = Set.of(
            "roi", "quarterly", "executive", "board", "strategy", "strategic", "architecture",
            "migration", "budget", "roadmap", "stakeholder", "leadership", "investment", "vision",
            "okr", "decision");

    private static final List<String> BUSINESS_KEYWORDS = List.of(
            "platform", "architecture", "scaling", "performance", "migration", "team", "hiring",
            "organization", "structure", "growth", "strategy", "roadmap", "vision", "objectives",
            "quarterly", "stakeholder", "executive", "board", "leadership", "communication",
            "budget", "roi", "cost", "investment", "financial", "technical", "debt",
            "implementation", "framework", "system");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her", "was",
            "one", "our", "out", "has", "have", "his", "how", "its", "may", "new", "now", "see", "two",
            "who", "did", "get", "let", "put", "say", "she", "too", "use", "that", "this", "with",
            "from", "they", "will", "would", "there", "their", "what", "about", "which", "when",
            "make", "like", "time", "just", "know", "take", "into", "year", "your", "some", "could",
            "them", "than", "then", "been", "also", "were", "each", "more", "should", "these",
            "those", "here", "only", "over", "such", "very", "after", "before", "while", "where");

    private static final Map<String, Map<String, Pattern>> CONTEXT_INDICATORS = buildContextIndicators();

    public String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public ContentFeatures features(String content) {
        if (content == null || content.isEmpty()) {
            return new ContentFeatures(0, 0, 0);
        }
        int structural = 0;
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (HEADING.matcher(line).matches() || LIST_ITEM.matcher(line).matches()
                    || TABLE_ROW.matcher(line).matches() || CODE_FENCE.matcher(line).matches()) {
                structural++;
            }
        }
        Matcher links = LINK.matcher(content);
        while (links.find()) {
            structural++;
        }
        int strategicHits = 0;
        Set<String> words = words(content);
        for (String keyword : STRATEGIC_KEYWORDS) {
            if (words.contains(keyword)) {
                strategicHits++;
            }
        }
        return new ContentFeatures(content.length(), structural, strategicHits);
    }

    /**
     * Business context indicators found in the content, grouped by family in a
     * fixed order, e.g. {@code platform-migration, budget-planning}.
     */
    public List<String> businessContexts(String content) {
        List<String> contexts = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return contexts;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (Map<String, Pattern> indicators : CONTEXT_INDICATORS.values()) {
            for (Map.Entry<String, Pattern> indicator : indicators.entrySet()) {
                if (indicator.getValue().matcher(lower).find()) {
                    contexts.add(indicator.getKey());
                }
            }
        }
        return contexts;
    }

    /**
     * Primary business context family: the family with most indicators, ties
     * broken by family order; {@value #GENERAL_CATEGORY} when none match.
     */
    public String category(String content) {
        if (content == null || content.isBlank()) {
            return GENERAL_CATEGORY;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        String best = GENERAL_CATEGORY;
        int bestCount = 0;
        for (Map.Entry<String, Map<String, Pattern>> family : CONTEXT_INDICATORS.entrySet()) {
            int count = 0;
            for (Pattern pattern : family.getValue().values()) {
                if (pattern.matcher(lower).find()) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = family.getKey();
                bestCount = count;
            }
        }
        return best;
    }

    /**
     * Business keywords plus up to ten proper nouns, sorted.
     */
    public List<String> keywords(String content) {
        Set<String> found = new TreeSet<>();
        if (content == null || content.isBlank()) {
            return new ArrayList<>(found);
        }
        Set<String> words = words(content);
        for (String keyword : BUSINESS_KEYWORDS) {
            if (words.contains(keyword)) {
                found.add(keyword);
            }
        }
        Matcher properNouns = PROPER_NOUN.matcher(content);
        int nouns = 0;
        while (properNouns.find() && nouns < MAX_PROPER_NOUNS) {
            if (found.add(properNouns.group())) {
                nouns++;
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Headings and substantial lines from the top of the content, cut at 300
     * characters.
     */
    public String summary(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < Math.min(lines.length, SUMMARY_SCAN_LINES); i++) {
            String line = lines[i].trim();
            if (line.startsWith("#") || line.startsWith("*")) {
                String stripped = line.replace("#", "").replace("*", "").trim();
                if (!stripped.isEmpty()) {
                    parts.add(stripped);
                }
            } else if (line.length() > 20) {
                parts.add(line);
            }
        }
        String summary = String.join(" ", parts);
        if (summary.length() > SUMMARY_MAX_LENGTH) {
            summary = summary.substring(0, SUMMARY_MAX_LENGTH) + "...";
        }
        return summary;
    }

    /**
     * First declared outcome, decision or result line, normalized for
     * comparison.
     */
    public Optional<String> outcome(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = OUTCOME_LINE.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(2).replace("*", "").trim().toLowerCase(Locale.ROOT);
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Most frequent non-stop-word terms, ties broken alphabetically so the
     * result only depends on the content.
     */
    public Set<String> topicTerms(String content) {
        Map<String, Integer> frequencies = new HashMap<>();
        if (content != null) {
            Matcher matcher = WORD.matcher(content.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String word = matcher.group();
                if (word.length() >= 3 && !STOP_WORDS.contains(word) && !isNumber(word)) {
                    frequencies.merge(word, 1, Integer::sum);
                }
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        Set<String> terms = new LinkedHashSet<>();
        for (int i = 0; i < Math.min(TOPIC_TERMS, ranked.size()); i++) {
            terms.add(ranked.get(i).getKey());
        }
        return terms;
    }

    private Set<String> words(String content) {
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(content.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    private static boolean isNumber(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Map<String, Pattern>> buildContextIndicators() {
        Map<String, Map<String, Pattern>> families = new LinkedHashMap<>();
        families.put("platform", indicators(
                "platform-migration", "migrat",
                "platform-scaling", "scal",
                "platform-architecture", "architect",
                "infrastructure", "infrastructure",
                "platform-performance", "performance"));
        families.put("team", indicators(
                "team-hiring", "hiring|recruit",
                "team-structure", "org\\b|organization",
                "team-performance", "performance review",
                "team-growth", "growth"));
        families.put("strategy", indicators(
                "strategic-roadmap", "roadmap",
                "strategic-vision", "vision",
                "strategic-objectives", "okrs?\\b|objectives",
                "quarterly-strategy", "quarterly"));
        families.put("stakeholder", indicators(
                "executive-communication", "executive",
                "board-presentation", "board\\b",
                "leadership-alignment", "leadership",
                "stakeholder-management", "stakeholder"));
        families.put("budget", indicators(
                "roi-analysis", "roi\\b|return on investment",
                "budget-planning", "budget",
                "cost-analysis", "cost",
                "investment-strategy", "investment"));
        families.put("technical", indicators(
                "technical-debt", "technical debt",
                "technical-migration", "migrat",
                "technical-implementation", "implementation",
                "technical-framework", "framework"));
        return families;
    }

    private static Map<String, Pattern> indicators(String... nameAndPattern) {
        Map<String, Pattern> indicators = new LinkedHashMap<>();
        for (int i = 0; i < nameAndPattern.length; i += 2) {
            indicators.put(nameAndPattern[i], Pattern.compile("\\b(?:" + nameAndPattern[i + 1] + ")"));
        }
        return indicators;
    }
}
