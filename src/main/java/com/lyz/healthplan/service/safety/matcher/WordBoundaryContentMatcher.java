package com.lyz.healthplan.service.safety.matcher;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 关键词两侧必须是非字母数字字符（或文本边界）才算命中
 * 含汉字的关键词没有词边界，按子串匹配（白糖、火腿肠）
 */
public class WordBoundaryContentMatcher implements ContentMatcher {

    private static final Pattern HAN = Pattern.compile("\\p{IsHan}");

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    @Override
    public ContentMatcherType type() {
        return ContentMatcherType.WORD_BOUNDARY;
    }

    @Override
    public List<String> findMatches(String content, Collection<String> keywords) {
        List<String> matches = new ArrayList<>();
        if (StringUtils.isBlank(content) || keywords == null) {
            return matches;
        }
        for (String keyword : keywords) {
            if (StringUtils.isBlank(keyword)) {
                continue;
            }
            Pattern pattern = patternCache.computeIfAbsent(keyword, WordBoundaryContentMatcher::compile);
            if (pattern.matcher(content).find()) {
                matches.add(keyword);
            }
        }
        return matches;
    }

    private static Pattern compile(String keyword) {
        if (HAN.matcher(keyword).find()) {
            return Pattern.compile(Pattern.quote(keyword));
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword) + "(?![\\p{L}\\p{N}])");
    }
}
