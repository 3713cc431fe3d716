package com.lyz.healthplan.service.safety.matcher;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class KeywordContentMatcher implements ContentMatcher {

    @Override
    public ContentMatcherType type() {
        return ContentMatcherType.KEYWORD;
    }

    @Override
    public List<String> findMatches(String content, Collection<String> keywords) {
        List<String> matches = new ArrayList<>();
        if (StringUtils.isBlank(content) || keywords == null) {
            return matches;
        }
        for (String keyword : keywords) {
            if (StringUtils.isNotBlank(keyword) && content.contains(keyword)) {
                matches.add(keyword);
            }
        }
        return matches;
    }
}
