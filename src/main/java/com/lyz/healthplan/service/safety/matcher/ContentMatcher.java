package com.lyz.healthplan.service.safety.matcher;

import java.util.Collection;
import java.util.List;

/**
 * 方案文本与禁忌关键词的匹配策略
 */
public interface ContentMatcher {

    ContentMatcherType type();

    /**
     * 返回命中的关键词（按关键词集合顺序），未命中返回空列表
     *
     * @param content  已转小写的方案文本
     * @param keywords 小写关键词
     */
    List<String> findMatches(String content, Collection<String> keywords);
}
