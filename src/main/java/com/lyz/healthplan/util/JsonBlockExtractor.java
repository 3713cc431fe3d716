package com.lyz.healthplan.util;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从大模型回复中截取 JSON：优先取 ```json 代码块，否则取首个括号到对应的最后一个括号
 */
public final class JsonBlockExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private JsonBlockExtractor() {
    }

    public static String extract(String text) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalStateException("Empty AI response");
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        String body = matcher.find() ? matcher.group(1) : text;

        int arrayStart = body.indexOf('[');
        int objectStart = body.indexOf('{');
        int start;
        char close;
        if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
            start = arrayStart;
            close = ']';
        } else if (objectStart >= 0) {
            start = objectStart;
            close = '}';
        } else {
            throw new IllegalStateException("No JSON found in response");
        }
        int end = body.lastIndexOf(close);
        if (end <= start) {
            throw new IllegalStateException("No JSON found in response");
        }
        return body.substring(start, end + 1);
    }
}
