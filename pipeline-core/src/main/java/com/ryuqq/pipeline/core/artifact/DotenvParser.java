package com.ryuqq.pipeline.core.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * dotenv 리포트 파싱 ({@code KEY=VALUE} 한 줄에 하나, '#' 주석).
 *
 * <p>잘못된 줄과 한도를 넘는 변수는 경고 후 무시합니다.</p>
 */
final class DotenvParser {

    private static final Logger log = LoggerFactory.getLogger(DotenvParser.class);

    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private DotenvParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, String> parse(String content, int limit) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (content == null) {
            return variables;
        }
        String[] lines = content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int separator = line.indexOf('=');
            String key = separator < 0 ? line : line.substring(0, separator).trim();
            if (separator < 0 || !KEY.matcher(key).matches()) {
                log.warn("Ignoring malformed dotenv line {}: {}", i + 1, line);
                continue;
            }
            if (variables.size() >= limit && !variables.containsKey(key)) {
                log.warn("Dotenv report exceeds {} variables, ignoring '{}'", limit, key);
                continue;
            }
            variables.put(key, unquote(line.substring(separator + 1).trim()));
        }
        return variables;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
