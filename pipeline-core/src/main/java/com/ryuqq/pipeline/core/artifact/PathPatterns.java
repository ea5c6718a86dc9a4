package com.ryuqq.pipeline.core.artifact;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 아티팩트/캐시 paths 패턴으로 워크스페이스 파일을 선택.
 *
 * <p>패턴은 glob이며 디렉터리를 가리키면 그 아래 모든 파일을 포함합니다.
 * 즉 파일 경로 또는 그 상위 디렉터리 중 하나가 패턴과 일치하면 선택됩니다.</p>
 */
final class PathPatterns {

    private PathPatterns() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static <T> Map<String, T> select(Map<String, T> files, List<String> patterns) {
        Map<String, T> selected = new LinkedHashMap<>();
        if (patterns.isEmpty()) {
            return selected;
        }
        List<PathMatcher> matchers = patterns.stream()
            .map(PathPatterns::normalize)
            .filter(pattern -> !pattern.isEmpty())
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toList();
        files.forEach((path, content) -> {
            if (matchesAny(matchers, normalize(path))) {
                selected.put(path, content);
            }
        });
        return selected;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, String path) {
        for (Path candidate = Path.of(path); candidate != null; candidate = candidate.getParent()) {
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String normalize(String path) {
        String normalized = path.trim();
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
