package com.sitewatch.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 줄 단위 URL 목록 로더.
 * 앞뒤 공백 제거, 빈 줄과 '#' 주석 줄 제외, 입력 순서 유지.
 */
public final class TargetListLoader {
    private TargetListLoader() {}

    public static List<String> load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("target list not found at: " + file.toAbsolutePath());
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static List<String> parse(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return text.lines()
                .map(String::trim)
                .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                .collect(Collectors.toUnmodifiableList());
    }
}
