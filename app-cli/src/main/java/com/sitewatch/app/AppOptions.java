package com.sitewatch.app;

import java.nio.file.Path;

/**
 * 커맨드라인 옵션.
 *   --config <path>   설정 파일(기본 sitewatch.yml, 없으면 기본값)
 *   --targets <path>  URL 목록 파일(설정의 targetsFile 대신)
 *   --once            배치 1회만 실행하고 종료
 */
public record AppOptions(Path configPath, Path targetsPath, boolean once) {

    public static final Path DEFAULT_CONFIG = Path.of("sitewatch.yml");

    public static AppOptions parse(String... args) {
        Path config = DEFAULT_CONFIG;
        Path targets = null;
        boolean once = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config" -> config = Path.of(value(args, ++i, a));
                case "--targets" -> targets = Path.of(value(args, ++i, a));
                case "--once" -> once = true;
                default -> throw new IllegalArgumentException("Unknown option: " + a);
            }
        }
        return new AppOptions(config, targets, once);
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException(opt + " requires a value");
        }
        return args[i];
    }
}
