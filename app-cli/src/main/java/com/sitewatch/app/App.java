package com.sitewatch.app;

import com.sitewatch.app.logging.LogSetup;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.service.CheckService;
import com.sitewatch.core.service.export.JsonReportExporter;
import com.sitewatch.core.util.Sleeper;
import com.sitewatch.core.util.TargetListLoader;
import com.sitewatch.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 콘솔 진입점: 설정/목록을 한 번 읽고 모니터 루프를 돈다. */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        AppOptions opts;
        try {
            opts = AppOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: sitewatch [--config sitewatch.yml] [--targets website_list.txt] [--once]");
            System.exit(2);
            return;
        }

        try {
            RunConfig cfg = loadConfig(opts.configPath());
            LogSetup.configure(cfg.getOutputDir());

            Path targetsFile = (opts.targetsPath() != null) ? opts.targetsPath() : cfg.getTargetsFile();
            List<String> targets = TargetListLoader.load(targetsFile);
            if (targets.isEmpty()) {
                System.err.println("No URLs found in " + targetsFile);
                return;
            }

            Monitor monitor = new Monitor(cfg, new CheckService(cfg), targets, System.out, Sleeper.SYSTEM,
                    cfg.isJsonOutput() ? new JsonReportExporter() : null);
            monitor.run(opts.once() ? 1 : 0);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Startup failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /** 설정 파일이 없으면 기본값으로 진행 */
    static RunConfig loadConfig(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("{} not found, using defaults", path);
            return RunConfig.defaults();
        }
        return YamlConfigLoader.load(path);
    }
}
