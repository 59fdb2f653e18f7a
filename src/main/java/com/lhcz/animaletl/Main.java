package com.lhcz.animaletl;

import com.lhcz.animaletl.config.AppConfig;
import com.lhcz.animaletl.config.ConfigLoader;
import com.lhcz.animaletl.core.Pipeline;
import com.lhcz.animaletl.core.WebConsole;
import com.lhcz.animaletl.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run());
    }

    /**
     * @return 进程退出码：拿到统计即为 0 (即使统计里有错误)，启动或运行中出现不可恢复异常为 1
     */
    static int run() {
        WebConsole webConsole = null;
        try {
            AppConfig config = new ConfigLoader().load();
            log.info("Starting Animal ETL ...");

            Pipeline pipeline = new Pipeline(config);
            if (!pipeline.getClient().healthCheck()) {
                log.warn("⚠️ 上游健康检查未通过，仍尝试运行: {}", config.api().baseUrl());
            }

            // 配置了端口才启动 Web 控制台
            if (config.web() != null && config.web().port() != null) {
                webConsole = new WebConsole(config.web().port(), pipeline);
                webConsole.start();
            }

            RunSummary stats = pipeline.run();
            printSummary(stats);
            return 0;
        } catch (Exception e) {
            log.error("Pipeline execution failed: {}", e.getMessage(), e);
            return 1;
        } finally {
            if (webConsole != null) {
                webConsole.stop();
            }
        }
    }

    private static void printSummary(RunSummary stats) {
        String line = "=".repeat(50);
        log.info(line);
        log.info("PIPELINE EXECUTION SUMMARY");
        log.info(line);
        log.info("Animals fetched: {}", stats.fetched());
        log.info("Animals transformed: {}", stats.transformed());
        log.info("Animals loaded: {}", stats.loaded());
        log.info("Batches loaded: {}", stats.batchesProcessed());
        log.info("Duration: {} seconds", String.format("%.2f", stats.duration().toMillis() / 1000.0));
        if (stats.hasErrors()) {
            log.error("Errors encountered: {}", stats.errors().size());
        }
        log.info(line);
    }
}
