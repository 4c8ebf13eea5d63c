package com.webdelta.app.cli;

import com.webdelta.app.logging.LogSetup;
import com.webdelta.core.model.CompareConfig;
import com.webdelta.core.render.RendererUnavailableException;
import com.webdelta.core.service.CompareOutcome;
import com.webdelta.core.service.MigrationCompareService;
import com.webdelta.core.service.export.ExportCoordinator;
import com.webdelta.core.service.export.ReportNaming;
import com.webdelta.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/** 명령행 진입점. 종료 코드: 0 성공, 1 인자 오류 또는 실행 실패 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private final PrintStream out;
    private final PrintStream err;

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    public int run(String[] args) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            out.print(CliOptions.usage());
            return 1;
        }
        if (opts.isHelp()) {
            out.print(CliOptions.usage());
            return 0;
        }

        CompareConfig cfg;
        try {
            cfg = (opts.getConfigFile() != null)
                    ? YamlConfigLoader.load(opts.getConfigFile())
                    : CompareConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: failed to load config: " + e.getMessage());
            return 1;
        }
        opts.applyTo(cfg);

        if (isBlank(cfg.getOldDomain()) || isBlank(cfg.getNewDomain())) {
            out.print(CliOptions.usage());
            return 1;
        }
        try {
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        LogSetup.configure(cfg.getOutputDir());
        return execute(cfg);
    }

    /** 설정이 확정된 뒤의 실행부(테스트에서 서비스 주입용으로 분리) */
    int execute(CompareConfig cfg) {
        return execute(cfg, new MigrationCompareService(cfg));
    }

    int execute(CompareConfig cfg, MigrationCompareService service) {
        // 출력 위치는 크롤 전에 확보
        try {
            prepareOutputDirs(cfg.getOutputDir());
        } catch (IOException e) {
            LOG.error("Cannot create output directory {}: {}", cfg.getOutputDir(), e.toString());
            err.println("Error: cannot create output directory: " + cfg.getOutputDir() + " (" + e + ")");
            return 1;
        }

        try {
            CompareOutcome outcome = service.run((p, phase, done, total) ->
                    LOG.debug("[{}] {}/{}", phase, done, total));

            List<Path> files = new ExportCoordinator()
                    .exportAll(cfg.getOutputDir(), outcome, new LinkedHashSet<>(cfg.getFormats()));

            out.println();
            out.println("=== Comparison Complete ===");
            for (Path p : files) out.println("Saved: " + p.toAbsolutePath());
            out.println();
            out.println("Migration comparison completed successfully!");
            return 0;
        } catch (RendererUnavailableException e) {
            LOG.error("Renderer unavailable: {}", e.getMessage(), e);
            err.println("Error during comparison: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to write results: {}", e.getMessage(), e);
            err.println("Error during comparison: failed to write results: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            LOG.error("Comparison failed", e);
            err.println("Error during comparison: " + e);
            return 1;
        }
    }

    static void prepareOutputDirs(Path baseDir) throws IOException {
        ReportNaming.ReportContext ctx = ReportNaming.context(baseDir, null);
        Files.createDirectories(ReportNaming.resultsDir(ctx));
        Files.createDirectories(ReportNaming.snapshotsDir(ctx));
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
