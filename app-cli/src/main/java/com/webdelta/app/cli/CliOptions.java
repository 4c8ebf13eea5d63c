package com.webdelta.app.cli;

import com.webdelta.core.model.CompareConfig;
import com.webdelta.core.model.RendererKind;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 명령행 인자 해석 결과.
 * 형식: --key=value, 짧은 별칭은 "-o value" / "-n value", 값 없는 플래그는 --quick / --concurrent / --help.
 */
public final class CliOptions {

    private String oldDomain;
    private String newDomain;
    private boolean quick;
    private boolean concurrent;
    private boolean help;
    private Path configFile;
    private Path outDir;
    private RendererKind renderer;

    private CliOptions() {}

    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        if (args == null) return o;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null || arg.isBlank()) continue;

            if (arg.startsWith("--")) {
                String body = arg.substring(2);
                int eq = body.indexOf('=');
                String key = (eq < 0) ? body : body.substring(0, eq);
                String value = (eq < 0) ? null : body.substring(eq + 1);
                o.applyLong(key, value);
            } else if (arg.startsWith("-") && arg.length() > 1) {
                String key = arg.substring(1);
                if ("h".equals(key)) { o.help = true; continue; }
                String value = (i + 1 < args.length) ? args[i + 1] : null;
                if (value == null || value.startsWith("-")) {
                    throw new IllegalArgumentException("option -" + key + " requires a value");
                }
                i++;
                switch (key) {
                    case "o": o.oldDomain = value; break;
                    case "n": o.newDomain = value; break;
                    default: throw new IllegalArgumentException("unknown option: " + arg);
                }
            } else {
                throw new IllegalArgumentException("unexpected argument: " + arg);
            }
        }
        return o;
    }

    private void applyLong(String key, String value) {
        switch (key) {
            case "old":        oldDomain = require(key, value); break;
            case "new":        newDomain = require(key, value); break;
            case "config":     configFile = Path.of(require(key, value)); break;
            case "out":        outDir = Path.of(require(key, value)); break;
            case "renderer":   renderer = rendererOf(require(key, value)); break;
            case "quick":      quick = flag(key, value); break;
            case "concurrent": concurrent = flag(key, value); break;
            case "help":       help = true; break;
            default: throw new IllegalArgumentException("unknown option: --" + key);
        }
    }

    private static String require(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("option --" + key + " requires a value (--" + key + "=...)");
        }
        return value.trim();
    }

    /** --quick, --quick=true, --quick=false */
    private static boolean flag(String key, String value) {
        if (value == null) return true;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        throw new IllegalArgumentException("option --" + key + " expects true|false: " + value);
    }

    private static RendererKind rendererOf(String s) {
        for (RendererKind k : RendererKind.values()) {
            if (k.name().equalsIgnoreCase(s)) return k;
        }
        throw new IllegalArgumentException("unknown renderer: " + s + " (expected jsoup|playwright)");
    }

    /** 명시된 플래그만 설정값을 덮어쓴다 */
    public CompareConfig applyTo(CompareConfig cfg) {
        if (oldDomain != null) cfg.setOldDomain(oldDomain);
        if (newDomain != null) cfg.setNewDomain(newDomain);
        if (quick) cfg.setQuick(true);
        if (concurrent) cfg.setConcurrentCrawls(true);
        if (outDir != null) cfg.setOutputDir(outDir);
        if (renderer != null) cfg.setRenderer(renderer);
        return cfg;
    }

    public String getOldDomain() { return oldDomain; }
    public String getNewDomain() { return newDomain; }
    public boolean isQuick() { return quick; }
    public boolean isConcurrent() { return concurrent; }
    public boolean isHelp() { return help; }
    public Path getConfigFile() { return configFile; }
    public Path getOutDir() { return outDir; }
    public RendererKind getRenderer() { return renderer; }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Website Migration Comparison Tool",
                "==================================",
                "",
                "Usage:",
                "  webdelta --old=<old-domain> --new=<new-domain> [options]",
                "  webdelta -o <old-domain> -n <new-domain> [options]",
                "",
                "Examples:",
                "  webdelta --old=https://oldwebsite.com --new=https://newwebsite.com",
                "  webdelta -o https://oldwebsite.com -n https://newwebsite.com --quick",
                "",
                "Options:",
                "  --old, -o              Old website base URL (required)",
                "  --new, -n              New website base URL (required)",
                "  --quick                Crawl at most " + CompareConfig.QUICK_MAX_PAGES
                        + " pages per site, reduced field set",
                "  --config=<file>        YAML configuration (compare.yml)",
                "  --out=<dir>            Output directory (default: out)",
                "  --renderer=<kind>      jsoup | playwright (default: jsoup)",
                "  --concurrent           Crawl both sites at the same time",
                "  --help, -h             Show this help",
                "",
                "Description:",
                "  Compares two websites and generates a detailed report of differences,",
                "  including missing URLs, content changes, and SEO impact analysis.",
                "");
    }
}
