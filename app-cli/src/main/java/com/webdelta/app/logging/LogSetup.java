package com.webdelta.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.*;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * core는 SLF4J로 로깅하고 slf4j-jdk14가 여기 설정된 핸들러로 넘긴다.
 *
 * System props:
 *  -Dwd.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dwd.log.sizeMb=2
 *  -Dwd.log.files=5
 *  -Dwd.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/webdelta-%g.log 로 저장 */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    /** logs 디렉터리를 직접 넘겨 초기화 */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wd.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("wd.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("wd.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wd.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        if (toConsole) root.addHandler(withLine(new ConsoleHandler(), level));

        Logger self = Logger.getLogger(LogSetup.class.getName());
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("webdelta-%g.log").toString();
            root.addHandler(withLine(new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true), level));
            self.log(Level.CONFIG, () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            self.log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }
    }

    private static Handler withLine(Handler h, Level level) {
        h.setLevel(level);
        h.setFormatter(LINE_FORMATTER);
        return h;
    }

    /** 문자열을 Level로(실패 시 INFO). DEBUG/TRACE/WARN 같은 SLF4J 이름도 허용 */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
