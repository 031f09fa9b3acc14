package com.eventboard.app;

import com.eventboard.config.Config;
import com.eventboard.data.http.HttpClientEx;
import com.eventboard.fetch.Aggregator;
import com.eventboard.fetch.BulkFetchReport;
import com.eventboard.fetch.BulkFetchRunner;
import com.eventboard.fetch.HealthProbe;
import com.eventboard.fetch.HttpPageFetcher;
import com.eventboard.fetch.ProceedDecision;
import com.eventboard.model.ReadinessReport;
import com.eventboard.storage.DatasetStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class EventBoardApplication {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_REFUSED = 3;
    public static final int EXIT_INTERRUPTED = 130;

    private static final String CMD_NAME = "eventboard";
    private static final String USAGE = CMD_NAME + " <fetch|explore|health|config> [options]";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean routeLogs;

    public EventBoardApplication() {
        this(
                Path.of(".").toAbsolutePath().normalize(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                true
        );
    }

    public EventBoardApplication(Path workingDir, BufferedReader in, PrintStream out, boolean routeLogs) {
        this.workingDir = workingDir;
        this.in = in;
        this.out = out;
        this.routeLogs = routeLogs;
    }

public static void main(String[] args) {
        int exit = new EventBoardApplication().run(args);
        System.exit(exit);
    }

/**
 * 方法说明：run，负责解析命令行并分派子命令。
 * 处理流程：解析参数 -> 加载配置并叠加 -D 覆盖 -> 执行 fetch/explore/health/config。
 * 维护提示：返回值即进程退出码，2 为用法错误，1 为运行失败。
 */
    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            printHelp(options);
            out.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<String> commands = cmd.getArgList();
        if (cmd.hasOption("help") || commands.isEmpty()) {
            printHelp(options);
            return commands.isEmpty() && !cmd.hasOption("help") ? EXIT_USAGE : EXIT_OK;
        }
        if (commands.size() > 1) {
            printHelp(options);
            out.println("ERROR: unexpected arguments: " + commands.subList(1, commands.size()));
            return EXIT_USAGE;
        }

        try {
            Config config = Config.load(workingDir).withOverrides(overrides(cmd));
            String command = commands.get(0).trim().toLowerCase(Locale.ROOT);
            switch (command) {
                case "fetch":
                    installLogRoutingIfNeeded(config);
                    return runFetch(cmd, config);
                case "health":
                    installLogRoutingIfNeeded(config);
                    return runHealth(config);
                case "explore":
                    return runExplore(cmd, config);
                case "config":
                    return runConfig(config);
                default:
                    printHelp(options);
                    out.println("ERROR: unknown command: " + command);
                    return EXIT_USAGE;
            }
        } catch (Exception e) {
            out.println("ERROR: " + e.getMessage());
            LogManager.getLogger(EventBoardApplication.class).error("Command failed", e);
            return EXIT_FAILURE;
        }
    }

    private int runFetch(CommandLine cmd, Config config) throws Exception {
        Logger log = LogManager.getLogger(EventBoardApplication.class);
        HttpClientEx http = newHttpClient(config);
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);

        ProceedDecision configured = ProceedDecision.fromConfig(config);
        ProceedDecision decision = cmd.hasOption("yes")
                ? (report, situation) -> situation == ProceedDecision.Situation.NO_READY_MONITORS
                        || configured.proceed(report, situation)
                : configured;

        HealthProbe probe = new HealthProbe(config, http);
        Aggregator aggregator = new Aggregator(config, new HttpPageFetcher(config, http), cancel::get);
        DatasetStore store = new DatasetStore(config.getPath("outputs.dir"), config.getString("api.base_url"));
        BulkFetchRunner runner = new BulkFetchRunner(config, probe, aggregator, store, decision, cancel::get);

        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                if (!done.await(30, TimeUnit.SECONDS)) {
                    log.warn("Fetch did not stop within 30s after interrupt");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "eventboard-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        BulkFetchReport report;
        try {
            log.info("Output dir: {}", store.dir());
            report = runner.run();
        } finally {
            done.countDown();
            removeHook(hook);
        }

        out.print(ReadinessFormatter.format(report.gate.report));
        if (report.refused()) {
            out.println("Fetch not started: " + report.gate.reason);
            out.println("Re-run with --yes or set fetch.proceed_without_ready_monitors=true to fetch anyway.");
            return EXIT_REFUSED;
        }
        out.print(ReadinessFormatter.format(report));
        out.println("Data saved in: " + store.dir());
        return report.interrupted ? EXIT_INTERRUPTED : EXIT_OK;
    }

    private int runHealth(Config config) {
        HealthProbe probe = new HealthProbe(config, newHttpClient(config));
        ReadinessReport report = probe.check();
        out.print(ReadinessFormatter.format(report));
        return report.available ? EXIT_OK : EXIT_FAILURE;
    }

    private int runExplore(CommandLine cmd, Config config) throws Exception {
        Path dir = cmd.hasOption("dir")
                ? workingDir.resolve(cmd.getOptionValue("dir")).normalize()
                : config.getPath("outputs.dir");
        if (!Files.isDirectory(dir)) {
            out.println("ERROR: data directory not found: " + dir);
            out.println("Run '" + CMD_NAME + " fetch' first.");
            return EXIT_FAILURE;
        }
        DatasetStore store = new DatasetStore(dir, config.getString("api.base_url"));
        ExplorerSession session = new ExplorerSession(config, store, in, out);
        return session.run(cmd.getOptionValue("file"));
    }

    private int runConfig(Config config) {
        for (String key : config.defaults().keySet()) {
            Config.ResolvedValue value = config.resolve(key);
            out.println(value.key + "=" + value.value + " (" + value.source + ")");
        }
        return EXIT_OK;
    }

    private HttpClientEx newHttpClient(Config config) {
        int timeout = Math.max(1, config.getInt("api.timeout_sec", 30));
        return new HttpClientEx(Duration.ofSeconds(timeout), config.getString("api.user_agent"));
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LogManager.getLogger(EventBoardApplication.class).debug("Shutdown in progress, hook left in place");
        }
    }

    static Map<String, String> overrides(CommandLine cmd) {
        Map<String, String> out = new LinkedHashMap<>();
        Properties props = cmd.getOptionProperties("D");
        for (String key : props.stringPropertyNames()) {
            out.put(key, props.getProperty(key));
        }
        return out;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (!routeLogs || LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (EventBoardApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("eventboard.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(EventBoardApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LogManager.getLogger(EventBoardApplication.class).info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                out.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out, true);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("D").numberOfArgs(2).valueSeparator('=').argName("key=value")
                .desc("override a config key").build());
        options.addOption(Option.builder().longOpt("yes").desc("fetch even when no monitors are ready").build());
        options.addOption(Option.builder().longOpt("dir").hasArg().argName("path").desc("data directory for explore").build());
        options.addOption(Option.builder().longOpt("file").hasArg().argName("name").desc("dataset file to open in explore").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
