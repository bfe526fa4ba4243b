package io.perfdash.web;

import io.perfdash.api.config.DashboardConfig;
import io.perfdash.core.filter.TimeRangeFilter;
import io.perfdash.core.report.ReportGenerators;
import io.perfdash.core.service.DashboardQueryService;
import io.perfdash.web.environment.DashboardEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher for the dashboard server and the offline report command.
 * <p>
 * Run the dashboard with:
 * <pre>{@code
 * mvn compile exec:java -pl perfdash-web -Dexec.args="--root ./results --port 5002"
 * }</pre>
 * Then open http://localhost:5002.
 * <p>
 * Write a report without starting the server:
 * <pre>{@code
 * mvn compile exec:java -pl perfdash-web \
 *   -Dexec.args="report Pixel7_20240101_120000 reports/pixel7.html --format html"
 * }</pre>
 * Options: {@code --root}, {@code --port}, {@code --metrics}, and for reports
 * {@code --format}, {@code --start}, {@code --end}. The {@code perfdash.root} and
 * {@code perfdash.port} system properties supply defaults.
 */
public class DashboardApplication {

    private static final Logger log = LoggerFactory.getLogger(DashboardApplication.class);

    public static void main(String[] args) throws InterruptedException {
        Arguments arguments;
        DashboardConfig config;
        try {
            arguments = Arguments.parse(args);
            config = configure(arguments);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            System.exit(2);
            return;
        }

        if (!arguments.positional().isEmpty() && arguments.positional().get(0).equals("report")) {
            System.exit(runReport(config, arguments));
            return;
        }

        DashboardEnvironment environment = new DashboardEnvironment(config);
        environment.startServer();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            environment.shutdown();
            stopped.countDown();
        }, "perfdash-shutdown"));
        stopped.await();
    }

    static DashboardConfig configure(Arguments arguments) {
        DashboardConfig config = DashboardConfig.create();

        String root = arguments.option("root", System.getProperty("perfdash.root"));
        if (root != null) {
            config.artifactRoot(Path.of(root));
        }

        String port = arguments.option("port", System.getProperty("perfdash.port"));
        if (port != null) {
            try {
                config.port(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + port, e);
            }
        }

        String metrics = arguments.option("metrics", null);
        if (metrics != null) {
            config.metricsFile(Path.of(metrics));
        }
        return config;
    }

    static int runReport(DashboardConfig config, Arguments arguments) {
        List<String> positional = arguments.positional();
        if (positional.size() < 2) {
            System.err.println(usage());
            return 2;
        }
        String folder = positional.get(1);
        String format = arguments.option("format", "html");
        Path output = positional.size() > 2
                ? Path.of(positional.get(2))
                : config.reportDirectory().resolve(folder + "." + format.toLowerCase(Locale.ROOT));

        try {
            var service = new DashboardQueryService(config);
            Path written = service.writeReport(folder,
                    TimeRangeFilter.parseBound("start_time", arguments.option("start", null)),
                    TimeRangeFilter.parseBound("end_time", arguments.option("end", null)),
                    ReportGenerators.forFormat(format),
                    output);
            System.out.println(written.toAbsolutePath());
            return 0;
        } catch (RuntimeException e) {
            log.error("Report for {} failed", folder, e);
            return 1;
        }
    }

    private static String usage() {
        return """
                Usage:
                  perfdash [--root DIR] [--port N] [--metrics FILE]
                  perfdash report FOLDER [OUTPUT] [--format html|csv|json] [--start TS] [--end TS] [--root DIR]""";
    }

    /**
     * Command line split into {@code --name value} options and positional words.
     */
    record Arguments(Map<String, String> options, List<String> positional) {

        static Arguments parse(String[] args) {
            Map<String, String> options = new LinkedHashMap<>();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--")) {
                    String name = arg.substring(2);
                    int eq = name.indexOf('=');
                    if (eq >= 0) {
                        options.put(name.substring(0, eq), name.substring(eq + 1));
                    } else if (i + 1 < args.length) {
                        options.put(name, args[++i]);
                    } else {
                        throw new IllegalArgumentException("Missing value for option --" + name);
                    }
                } else {
                    positional.add(arg);
                }
            }
            return new Arguments(options, positional);
        }

        String option(String name, String fallback) {
            return options.getOrDefault(name, fallback);
        }
    }
}
