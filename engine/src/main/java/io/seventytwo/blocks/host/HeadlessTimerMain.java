package io.seventytwo.blocks.host;

import com.google.common.base.Splitter;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.config.ConfigPaths;
import io.seventytwo.blocks.config.TimerSettings;
import io.seventytwo.blocks.timer.CompletionEvent;
import io.seventytwo.blocks.timer.TimerListener;
import io.seventytwo.blocks.timer.TimerView;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the block timer without a UI: recovers the previous run or starts the current slot, then keeps
 * going (continuing into later slots) until the process is interrupted.
 */
public final class HeadlessTimerMain {
    private static final Logger logger = LogManager.getLogger(HeadlessTimerMain.class);

    private static final Set<String> VALID_ARGS = Set.of("data-dir", "category", "label", "break", "help");

    record ParsedArgs(Map<String, String> args, Set<String> invalidKeys) {
        boolean has(String key) {
            return args.containsKey(key);
        }

        @Nullable
        String value(String key) {
            var value = args.get(key);
            return value == null || value.isBlank() ? null : value;
        }
    }

    private HeadlessTimerMain() {}

    /* Accepts --key=value and bare --flag; anything else not starting with -- is ignored. */
    static ParsedArgs parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        var invalidKeys = new TreeSet<String>();
        for (var arg : args) {
            if (!arg.startsWith("--")) {
                continue;
            }
            var parts = Splitter.on('=').limit(2).splitToList(arg.substring(2));
            var key = parts.get(0);
            var value = parts.size() > 1 ? parts.get(1) : "";
            if (VALID_ARGS.contains(key)) {
                result.put(key, value);
            } else {
                invalidKeys.add(key);
            }
        }
        return new ParsedArgs(Map.copyOf(result), invalidKeys);
    }

    private static void printUsage(Set<String> invalidArgs) {
        if (!invalidArgs.isEmpty()) {
            System.err.println("Error: Unknown argument(s): "
                    + invalidArgs.stream().map(arg -> "--" + arg).collect(Collectors.joining(", ")));
            System.err.println();
        }
        System.out.println("Usage: java HeadlessTimerMain [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --data-dir=<path>     Where blocks and the live run are stored");
        System.out.println("                        (default: " + ConfigPaths.defaultDataDir() + ")");
        System.out.println("  --category=<id>       Category to record work against");
        System.out.println("  --label=<text>        Label to record work against");
        System.out.println("  --break               Start on a break instead of working");
        System.out.println("  --help                Show this help message");
        System.out.println();
        System.out.println("Settings are read from " + ConfigPaths.settingsFile());
    }

    public static void main(String[] args) {
        var parsed = parseArgs(args);
        if (parsed.has("help") || !parsed.invalidKeys().isEmpty()) {
            printUsage(parsed.invalidKeys());
            System.exit(parsed.invalidKeys().isEmpty() ? 0 : 1);
            return;
        }

        var dataDirArg = parsed.value("data-dir");
        var dataDir = dataDirArg != null ? Path.of(dataDirArg) : ConfigPaths.defaultDataDir();
        var settings = TimerSettings.load(ConfigPaths.settingsFile());
        logger.info("Using data directory {} and zone {}", dataDir, settings.zone());

        var app = new BlockTimerApp(dataDir, settings, Clock.systemDefaultZone());
        app.engine().addListener(new ConsoleListener());
        try {
            if (!app.open()) {
                var mode = parsed.has("break") ? SegmentKind.BREAK : SegmentKind.WORK;
                if (!app.startCurrentSlot(mode, parsed.value("category"), parsed.value("label"))) {
                    System.err.println("Could not start the current block; see the log for details.");
                    app.close();
                    System.exit(1);
                    return;
                }
            }
            Runtime.getRuntime()
                    .addShutdownHook(new Thread(
                            () -> {
                                logger.info("Shutdown signal received, saving the live run");
                                app.close();
                            },
                            "BlockTimer-ShutdownHook"));
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.info("HeadlessTimerMain interrupted", e);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Fatal error in HeadlessTimerMain", e);
            app.close();
            System.exit(1);
        }
    }

    /** Prints a status line once a minute and on every state change. */
    private static final class ConsoleListener implements TimerListener {
        @Override
        public void onTick(int timeLeft, double progressPercent) {
            if (timeLeft % 60 == 0) {
                System.out.printf("%d:%02d left (%.0f%%)%n", timeLeft / 60, timeLeft % 60, progressPercent);
            }
        }

        @Override
        public void onBreakNotify() {
            System.out.println("Break reminder: your break has run its course.");
        }

        @Override
        public void onComplete(CompletionEvent event) {
            System.out.printf(
                    "Block at slot %d finished: %ds used%s%n",
                    event.blockIndex(),
                    event.secondsUsed(),
                    event.natural() ? "" : " (stopped early)");
        }

        @Override
        public void onCheckInRequired() {
            System.out.println("Still there? Automatic continuation is paused until you check in.");
        }

        @Override
        public void onStateChanged(TimerView view) {
            System.out.println("Timer " + view.phase().name().toLowerCase(Locale.ROOT)
                    + (view.phase().hasSession() ? " on slot " + view.blockIndex() : ""));
        }
    }
}
