package io.seventytwo.blocks.config;

import io.seventytwo.blocks.checkin.CheckInCounter;
import io.seventytwo.blocks.segments.SegmentLedger;
import io.seventytwo.blocks.util.AtomicFiles;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * User-tunable engine settings, stored as a properties file.
 *
 * <p>Values are read over the bundled {@code blocktimer-defaults.properties}; a missing or invalid
 * value falls back to the default and is logged.
 */
public record TimerSettings(
        ZoneId zone,
        int dayStartHour,
        int checkInThreshold,
        Duration breakReminder,
        Duration autoContinueDelay,
        boolean autoContinueEnabled,
        int minLabelSegmentSeconds,
        Duration tickInterval,
        Duration snapshotInterval) {
    private static final Logger logger = LogManager.getLogger(TimerSettings.class);

    static final String DEFAULTS_RESOURCE = "/blocktimer-defaults.properties";

    public static final String KEY_ZONE = "zone";
    public static final String KEY_DAY_START_HOUR = "dayStartHour";
    public static final String KEY_CHECK_IN_THRESHOLD = "checkInThreshold";
    public static final String KEY_BREAK_REMINDER_SECONDS = "breakReminderSeconds";
    public static final String KEY_AUTO_CONTINUE_SECONDS = "autoContinueSeconds";
    public static final String KEY_AUTO_CONTINUE_ENABLED = "autoContinueEnabled";
    public static final String KEY_MIN_LABEL_SEGMENT_SECONDS = "minLabelSegmentSeconds";
    public static final String KEY_TICK_INTERVAL_MILLIS = "tickIntervalMillis";
    public static final String KEY_SNAPSHOT_INTERVAL_MILLIS = "snapshotIntervalMillis";

    public static final int DEFAULT_DAY_START_HOUR = 6;
    public static final Duration DEFAULT_BREAK_REMINDER = Duration.ofMinutes(5);
    public static final Duration DEFAULT_AUTO_CONTINUE_DELAY = Duration.ofSeconds(25);
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SNAPSHOT_INTERVAL = Duration.ofSeconds(5);

    public TimerSettings {
        Objects.requireNonNull(zone, "zone");
        if (dayStartHour < 0 || dayStartHour > 23) {
            throw new IllegalArgumentException("dayStartHour must be within 0..23, got: " + dayStartHour);
        }
        if (checkInThreshold < 1 || checkInThreshold > CheckInCounter.MAX_THRESHOLD) {
            throw new IllegalArgumentException("checkInThreshold must be within 1.." + CheckInCounter.MAX_THRESHOLD
                    + ", got: " + checkInThreshold);
        }
        if (minLabelSegmentSeconds < 0) {
            throw new IllegalArgumentException(
                    "minLabelSegmentSeconds must be non-negative, got: " + minLabelSegmentSeconds);
        }
        requirePositive(breakReminder, "breakReminder");
        requirePositive(tickInterval, "tickInterval");
        requirePositive(snapshotInterval, "snapshotInterval");
        if (autoContinueDelay.isNegative()) {
            throw new IllegalArgumentException("autoContinueDelay must not be negative, got: " + autoContinueDelay);
        }
    }

    public static TimerSettings defaults() {
        return new TimerSettings(
                ZoneId.systemDefault(),
                DEFAULT_DAY_START_HOUR,
                CheckInCounter.DEFAULT_THRESHOLD,
                DEFAULT_BREAK_REMINDER,
                DEFAULT_AUTO_CONTINUE_DELAY,
                true,
                SegmentLedger.DEFAULT_MIN_LABEL_SEGMENT_SECONDS,
                DEFAULT_TICK_INTERVAL,
                DEFAULT_SNAPSHOT_INTERVAL);
    }

    /** Bundled defaults overlaid with {@code file} if it exists. Never throws. */
    public static TimerSettings load(Path file) {
        var props = bundledDefaults();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
                logger.debug("Loaded timer settings from {}", file);
            } catch (IOException e) {
                logger.error("Failed to load timer settings from {}: {}", file, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    public static TimerSettings fromProperties(Properties props) {
        var fallback = defaults();
        return new TimerSettings(
                parseZone(props.getProperty(KEY_ZONE), fallback.zone()),
                parseInt(props, KEY_DAY_START_HOUR, 0, 23, fallback.dayStartHour()),
                parseInt(props, KEY_CHECK_IN_THRESHOLD, 1, CheckInCounter.MAX_THRESHOLD, fallback.checkInThreshold()),
                Duration.ofSeconds(parseInt(
                        props,
                        KEY_BREAK_REMINDER_SECONDS,
                        1,
                        Integer.MAX_VALUE,
                        (int) fallback.breakReminder().toSeconds())),
                Duration.ofSeconds(parseInt(
                        props,
                        KEY_AUTO_CONTINUE_SECONDS,
                        0,
                        Integer.MAX_VALUE,
                        (int) fallback.autoContinueDelay().toSeconds())),
                parseBoolean(props, KEY_AUTO_CONTINUE_ENABLED, fallback.autoContinueEnabled()),
                parseInt(props, KEY_MIN_LABEL_SEGMENT_SECONDS, 0, Integer.MAX_VALUE, fallback.minLabelSegmentSeconds()),
                Duration.ofMillis(parseInt(
                        props,
                        KEY_TICK_INTERVAL_MILLIS,
                        1,
                        Integer.MAX_VALUE,
                        (int) fallback.tickInterval().toMillis())),
                Duration.ofMillis(parseInt(
                        props,
                        KEY_SNAPSHOT_INTERVAL_MILLIS,
                        1,
                        Integer.MAX_VALUE,
                        (int) fallback.snapshotInterval().toMillis())));
    }

    public Properties toProperties() {
        var props = new Properties();
        props.setProperty(KEY_ZONE, zone.getId());
        props.setProperty(KEY_DAY_START_HOUR, Integer.toString(dayStartHour));
        props.setProperty(KEY_CHECK_IN_THRESHOLD, Integer.toString(checkInThreshold));
        props.setProperty(KEY_BREAK_REMINDER_SECONDS, Long.toString(breakReminder.toSeconds()));
        props.setProperty(KEY_AUTO_CONTINUE_SECONDS, Long.toString(autoContinueDelay.toSeconds()));
        props.setProperty(KEY_AUTO_CONTINUE_ENABLED, Boolean.toString(autoContinueEnabled));
        props.setProperty(KEY_MIN_LABEL_SEGMENT_SECONDS, Integer.toString(minLabelSegmentSeconds));
        props.setProperty(KEY_TICK_INTERVAL_MILLIS, Long.toString(tickInterval.toMillis()));
        props.setProperty(KEY_SNAPSHOT_INTERVAL_MILLIS, Long.toString(snapshotInterval.toMillis()));
        return props;
    }

    public void save(Path file) throws IOException {
        AtomicFiles.writeProperties(file, toProperties(), "SeventyTwo Blocks timer settings");
        logger.info("Saved timer settings to {}", file);
    }

    public TimerSettings withZone(ZoneId newZone) {
        return new TimerSettings(
                newZone,
                dayStartHour,
                checkInThreshold,
                breakReminder,
                autoContinueDelay,
                autoContinueEnabled,
                minLabelSegmentSeconds,
                tickInterval,
                snapshotInterval);
    }

    public TimerSettings withCheckInThreshold(int threshold) {
        return new TimerSettings(
                zone,
                dayStartHour,
                threshold,
                breakReminder,
                autoContinueDelay,
                autoContinueEnabled,
                minLabelSegmentSeconds,
                tickInterval,
                snapshotInterval);
    }

    public TimerSettings withDayStartHour(int hour) {
        return new TimerSettings(
                zone,
                hour,
                checkInThreshold,
                breakReminder,
                autoContinueDelay,
                autoContinueEnabled,
                minLabelSegmentSeconds,
                tickInterval,
                snapshotInterval);
    }

    private static Properties bundledDefaults() {
        var props = new Properties();
        try (InputStream in = TimerSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Bundled settings {} not found; using built-in defaults", DEFAULTS_RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read bundled settings {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return props;
    }

    private static int parseInt(Properties props, String key, int min, int max, int fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                logger.warn("Setting {}={} is outside {}..{}; using {}", key, value, min, max, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Setting {}='{}' is not a number; using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> {
                logger.warn("Setting {}='{}' is not a boolean; using {}", key, raw, fallback);
                yield fallback;
            }
        };
    }

    private static ZoneId parseZone(@Nullable String raw, ZoneId fallback) {
        if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("system")) {
            return fallback;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            logger.warn("Setting {}='{}' is not a valid zone; using {}", KEY_ZONE, raw, fallback);
            return fallback;
        }
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + duration);
        }
    }
}
