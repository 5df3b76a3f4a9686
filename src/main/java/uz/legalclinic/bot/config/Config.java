package uz.legalclinic.bot.config;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

public final class Config {
    private final String botToken;
    private final String botUsername;
    private final Path dbPath;
    private final ZoneId zoneId;

    // Broadcast channels (Telegram group chat ids)
    private final long reviewerChatId;
    private final long fulfillerChatId;

    // Actors created as (or upgraded to) reviewers
    private final Set<Long> reviewerIds;

    private final int minRequestLength;
    private final String defaultLocale;
    private final int workerThreads;
    private final int maxMessageLen;

    private Config(
            String botToken,
            String botUsername,
            Path dbPath,
            ZoneId zoneId,
            long reviewerChatId,
            long fulfillerChatId,
            Set<Long> reviewerIds,
            int minRequestLength,
            String defaultLocale,
            int workerThreads,
            int maxMessageLen
    ) {
        this.botToken = Objects.requireNonNull(botToken);
        this.botUsername = Objects.requireNonNull(botUsername);
        this.dbPath = Objects.requireNonNull(dbPath);
        this.zoneId = Objects.requireNonNull(zoneId);
        this.reviewerChatId = reviewerChatId;
        this.fulfillerChatId = fulfillerChatId;
        this.reviewerIds = Collections.unmodifiableSet(reviewerIds);
        this.minRequestLength = minRequestLength;
        this.defaultLocale = Objects.requireNonNull(defaultLocale);
        this.workerThreads = workerThreads;
        this.maxMessageLen = maxMessageLen;
    }

    public static Config load() {
        return from(Config::lookupEnv);
    }

    /**
     * Builds the configuration from an arbitrary key lookup. Missing keys fall back to defaults.
     */
    public static Config from(Function<String, String> lookup) {
        String botToken = get(lookup, "BOT_TOKEN", "");
        String botUsername = get(lookup, "BOT_USERNAME", "legal_clinic_bot");
        String dbPath = get(lookup, "DB_PATH", "./data/bot.db");
        String tz = get(lookup, "BOT_TIMEZONE", "Asia/Tashkent");

        long reviewerChat = getLong(lookup, "REVIEWER_CHAT_ID", 0L);
        long fulfillerChat = getLong(lookup, "FULFILLER_CHAT_ID", 0L);
        Set<Long> reviewers = parseIds(get(lookup, "REVIEWER_IDS", ""));

        int minLen = getInt(lookup, "MIN_REQUEST_LENGTH", 150);
        String locale = get(lookup, "DEFAULT_LOCALE", "ru");
        int workers = getInt(lookup, "WORKER_THREADS", 8);
        int maxLen = getInt(lookup, "MAX_MESSAGE_LEN", 3900);

        return new Config(
                botToken,
                botUsername,
                Path.of(dbPath),
                ZoneId.of(tz),
                reviewerChat,
                fulfillerChat,
                reviewers,
                minLen,
                locale,
                Math.max(1, workers),
                maxLen
        );
    }

    private static String lookupEnv(String key) {
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) return env;
        return System.getProperty(key);
    }

    private static String get(Function<String, String> lookup, String key, String def) {
        String v = lookup.apply(key);
        if (v != null && !v.isBlank()) return v.trim();
        return def;
    }

    private static int getInt(Function<String, String> lookup, String key, int def) {
        String v = get(lookup, key, "");
        if (v.isBlank()) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static long getLong(Function<String, String> lookup, String key, long def) {
        String v = get(lookup, key, "");
        if (v.isBlank()) return def;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static Set<Long> parseIds(String csv) {
        Set<Long> out = new LinkedHashSet<>();
        for (String part : csv.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            try {
                out.add(Long.parseLong(p));
            } catch (NumberFormatException ignored) {
                // not an id, skip it
            }
        }
        return out;
    }

    /**
     * Names of the required keys that are missing. Empty when the bot can start.
     */
    public Set<String> missingRequired() {
        Set<String> missing = new LinkedHashSet<>();
        if (botToken.isBlank()) missing.add("BOT_TOKEN");
        if (reviewerChatId == 0L) missing.add("REVIEWER_CHAT_ID");
        if (fulfillerChatId == 0L) missing.add("FULFILLER_CHAT_ID");
        return missing;
    }

    public String botToken() { return botToken; }
    public String botUsername() { return botUsername; }
    public Path dbPath() { return dbPath; }
    public ZoneId zoneId() { return zoneId; }

    public long reviewerChatId() { return reviewerChatId; }
    public long fulfillerChatId() { return fulfillerChatId; }
    public Set<Long> reviewerIds() { return reviewerIds; }

    public int minRequestLength() { return minRequestLength; }
    public String defaultLocale() { return defaultLocale; }
    public int workerThreads() { return workerThreads; }
    public int maxMessageLen() { return maxMessageLen; }
}
