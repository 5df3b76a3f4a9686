package uz.legalclinic.bot.i18n;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message bundles stored as nested JSON objects under {@code locales/<code>.json} on the classpath.
 */
public final class JsonTranslator implements Translator {

    private static final Logger log = LoggerFactory.getLogger(JsonTranslator.class);

    public static final List<String> BUNDLED = List.of("ru", "uz", "en");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final Map<String, JsonObject> bundles;
    private final String defaultLocale;

    public JsonTranslator(Map<String, JsonObject> bundles, String defaultLocale) {
        if (!bundles.containsKey(defaultLocale)) {
            throw new IllegalArgumentException("No bundle for default locale " + defaultLocale);
        }
        this.bundles = Collections.unmodifiableMap(new LinkedHashMap<>(bundles));
        this.defaultLocale = defaultLocale;
    }

    public static JsonTranslator load(String defaultLocale) {
        Map<String, JsonObject> bundles = new LinkedHashMap<>();
        for (String code : BUNDLED) {
            String path = "locales/" + code + ".json";
            try (InputStream in = JsonTranslator.class.getClassLoader().getResourceAsStream(path)) {
                if (in == null) {
                    log.warn("Locale bundle {} not found", path);
                    continue;
                }
                bundles.put(code, JsonUtils.parseObj(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
                log.info("Loaded locale {}", code);
            } catch (IOException e) {
                log.error("Failed to read locale bundle {}", path, e);
            }
        }
        return new JsonTranslator(bundles, defaultLocale);
    }

    @Override
    public String resolve(String key, String locale, Map<String, ?> params) {
        String template = JsonUtils.stringAt(bundles.get(locale), key);
        if (template == null && !defaultLocale.equals(locale)) {
            template = JsonUtils.stringAt(bundles.get(defaultLocale), key);
        }
        if (template == null) {
            log.warn("Translation missing: {} for locale {}", key, locale);
            return key;
        }
        return interpolate(template, params);
    }

    @Override
    public Set<String> supportedLocales() {
        return bundles.keySet();
    }

    @Override
    public String defaultLocale() {
        return defaultLocale;
    }

    // unknown placeholders stay as they are
    private static String interpolate(String template, Map<String, ?> params) {
        if (params == null || params.isEmpty()) return template;
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object v = params.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(v != null ? String.valueOf(v) : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
