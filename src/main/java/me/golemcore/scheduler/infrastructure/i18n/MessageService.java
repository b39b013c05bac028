package me.golemcore.scheduler.infrastructure.i18n;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Internationalization service for localized command replies.
 *
 * <p>
 * Message bundles are loaded from {@code messages_<lang>.properties} resources
 * (English and Russian) and formatted with {@link MessageFormat}. A key missing
 * in the requested language falls back to English; a key missing entirely is
 * returned as-is.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService() {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
    }

    private void loadBundle(String lang) {
        try {
            Locale locale = Locale.forLanguageTag(lang);
            ResourceBundle bundle = ResourceBundle.getBundle("messages", locale,
                    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
            bundles.put(lang, bundle);
            log.debug("Loaded message bundle for language: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
        }
    }

    /**
     * Get message in current global language.
     */
    public String getMessage(String key, Object... args) {
        return getMessage(key, language, args);
    }

    /**
     * Get message for specific language.
     */
    public String getMessage(String key, String lang, Object... args) {
        String pattern = lookup(bundles.get(lang), key);
        if (pattern == null && !DEFAULT_LANG.equals(lang)) {
            pattern = lookup(bundles.get(DEFAULT_LANG), key);
        }
        if (pattern == null) {
            log.warn("Missing message key: {} for language: {}", key, lang);
            return key;
        }
        if (args != null && args.length > 0) {
            return MessageFormat.format(pattern, args);
        }
        return pattern;
    }

    public String getLanguage() {
        return language;
    }

    /**
     * Set global language. Unsupported languages fall back to English.
     */
    public void setLanguage(String lang) {
        if (SUPPORTED_LANGUAGES.contains(lang)) {
            language = lang;
            log.info("Global language set to: {}", lang);
        } else {
            log.warn("Unsupported language: {}, using default", lang);
            language = DEFAULT_LANG;
        }
    }

    public boolean isSupported(String lang) {
        return SUPPORTED_LANGUAGES.contains(lang);
    }

    private static String lookup(ResourceBundle bundle, String key) {
        if (bundle == null || !bundle.containsKey(key)) {
            return null;
        }
        return bundle.getString(key);
    }
}
