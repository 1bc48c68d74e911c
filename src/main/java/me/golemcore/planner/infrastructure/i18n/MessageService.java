package me.golemcore.planner.infrastructure.i18n;

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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized command replies from {@code messages_<lang>.properties}.
 *
 * <p>
 * Lookups name the language explicitly because each user picks their own. A
 * key missing from a translation falls back to the English text, and a key
 * missing everywhere is returned as-is so a reply is never lost.
 */
@Service
@Slf4j
public class MessageService {

    public static final String DEFAULT_LANG = "en";

    private static final List<String> SUPPORTED_LANGUAGES = List.of(DEFAULT_LANG, "ru");
    private static final String BUNDLE = "messages";

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();

    public MessageService() {
        ResourceBundle.Control exactLocale = ResourceBundle.Control
                .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
        for (String language : SUPPORTED_LANGUAGES) {
            try {
                bundles.put(language, ResourceBundle.getBundle(BUNDLE, Locale.forLanguageTag(language), exactLocale));
            } catch (MissingResourceException e) {
                log.warn("[i18n] No message bundle for '{}'", language);
            }
        }
        log.debug("[i18n] Loaded bundles: {}", bundles.keySet());
    }

    public String getMessage(String key, String language, Object... args) {
        String lang = isSupported(language) ? language : DEFAULT_LANG;
        String pattern = lookup(lang, key);
        if (pattern == null && !DEFAULT_LANG.equals(lang)) {
            log.debug("[i18n] '{}' has no {} translation, using English", key, lang);
            pattern = lookup(DEFAULT_LANG, key);
        }
        if (pattern == null) {
            log.warn("[i18n] Missing message key: {}", key);
            return key;
        }
        if (args == null || args.length == 0) {
            return pattern;
        }
        return new MessageFormat(pattern, Locale.forLanguageTag(lang)).format(args);
    }

    public boolean isSupported(String language) {
        return language != null && SUPPORTED_LANGUAGES.contains(language);
    }

    public List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }

    private String lookup(String language, String key) {
        ResourceBundle bundle = bundles.get(language);
        if (bundle == null || !bundle.containsKey(key)) {
            return null;
        }
        return bundle.getString(key);
    }
}
