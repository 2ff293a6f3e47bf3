/*
 [File Info]
 path: src/main/java/tech/robd/juncover/diagnostics/DiagnosticsBackend.java
 description: SLF4J sink for Diagnostics. Gated levels follow `juncover.diag`; errors are always emitted.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/

/*
 * Copyright (c) 2025 Rob Deas Ltd.
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
 */

package tech.robd.juncover.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Package-private sink behind {@link Diagnostics}.
 *
 * <p>Loggers are cached per owner class. When the bound SLF4J logger is a
 * {@link LocationAwareLogger}, calls are attributed to the caller of {@link Diagnostics}
 * rather than to this class.</p>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQCN = Diagnostics.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property enabling gated output: {@code -Djuncover.diag=true}.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "juncover.diag";

    private static volatile boolean enabled =
            Boolean.parseBoolean(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    static void enable() {
        enabled = true;
    }

    static void disable() {
        enabled = false;
    }

    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        if (!enabled) return; // fast path
        emit(logger(owner), LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        if (!enabled) return; // fast path
        emit(logger(owner), LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        emit(logger(owner), LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void emit(Logger log, int level, String msg, Object[] args) {
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level, msg, args, null);
            return;
        }
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> log.debug(msg, args);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, args);
            default -> log.error(msg, args);
        }
    }
    // [/🧩 Section: emitters]
}
