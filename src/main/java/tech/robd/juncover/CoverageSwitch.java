/*
 [File Info]
 path: src/main/java/tech/robd/juncover/CoverageSwitch.java
 description: Process-wide on/off switch for mark bookkeeping, resolved once from `juncover.enabled`
              (true/false/auto, auto follows the JVM assertion status).
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
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

package tech.robd.juncover;

import org.jspecify.annotations.Nullable;
import tech.robd.juncover.diagnostics.Diagnostics;

import java.util.Locale;

/**
 * Global switch deciding whether the {@link CoverageState#global() global state} does real
 * bookkeeping or is inert.
 *
 * <p>The value is read once from the system property {@value #PROPERTY_NAME}:
 * <ul>
 *   <li>{@code true} – always active,</li>
 *   <li>{@code false} – always inert,</li>
 *   <li>{@code auto} (default) – active iff assertions are enabled for this package
 *       ({@code -ea}), which mirrors the usual "checks on in test builds, off in production" split.</li>
 * </ul>
 * Any other value is logged as an error and treated as {@code auto}.
 *
 * <p>{@link #ENABLED} is a {@code static final} constant, so guarded call sites such as
 * {@link Uncover#mark(String)} are folded away by the JIT when the switch is off.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class CoverageSwitch {

    // 🧩 Section: constants
    private static final Diagnostics DIAG = Diagnostics.of(CoverageSwitch.class);

    /**
     * System property controlling the switch: {@code -Djuncover.enabled=true|false|auto}.
     */
    public static final String PROPERTY_NAME = "juncover.enabled";

    /**
     * Resolved once at class initialisation; never changes for the life of the JVM.
     */
    public static final boolean ENABLED =
            resolve(System.getProperty(PROPERTY_NAME), CoverageSwitch.class.desiredAssertionStatus());
    // [/🧩 Section: constants]

    private CoverageSwitch() {
        // no instances
    }

    // 🧩 Section: resolution

    /**
     * Resolve a raw property value into the switch state.
     *
     * @param raw               property value, {@code null} when unset
     * @param assertionsEnabled JVM assertion status used for {@code auto}
     * @return whether bookkeeping should be active; an unrecognised value falls back to {@code auto}
     */
    static boolean resolve(@Nullable String raw, boolean assertionsEnabled) {
        if (raw == null) return assertionsEnabled;
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "":
            case "auto":
                return assertionsEnabled;
            case "true":
                return true;
            case "false":
                return false;
            default:
                DIAG.error("{} must be one of true, false, auto but was '{}'; using auto (enabled={})",
                        PROPERTY_NAME, raw, assertionsEnabled);
                return assertionsEnabled;
        }
    }
    // [/🧩 Section: resolution]
}
