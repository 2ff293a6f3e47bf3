/*
 [File Info]
 path: src/main/java/tech/robd/juncover/diagnostics/Diagnostics.java
 description: Owner-bound logging facade used by the mark/check engine. Forwards to DiagnosticsBackend (SLF4J).
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

/**
 * Small logging facade bound to an owning {@link Class}.
 * <p>
 * Debug and warn output is gated by the {@code juncover.diag} switch so scope bookkeeping
 * stays quiet in normal test runs. Error output always reaches SLF4J: it is reserved for
 * misuse of the check API, which must never go unnoticed.
 * </p>
 */
public final class Diagnostics {

    // 🧩 Section: state
    private final Class<?> owner;
    // [/🧩 Section: state]

    private Diagnostics(Class<?> owner) {
        this.owner = owner;
    }

    /**
     * @param owner the class whose logger receives the output
     * @return a diagnostics instance routed to {@code owner}'s logger
     */
    public static Diagnostics of(Class<?> owner) {
        if (owner == null) throw new IllegalArgumentException("Owner cannot be null");
        return new Diagnostics(owner);
    }

    /**
     * @return the owning class
     */
    public Class<?> owner() {
        return owner;
    }

    // 🧩 Section: forwarding
    public void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner, msg, args);
    }

    public void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner, msg, args);
    }

    /**
     * Emit an error. Not gated by the diagnostics switch.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments for {@code msg}
     */
    public void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner, msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: enablement

    /**
     * Turn gated output on until {@link #disableAll()} or JVM exit.
     */
    public static void enableAll() {
        DiagnosticsBackend.enable();
    }

    /**
     * Turn gated output off.
     */
    public static void disableAll() {
        DiagnosticsBackend.disable();
    }
    // [/🧩 Section: enablement]
}
