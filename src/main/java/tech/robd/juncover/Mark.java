/*
 [File Info]
 path: src/main/java/tech/robd/juncover/Mark.java
 description: Handle to a named instrumentation point; identity is the name, obtained idempotently from MarkRegistry.
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

import java.util.Objects;

/**
 * A named instrumentation point.
 * <p>
 * Handles come from {@link MarkRegistry#register(String)}; registering the same name again returns
 * this same instance. The name is the only payload and is kept verbatim, so it can be found by a
 * plain text search of the sources.
 * </p>
 *
 * <pre>{@code
 * private static final Mark FAST_PATH = Uncover.register("fast-path");
 * ...
 * FAST_PATH.hit();
 * }</pre>
 */
public final class Mark {

    private final String name;
    private final CoverageState state;

    Mark(String name, CoverageState state) {
        this.name = name;
        this.state = state;
    }

    public String name() {
        return name;
    }

    /**
     * Record one execution of this point on the calling thread. Never throws.
     */
    public void hit() {
        state.hit(name);
    }

    @Override
    public String toString() {
        return "Mark[" + name + "]";
    }

    static String requireValidName(String name) {
        Objects.requireNonNull(name, "Mark name cannot be null");
        if (name.isBlank()) throw new IllegalArgumentException("Mark name cannot be blank");
        return name;
    }
}
