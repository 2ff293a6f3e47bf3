/*
 [File Info]
 path: src/test/java/tech/robd/juncover/examples/DateParser.java
 description: Sample instrumented code: a yyyy-mm-dd parser marking its rejection branches.
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

package tech.robd.juncover.examples;

import org.jspecify.annotations.Nullable;
import tech.robd.juncover.Uncover;

/**
 * Parses {@code yyyy-mm-dd}. Each early rejection is marked so tests can prove they reach it.
 */
public final class DateParser {

    public record DateParts(int year, int month, int day) {
    }

    private DateParser() {
    }

    public static @Nullable DateParts parse(String s) {
        if (s.length() != 10) {
            Uncover.mark("short date");
            return null;
        }
        if (s.charAt(4) != '-' || s.charAt(7) != '-') {
            Uncover.mark("wrong dashes");
            return null;
        }
        try {
            return new DateParts(
                    Integer.parseInt(s.substring(0, 4)),
                    Integer.parseInt(s.substring(5, 7)),
                    Integer.parseInt(s.substring(8, 10)));
        } catch (NumberFormatException e) {
            Uncover.mark("bad digits");
            return null;
        }
    }
}
