/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.foreststate.storage;

import java.util.regex.Pattern;

/**
 * Validation rules shared by project ids, path segments and session ids.
 */
public final class Identifiers {

    /** Letters, digits, dot, underscore, dash; must start with a letter or digit. */
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    /** Suffix reserved for in-flight writes. */
    static final String TEMP_SUFFIX = ".tmp";

    private Identifiers() {
    }

    /**
     * Validates a project id.
     *
     * @return the id, unchanged
     * @throws ValidationException if the id is null or malformed
     */
    public static String requireProjectId(String projectId) {
        return requireSegment(projectId, "projectId");
    }

    /**
     * Validates a dialogue session id.
     *
     * @return the id, unchanged
     * @throws ValidationException if the id is null or malformed
     */
    public static String requireSessionId(String sessionId) {
        return requireSegment(sessionId, "sessionId");
    }

    /**
     * Validates a {@code /}-separated relative path.
     *
     * @return the path, unchanged
     * @throws ValidationException if the path is absolute, empty, escapes its
     *                             project or names a temp file
     */
    public static String requireRelativePath(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            throw new ValidationException("relativePath must not be empty");
        }
        if (relativePath.startsWith("/") || relativePath.endsWith("/")) {
            throw new ValidationException("relativePath must be relative without trailing slash: " + relativePath);
        }
        for (String segment : relativePath.split("/", -1)) {
            requireSegment(segment, "relativePath segment");
            if (segment.endsWith(TEMP_SUFFIX)) {
                throw new ValidationException("relativePath must not name a temp file: " + relativePath);
            }
        }
        return relativePath;
    }

    private static String requireSegment(String value, String what) {
        if (value == null) {
            throw new ValidationException(what + " must not be null");
        }
        if (!SEGMENT.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new ValidationException("Invalid " + what + ": '" + value + "'");
        }
        return value;
    }
}
