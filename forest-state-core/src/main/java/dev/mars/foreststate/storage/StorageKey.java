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

/**
 * Address of one stored document: a project and a path inside it.
 * <p>
 * Both parts are validated on construction, so a key that exists is always
 * safe to resolve against the data directory.
 *
 * @param projectId    owning project
 * @param relativePath {@code /}-separated path inside the project directory
 */
public record StorageKey(String projectId, String relativePath) {

    /** Directory that holds path-scoped documents. */
    public static final String PATHS_DIR = "paths";

    public StorageKey {
        Identifiers.requireProjectId(projectId);
        Identifiers.requireRelativePath(relativePath);
    }

    /** Key for a project-level document such as {@code config.json}. */
    public static StorageKey of(String projectId, String relativePath) {
        return new StorageKey(projectId, relativePath);
    }

    /**
     * Key for a document scoped to one learning path of a project,
     * stored as {@code paths/<pathName>/<fileName>}.
     */
    public static StorageKey pathScoped(String projectId, String pathName, String fileName) {
        Identifiers.requireRelativePath(pathName);
        Identifiers.requireRelativePath(fileName);
        return new StorageKey(projectId, PATHS_DIR + "/" + pathName + "/" + fileName);
    }

    /** Last segment of the path. */
    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    @Override
    public String toString() {
        return projectId + ":" + relativePath;
    }
}
