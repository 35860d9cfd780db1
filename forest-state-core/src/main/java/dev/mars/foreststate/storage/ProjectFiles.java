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
 * Well-known document names inside a project directory.
 */
public final class ProjectFiles {

    public static final String CONFIG = "config.json";
    public static final String HTA = "hta.json";
    public static final String LEARNING_HISTORY = "learning-history.json";
    public static final String DAILY_SCHEDULE = "daily-schedule.json";
    public static final String COMPLETION_LOG = "completion-log.json";
    public static final String STRATEGY_EVOLUTION = "strategy-evolution.json";
    public static final String METADATA = "metadata.json";

    /** Learning path used when a project has not defined any. */
    public static final String DEFAULT_PATH = "general";

    private ProjectFiles() {
    }
}
