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
package dev.mars.foreststate.session;

import java.util.OptionalDouble;

/**
 * Session counts, for all projects or for one.
 *
 * @param total                      all sessions
 * @param active                     sessions still in progress
 * @param completed                  finished sessions
 * @param averageCompletedConfidence mean final confidence of completed sessions that report one
 */
public record DialogueStats(int total, int active, int completed, OptionalDouble averageCompletedConfidence) {

    public static final DialogueStats EMPTY = new DialogueStats(0, 0, 0, OptionalDouble.empty());
}
