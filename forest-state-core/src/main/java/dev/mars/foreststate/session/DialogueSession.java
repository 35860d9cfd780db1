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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.foreststate.storage.Identifiers;
import dev.mars.foreststate.storage.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A goal-clarification dialogue between the user and the planner.
 * <p>
 * Instances are immutable values: JSON members are deep-copied on construction and
 * must not be modified through the accessors. Use the {@code with*} helpers to derive
 * the next state and save it again; saving the same value twice is a no-op.
 *
 * @param id               session id
 * @param projectId        owning project
 * @param originalGoal     goal as first stated by the user
 * @param context          free-form context captured at start
 * @param status           lifecycle state
 * @param startedAt        creation time
 * @param completedAt      completion time, null while active
 * @param currentRound     number of answered questions
 * @param responses        answers in the order they were given
 * @param uncertaintyMap   open uncertainties by topic
 * @param confidenceLevels confidence by topic
 * @param refinedGoal      clarified goal, null until known
 * @param finalConfidence  confidence in the refined goal, null while active
 * @param goalEvolution    successive formulations of the goal
 * @param lastQuestion     question awaiting an answer, null if none
 * @param lastUpdated      time of the last change
 */
public record DialogueSession(
        String id,
        String projectId,
        String originalGoal,
        JsonNode context,
        DialogueStatus status,
        Instant startedAt,
        Instant completedAt,
        int currentRound,
        List<JsonNode> responses,
        JsonNode uncertaintyMap,
        JsonNode confidenceLevels,
        String refinedGoal,
        Double finalConfidence,
        JsonNode goalEvolution,
        String lastQuestion,
        Instant lastUpdated) {

    /** Most recently started first; ties broken by id. */
    public static final Comparator<DialogueSession> NEWEST_FIRST =
            Comparator.comparing(DialogueSession::startedAt).reversed()
                    .thenComparing(DialogueSession::id);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public DialogueSession {
        Identifiers.requireSessionId(id);
        Identifiers.requireProjectId(projectId);
        Objects.requireNonNull(originalGoal, "originalGoal");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        if (currentRound < 0) {
            throw new ValidationException("currentRound must not be negative: " + currentRound);
        }
        if (finalConfidence != null) {
            requireConfidence(finalConfidence);
        }
        context = copyOr(context, NODES.objectNode());
        uncertaintyMap = copyOr(uncertaintyMap, NODES.objectNode());
        confidenceLevels = copyOr(confidenceLevels, NODES.objectNode());
        goalEvolution = copyOr(goalEvolution, NODES.arrayNode());
        List<JsonNode> copied = new ArrayList<>();
        if (responses != null) {
            for (JsonNode response : responses) {
                copied.add(Objects.requireNonNull(response, "response").deepCopy());
            }
        }
        responses = List.copyOf(copied);
    }

    /**
     * Starts a new active session whose goal history holds the original goal.
     */
    public static DialogueSession start(String id, String projectId, String originalGoal,
                                        JsonNode context, Instant now) {
        ArrayNode evolution = NODES.arrayNode().add(originalGoal);
        return new DialogueSession(id, projectId, originalGoal, context, DialogueStatus.ACTIVE, now, null,
                0, List.of(), null, null, null, null, evolution, null, now);
    }

    /**
     * Records an answer and the follow-up question, advancing the round.
     *
     * @param nextQuestion question to ask next, or null when none is pending
     */
    public DialogueSession withResponse(JsonNode response, String nextQuestion, Instant now) {
        Objects.requireNonNull(response, "response");
        List<JsonNode> next = new ArrayList<>(responses);
        next.add(response);
        return new DialogueSession(id, projectId, originalGoal, context, status, startedAt, completedAt,
                currentRound + 1, next, uncertaintyMap, confidenceLevels, refinedGoal, finalConfidence,
                goalEvolution, nextQuestion, now);
    }

    /**
     * Replaces the uncertainty and confidence assessments and, when the goal was
     * reformulated, appends it to the goal history.
     */
    public DialogueSession withAssessment(JsonNode uncertainties, JsonNode confidences, String refined, Instant now) {
        JsonNode evolution = goalEvolution;
        if (refined != null && !lastGoal().equals(refined)) {
            ArrayNode grown = goalEvolution.isArray() ? (ArrayNode) goalEvolution.deepCopy() : NODES.arrayNode();
            grown.add(refined);
            evolution = grown;
        }
        return new DialogueSession(id, projectId, originalGoal, context, status, startedAt, completedAt,
                currentRound, responses, uncertainties, confidences, refined != null ? refined : refinedGoal,
                finalConfidence, evolution, lastQuestion, now);
    }

    /**
     * Completes the session with the clarified goal.
     */
    public DialogueSession completed(String refined, double confidence, Instant now) {
        Objects.requireNonNull(refined, "refined");
        return new DialogueSession(id, projectId, originalGoal, context, DialogueStatus.COMPLETED, startedAt, now,
                currentRound, responses, uncertaintyMap, confidenceLevels, refined, confidence,
                goalEvolution, null, now);
    }

    public boolean isActive() {
        return status == DialogueStatus.ACTIVE;
    }

    private String lastGoal() {
        if (goalEvolution.isArray() && goalEvolution.size() > 0) {
            return goalEvolution.get(goalEvolution.size() - 1).asText();
        }
        return refinedGoal != null ? refinedGoal : originalGoal;
    }

    private static JsonNode copyOr(JsonNode value, JsonNode fallback) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return fallback;
        }
        return value.deepCopy();
    }

    /**
     * Rejects a confidence outside [0, 1], NaN included.
     *
     * @throws ValidationException if the value is out of range
     */
    static double requireConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("finalConfidence must be within [0, 1]: " + confidence);
        }
        return confidence;
    }
}
