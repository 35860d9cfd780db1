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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.foreststate.storage.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DialogueSessionTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Instant T0 = Instant.parse("2026-05-01T09:00:00Z");

    @Test
    void testStart() {
        DialogueSession s = DialogueSession.start("d1", "p1", "learn piano", null, T0);

        assertTrue(s.isActive());
        assertEquals(0, s.currentRound());
        assertEquals(T0, s.startedAt());
        assertEquals(T0, s.lastUpdated());
        assertNull(s.completedAt());
        assertEquals(NODES.arrayNode().add("learn piano"), s.goalEvolution());
        assertEquals(NODES.objectNode(), s.context());
    }

    @Test
    void testWithResponse_AdvancesRound() {
        DialogueSession s = DialogueSession.start("d1", "p1", "learn piano", null, T0)
                .withResponse(NODES.textNode("evenings"), "which genre?", T0.plusSeconds(5))
                .withResponse(NODES.textNode("jazz"), null, T0.plusSeconds(9));

        assertEquals(2, s.currentRound());
        assertEquals(2, s.responses().size());
        assertNull(s.lastQuestion());
        assertEquals(T0.plusSeconds(9), s.lastUpdated());
        assertEquals(T0, s.startedAt());
    }

    @Test
    void testWithAssessment_RecordsGoalOnlyWhenChanged() {
        DialogueSession s = DialogueSession.start("d1", "p1", "learn piano", null, T0)
                .withAssessment(NODES.objectNode(), NODES.objectNode(), "learn jazz piano", T0)
                .withAssessment(NODES.objectNode(), NODES.objectNode(), "learn jazz piano", T0);

        assertEquals(NODES.arrayNode().add("learn piano").add("learn jazz piano"), s.goalEvolution());
        assertEquals("learn jazz piano", s.refinedGoal());
    }

    @Test
    void testCompleted() {
        DialogueSession s = DialogueSession.start("d1", "p1", "learn piano", null, T0)
                .withResponse(NODES.textNode("x"), "next?", T0.plusSeconds(1))
                .completed("play jazz standards", 0.8, T0.plusSeconds(2));

        assertEquals(DialogueStatus.COMPLETED, s.status());
        assertEquals(0.8, s.finalConfidence());
        assertEquals(T0.plusSeconds(2), s.completedAt());
        assertNull(s.lastQuestion());
    }

    @Test
    void testContextIsCopied() {
        ObjectNode context = NODES.objectNode().put("level", "beginner");
        DialogueSession s = DialogueSession.start("d1", "p1", "learn piano", context, T0);

        context.put("level", "expert");

        assertEquals("beginner", s.context().get("level").asText());
    }

    @Test
    void testValidation() {
        assertThrows(ValidationException.class,
                () -> DialogueSession.start("../d", "p1", "goal", null, T0));
        assertThrows(ValidationException.class,
                () -> DialogueSession.start("d1", "p1", "goal", null, T0).completed("g", 1.5, T0));
        assertThrows(NullPointerException.class,
                () -> DialogueSession.start("d1", "p1", null, null, T0));
    }

    @Test
    void testStatusColumnValues() {
        assertEquals("active", DialogueStatus.ACTIVE.columnValue());
        assertEquals(DialogueStatus.COMPLETED, DialogueStatus.fromColumn("Completed"));
        assertThrows(SessionStoreException.class, () -> DialogueStatus.fromColumn("archived"));
    }
}
