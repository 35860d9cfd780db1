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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * Encodes documents as UTF-8, pretty-printed JSON.
 * <p>
 * Stored files stay human-readable so operators can inspect and repair them by hand.
 */
public final class DocumentCodec {

    private final ObjectMapper mapper;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** The mapper used for encoding; shared with callers that build documents from POJOs. */
    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Encodes a document.
     *
     * @throws ValidationException if the tree cannot be serialized
     */
    public byte[] encode(JsonNode document) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Document cannot be encoded: " + e.getOriginalMessage());
        }
    }

    /**
     * Decodes committed bytes.
     *
     * @throws IOException if the bytes are not a JSON document
     */
    public JsonNode decode(byte[] bytes) throws IOException {
        JsonNode node = mapper.readTree(bytes);
        if (node == null || node.isMissingNode()) {
            throw new IOException("empty document");
        }
        return node;
    }

    /** Converts a POJO into a document tree. */
    public JsonNode toDocument(Object value) {
        return mapper.valueToTree(value);
    }

    /**
     * Converts a document tree into a POJO.
     *
     * @throws ValidationException if the document does not fit the type
     */
    public <T> T fromDocument(JsonNode document, Class<T> type) {
        try {
            return mapper.treeToValue(document, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Document does not match " + type.getSimpleName()
                    + ": " + e.getOriginalMessage());
        }
    }
}
