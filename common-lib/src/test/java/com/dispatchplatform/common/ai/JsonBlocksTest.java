package com.dispatchplatform.common.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonBlocksTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("finds the block inside prose and code fences")
    void extractsWrappedBlock() {
        String reply = "Here is the analysis:\n```json\n{\"hasIncident\": true, \"location\": \"Fulton St\"}\n```\nDone.";
        Optional<JsonNode> node = JsonBlocks.extract(reply, objectMapper);
        assertTrue(node.isPresent());
        assertTrue(node.get().path("hasIncident").asBoolean());
        assertEquals("Fulton St", JsonBlocks.text(node.get(), "location"));
    }

    @Test
    @DisplayName("missing or malformed blocks yield empty")
    void malformed() {
        assertTrue(JsonBlocks.extract("no structured data here", objectMapper).isEmpty());
        assertTrue(JsonBlocks.extract("{\"hasIncident\": tru", objectMapper).isEmpty());
        assertTrue(JsonBlocks.extract("{not json at all}", objectMapper).isEmpty());
        assertTrue(JsonBlocks.extract(null, objectMapper).isEmpty());
    }

    @Test
    @DisplayName("text() treats null and blank fields as absent")
    void textHelper() throws Exception {
        JsonNode node = objectMapper.readTree("{\"a\": null, \"b\": \"  \", \"c\": \"x\"}");
        assertNull(JsonBlocks.text(node, "a"));
        assertNull(JsonBlocks.text(node, "b"));
        assertNull(JsonBlocks.text(node, "missing"));
        assertEquals("x", JsonBlocks.text(node, "c"));
    }
}
