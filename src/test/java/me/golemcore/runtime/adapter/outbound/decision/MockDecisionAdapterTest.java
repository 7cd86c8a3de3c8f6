package me.golemcore.runtime.adapter.outbound.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.MessageRole;
import me.golemcore.runtime.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MockDecisionAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final List<ToolDefinition> CATALOG = List.of(
            ToolDefinition.simple("calculator", "math"),
            ToolDefinition.simple("file_read", "read"));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MockDecisionAdapter adapter = new MockDecisionAdapter(objectMapper);

    private JsonNode decide(List<Message> transcript, List<ToolDefinition> catalog) throws Exception {
        String raw = adapter.decide(new DecisionRequest("s1", 0, transcript, catalog)).get();
        return objectMapper.readTree(raw);
    }

    private static List<Message> task(String text) {
        List<Message> transcript = new ArrayList<>();
        transcript.add(Message.system("system", NOW));
        transcript.add(Message.user(text, NOW));
        return transcript;
    }

    @Test
    void shouldAskCalculatorForArithmetic() throws Exception {
        JsonNode action = decide(task("What is 23*19? Use the calculator tool."), CATALOG);

        assertEquals("tool", action.get("action").asText());
        assertEquals("calculator", action.get("tool").asText());
        assertEquals("23*19", action.get("args").get("expression").asText());
    }

    @Test
    void shouldAskFileReadForFileTasks() throws Exception {
        JsonNode action = decide(task("Please read the file notes/todo.txt"), CATALOG);

        assertEquals("file_read", action.get("tool").asText());
        assertEquals("notes/todo.txt", action.get("args").get("path").asText());
    }

    @Test
    void shouldAnswerFromObservation() throws Exception {
        List<Message> transcript = task("What is 23*19?");
        transcript.add(Message.builder().role(MessageRole.ASSISTANT).content("{}").timestamp(NOW).build());
        transcript.add(Message.builder().role(MessageRole.TOOL_OBSERVATION).toolName("calculator")
                .content("437").timestamp(NOW).build());

        JsonNode action = decide(transcript, CATALOG);

        assertEquals("final", action.get("action").asText());
        assertEquals("The result is 437.", action.get("content").asText());
    }

    @Test
    void shouldAdmitFailureAfterErrorObservation() throws Exception {
        List<Message> transcript = task("What is 1/0?");
        transcript.add(Message.builder().role(MessageRole.TOOL_OBSERVATION).toolName("calculator")
                .content("Error [execution_failed]: Invalid expression: division by zero")
                .errorCode("execution_failed").timestamp(NOW).build());

        JsonNode action = decide(transcript, CATALOG);

        assertTrue(action.get("content").asText().startsWith("I could not complete the task."));
    }

    @Test
    void shouldReplyWithoutToolWhenNoneFits() throws Exception {
        JsonNode action = decide(task("Tell me a joke"), CATALOG);

        assertEquals("final", action.get("action").asText());
        assertEquals(MockDecisionAdapter.NO_TOOL_REPLY, action.get("content").asText());
    }

    @Test
    void shouldNotRequestToolMissingFromCatalog() throws Exception {
        JsonNode action = decide(task("What is 2+2?"), List.of());

        assertEquals("final", action.get("action").asText());
    }

    @Test
    void shouldFindExpressionsInText() {
        assertEquals(Optional.of("(2+3)*4"), MockDecisionAdapter.findExpression("Compute (2+3)*4 please."));
        assertEquals(Optional.of("23 * 19"), MockDecisionAdapter.findExpression("What is 23 * 19?"));
        assertEquals(Optional.empty(), MockDecisionAdapter.findExpression("Version 2 of the app"));
    }
}
