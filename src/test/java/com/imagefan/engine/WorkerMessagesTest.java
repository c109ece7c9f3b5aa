package com.imagefan.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerMessagesTest {

    @Test
    void startPayloadCarriesSourcePathAndName() throws Exception {
        WorkItem item = new WorkItem(Path.of("input-images", "sample-1.jpg"), "sample-1");

        String json = WorkerMessages.encodeStart(item);
        WorkItem decoded = WorkerMessages.decodeStart(json);

        assertTrue(json.contains("\"sourcePath\""));
        assertTrue(json.contains("\"name\":\"sample-1\""));
        assertEquals(item.sourcePath, decoded.sourcePath);
        assertEquals("sample-1", decoded.name);
    }

    @Test
    void startPayloadWithoutNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkerMessages.decodeStart("{\"sourcePath\":\"/tmp/a.jpg\"}"));
        assertThrows(JsonProcessingException.class,
                () -> WorkerMessages.decodeStart("not json"));
    }

    @Test
    void successMessageMatchesTheWireShape() {
        String json = WorkerMessages.encodeCompletion(WorkOutcome.succeeded("sample-1"));

        assertEquals("{\"success\":true,\"filename\":\"sample-1\"}", json);
    }

    @Test
    void completionIsTheLastJsonLineOfStdout() {
        String failure = WorkerMessages.encodeCompletion(WorkOutcome.failed("b",
                new WorkFailure(Stage.WRITE, "medium", "disk full")));
        String stdout = "some banner\n"
                + "{\"unrelated\":1}\n"
                + failure + "\n"
                + "\n";

        WorkOutcome outcome = WorkerMessages.findCompletion(stdout);

        assertNotNull(outcome);
        assertEquals("b", outcome.name);
        assertEquals(Stage.WRITE, outcome.error.stage);
        assertEquals("medium", outcome.error.variant);
        assertEquals("disk full", outcome.error.message);
    }

    @Test
    void noCompletionWhenStdoutHasNone() {
        assertNull(WorkerMessages.findCompletion(""));
        assertNull(WorkerMessages.findCompletion("Exception in thread \"main\"\n{broken"));
    }

    @Test
    void failureWithoutStageIsAttributedToTheWorker() {
        WorkOutcome outcome = WorkerMessages.findCompletion("{\"success\":false,\"filename\":\"c\"}");

        assertNotNull(outcome);
        assertEquals(Stage.WORKER, outcome.error.stage);
    }
}
