package com.pie.workflow.load;

import com.pie.workflow.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowLoaderTest {

    private static final String DANGLING_JSON = """
            {"name":"dangling","nodes":[
              {"id":"a","image":"a.wasm"},
              {"id":"b","dependencies":["a","ghost"],"image":"b.wasm"},
              {"id":"c","dependencies":["phantom"],"image":"c.wasm"}
            ]}
            """;

    @TempDir
    Path tempDir;

    @Test
    void load_setsBaseDirectoryToWorkflowFolder() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("example-apps"));
        Path file = Files.writeString(dir.resolve("workflow_demo.json"),
                "{\"name\":\"demo\",\"nodes\":[{\"id\":\"a\",\"image\":\"a.wasm\"}]}");

        WorkflowDefinition workflow = new WorkflowLoader().load(file);

        assertEquals("demo", workflow.getName());
        assertEquals(dir.toAbsolutePath().normalize(), workflow.getBaseDirectory());
    }

    @Test
    void load_missingFileIsInvalid() {
        InvalidWorkflowException e = assertThrows(InvalidWorkflowException.class,
                () -> new WorkflowLoader().load(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("not found"), e.getMessage());
    }

    @Test
    void load_lazyModeAcceptsDanglingDependencies() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dangling.json"), DANGLING_JSON);

        WorkflowDefinition workflow = new WorkflowLoader(false).load(file);

        assertEquals(3, workflow.getNodes().size());
    }

    @Test
    void load_eagerModeRejectsDanglingDependencies() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dangling.json"), DANGLING_JSON);

        InvalidWorkflowException e = assertThrows(InvalidWorkflowException.class,
                () -> new WorkflowLoader(true).load(file));
        assertTrue(e.getMessage().contains("ghost"), e.getMessage());
        assertTrue(e.getMessage().contains("phantom"), e.getMessage());
    }

    @Test
    void danglingDependencies_listsOnlyUnknownIdsPerNode() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dangling.json"), DANGLING_JSON);
        WorkflowDefinition workflow = new WorkflowLoader().load(file);

        Map<String, List<String>> dangling = WorkflowValidator.danglingDependencies(workflow);

        assertEquals(Map.of("b", List.of("ghost"), "c", List.of("phantom")), dangling);
    }
}
