package com.toolgate.core.mode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WriteOperationClassifierTest {

    private static Map<String, Object> cmd(String command) {
        return Map.of("command", command);
    }

    @Nested
    @DisplayName("Tool lists")
    class ToolListTests {

        @Test
        @DisplayName("known write tools are writes regardless of arguments")
        void writeToolsAreWrites() {
            assertTrue(WriteOperationClassifier.isWriteOperation("write_file", Map.of("path", "a.txt")));
            assertTrue(WriteOperationClassifier.isWriteOperation("search_replace", Map.of()));
            assertTrue(WriteOperationClassifier.isWriteOperation("todo_write", Map.of()));
        }

        @Test
        @DisplayName("explicit read-only tools are reads")
        void readOnlyToolsAreReads() {
            assertFalse(WriteOperationClassifier.isWriteOperation("read_file", Map.of("path", "a.txt")));
            assertFalse(WriteOperationClassifier.isWriteOperation("grep", Map.of("pattern", "foo")));
            assertFalse(WriteOperationClassifier.isWriteOperation("git_diff", Map.of()));
        }

        @Test
        @DisplayName("unknown tools fail closed as writes")
        void unknownToolsAreWrites() {
            assertTrue(WriteOperationClassifier.isWriteOperation("deploy_to_prod", Map.of()));
            assertTrue(WriteOperationClassifier.isWriteOperation(null, Map.of()));
        }

        @Test
        @DisplayName("isReadOnlyTool is null-safe")
        void isReadOnlyToolNullSafe() {
            assertFalse(WriteOperationClassifier.isReadOnlyTool(null));
            assertTrue(WriteOperationClassifier.isReadOnlyTool("list_files"));
            assertFalse(WriteOperationClassifier.isReadOnlyTool("bash"));
        }
    }

    @Nested
    @DisplayName("Shell commands")
    class ShellCommandTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "ls -la", "cat README.md", "git status", "git log --oneline", "git diff HEAD~1",
                "pwd", "grep -n foo src", "echo hello", "wc -l build.log"
        })
        @DisplayName("read-only commands are reads")
        void readOnlyCommands(String command) {
            assertFalse(WriteOperationClassifier.isWriteOperation("bash", cmd(command)), command);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "rm -rf build", "mv a b", "echo hi > out.txt", "cat a >> b", "sed -i s/a/b/ f.txt",
                "chmod +x run.sh", "git push origin main", "git commit -m wip", "git checkout -b x",
                "curl -o out.bin https://example.com", "npm install left-pad", "pip install requests",
                "sudo ls", "ls | tee listing.txt", "cat ${IFS}x"
        })
        @DisplayName("mutating commands are writes")
        void writeCommands(String command) {
            assertTrue(WriteOperationClassifier.isWriteOperation("bash", cmd(command)), command);
        }

        @Test
        @DisplayName("unrecognised base commands fail closed")
        void unknownCommandIsWrite() {
            assertTrue(WriteOperationClassifier.isWriteCommand("python script.py"));
            assertTrue(WriteOperationClassifier.isWriteCommand("git frobnicate"));
        }

        @Test
        @DisplayName("empty or missing command is a read")
        void emptyCommandIsRead() {
            assertFalse(WriteOperationClassifier.isWriteOperation("bash", Map.of()));
            assertFalse(WriteOperationClassifier.isWriteOperation("bash", cmd("   ")));
        }

        @Test
        @DisplayName("command is found under alternative argument keys")
        void alternativeCommandKeys() {
            assertTrue(WriteOperationClassifier.isWriteOperation("run_command", Map.of("cmd", "rm x")));
            assertTrue(WriteOperationClassifier.isWriteOperation("shell", Map.of("CommandLine", "git push")));
        }
    }
}
