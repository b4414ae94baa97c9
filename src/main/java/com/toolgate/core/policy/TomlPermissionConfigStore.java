package com.toolgate.core.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.toolgate.core.model.InvalidPermissionException;
import com.toolgate.core.model.ToolPermission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores tool policy in a TOML file:
 * <pre>
 * [tools.bash]
 * permission = "ask-iterations"
 * allowlist = ["git status*", "ls *"]
 * denylist = ["rm -rf *"]
 * </pre>
 * Keys outside {@code tools.<name>.permission} are carried over untouched when the file is
 * rewritten. Writes go to a sibling temp file which is then moved over the original.
 */
public class TomlPermissionConfigStore implements PermissionConfigStore {

    private static final Logger log = LoggerFactory.getLogger(TomlPermissionConfigStore.class);

    private final Path file;
    private final TomlMapper mapper;

    public TomlPermissionConfigStore(Path file) {
        this.file = file;
        this.mapper = new TomlMapper();
    }

    @Override
    public Map<String, ToolRule> load() throws IOException {
        Map<String, ToolRule> rules = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            log.debug("Policy file {} does not exist; no tool rules configured", file);
            return rules;
        }

        JsonNode tools = readRoot().path("tools");
        if (!tools.isObject()) {
            return rules;
        }
        Iterator<Map.Entry<String, JsonNode>> it = tools.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String toolName = entry.getKey();
            JsonNode node = entry.getValue();
            if (!node.isObject()) {
                log.warn("Ignoring non-table entry tools.{} in {}", toolName, file);
                continue;
            }
            rules.put(toolName, new ToolRule(
                    parsePermission(toolName, node.path("permission")),
                    stringList(node.path("allowlist")),
                    stringList(node.path("denylist"))));
        }
        return rules;
    }

    @Override
    public void setPermission(String toolName, ToolPermission permission) throws IOException {
        ObjectNode root = Files.exists(file) ? readRoot() : mapper.createObjectNode();
        ObjectNode tools = root.path("tools").isObject()
                ? (ObjectNode) root.get("tools")
                : root.putObject("tools");
        ObjectNode tool = tools.path(toolName).isObject()
                ? (ObjectNode) tools.get(toolName)
                : tools.putObject(toolName);
        tool.put("permission", permission.configValue());

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), root);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote tools.{}.permission = {} to {}", toolName, permission.configValue(), file);
    }

    @Override
    public String location() {
        return file.toString();
    }

    private ObjectNode readRoot() throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            return mapper.createObjectNode();
        }
        return (ObjectNode) root;
    }

    private ToolPermission parsePermission(String toolName, JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return ToolPermission.ASK;
        }
        try {
            return ToolPermission.fromConfig(value.asText());
        } catch (InvalidPermissionException e) {
            log.warn("tools.{} in {}: {}; treating as ask", toolName, file, e.getMessage());
            return ToolPermission.ASK;
        }
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String text = item.asText("").trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }
}
