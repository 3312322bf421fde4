package im.arun.jsonnav.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.jsonnav.model.LazyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts the materialized part of a lazy tree back into JSON.
 * Containers whose children are not loaded are written as empty containers.
 */
public class TreeSerializer {
    private static final Logger logger = LoggerFactory.getLogger(TreeSerializer.class);

    private final ObjectMapper mapper;

    public TreeSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public JsonNode toJsonNode(LazyNode node) {
        switch (node.getKind()) {
            case OBJECT: {
                ObjectNode object = JsonNodeFactory.instance.objectNode();
                for (LazyNode child : node.getChildren()) {
                    object.set(child.getKey(), toJsonNode(child));
                }
                return object;
            }
            case ARRAY: {
                ArrayNode array = JsonNodeFactory.instance.arrayNode();
                for (LazyNode child : node.getChildren()) {
                    array.add(toJsonNode(child));
                }
                return array;
            }
            default:
                JsonNode value = node.getLeafValue();
                return value == null ? NullNode.getInstance() : value;
        }
    }

    public String toJson(LazyNode node) {
        try {
            return mapper.writeValueAsString(toJsonNode(node));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize tree at " + node.getPath(), e);
        }
    }

    public void writeTo(LazyNode node, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(output.toFile(), toJsonNode(node));
        logger.info("Tree saved to: {}", output);
    }
}
