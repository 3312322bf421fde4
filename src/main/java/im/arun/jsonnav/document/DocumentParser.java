package im.arun.jsonnav.document;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.util.FileSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes JSON input into a {@link JsonDocument} with Jackson, enforcing the
 * configured size and nesting-depth caps.
 */
public class DocumentParser {
    private static final Logger logger = LoggerFactory.getLogger(DocumentParser.class);

    private final JsonMapper mapper;
    private final long maxDocumentBytes;
    private final int maxDepth;

    public DocumentParser(JsonNavConfig config) {
        this.maxDocumentBytes = config.getMaxDocumentBytes();
        this.maxDepth = config.getMaxDepth();

        JsonFactoryBuilder factoryBuilder = new JsonFactoryBuilder();
        factoryBuilder.streamReadConstraints(StreamReadConstraints.builder()
            .maxNestingDepth(maxDepth)
            .maxStringLength((int) Math.min(Integer.MAX_VALUE, maxDocumentBytes))
            .build());
        if (config.isAllowComments()) {
            factoryBuilder.enable(JsonReadFeature.ALLOW_JAVA_COMMENTS);
        }
        if (config.isAllowTrailingCommas()) {
            factoryBuilder.enable(JsonReadFeature.ALLOW_TRAILING_COMMA);
        }

        this.mapper = JsonMapper.builder(factoryBuilder.build())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * Parses a file. The size cap is checked from the file size before anything is read.
     *
     * @throws DocumentTooLargeException if the file exceeds the size cap
     * @throws DocumentParseException    if the content is not valid JSON or nests too deeply
     * @throws IOException               if the file cannot be read
     */
    public JsonDocument parse(Path file) throws IOException {
        long size = Files.size(file);
        checkSize(size);

        logger.info("Opening JSON document: {}, size: {}", file, FileSizes.readable(size));
        long start = System.currentTimeMillis();
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw translate(file.toString(), e);
        }
        JsonDocument document = toDocument(root, file.toString(), size);
        logger.info("Parsed {} in {} ms", file, System.currentTimeMillis() - start);
        return document;
    }

    /**
     * Parses in-memory content.
     *
     * @param sourceName name used in logs and journals
     */
    public JsonDocument parse(byte[] content, String sourceName) {
        checkSize(content.length);

        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw translate(sourceName, e);
        } catch (IOException e) {
            throw new DocumentParseException(DocumentParseException.Reason.MALFORMED,
                "Failed to read " + sourceName + ": " + e.getMessage(), -1, e);
        }
        return toDocument(root, sourceName, content.length);
    }

    /**
     * Checks that a file holds a well-formed document within the caps.
     */
    public boolean validate(Path file) {
        try {
            parse(file);
            return true;
        } catch (DocumentParseException e) {
            logger.debug("Validation failed for {}: {}", file, e.getMessage());
            return false;
        } catch (IOException e) {
            logger.error("Error while validating JSON file: {}", file, e);
            return false;
        }
    }

    private void checkSize(long size) {
        if (size > maxDocumentBytes) {
            logger.warn("Refusing document of {} (limit {})", FileSizes.readable(size), FileSizes.readable(maxDocumentBytes));
            throw new DocumentTooLargeException(size, maxDocumentBytes);
        }
    }

    private JsonDocument toDocument(JsonNode root, String sourceName, long size) {
        if (root == null || root.isMissingNode()) {
            throw new DocumentParseException(DocumentParseException.Reason.MALFORMED,
                "Document " + sourceName + " is empty", 0, null);
        }
        return new JsonDocument(root, sourceName, size);
    }

    private DocumentParseException translate(String sourceName, JsonProcessingException e) {
        long offset = offsetOf(e.getLocation());
        if (isDepthViolation(e)) {
            logger.error("JSON nesting too deep in {} (limit {})", sourceName, maxDepth);
            return new DocumentParseException(DocumentParseException.Reason.DEPTH_EXCEEDED,
                "Document nesting exceeds the maximum depth of " + maxDepth, offset, e);
        }
        logger.error("JSON format error in {}: {}", sourceName, e.getOriginalMessage());
        return new DocumentParseException(DocumentParseException.Reason.MALFORMED,
            "JSON format error: " + e.getOriginalMessage(), offset, e);
    }

    private static boolean isDepthViolation(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StreamConstraintsException
                && t.getMessage() != null
                && t.getMessage().toLowerCase(Locale.ROOT).contains("depth")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static long offsetOf(JsonLocation location) {
        if (location == null) {
            return -1;
        }
        if (location.getByteOffset() >= 0) {
            return location.getByteOffset();
        }
        return location.getCharOffset();
    }
}
