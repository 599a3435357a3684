package info.isaksson.erland.recordnames.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON reading/writing for name requests and resolved names.
 *
 * <p>Writing is deterministic: stable property order, sorted map keys, fixed indentation and a trailing newline.</p>
 */
public final class NameJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();
    private static final TypeReference<List<NameRequest>> REQUESTS = new TypeReference<>() {};

    private NameJson() {}

    public static List<NameRequest> readRequests(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, REQUESTS);
        }
    }

    public static List<NameRequest> readRequestsFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, REQUESTS);
    }

    public static TypeDescriptor readDescriptor(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, TypeDescriptor.class);
    }

    /** Serializes any value of this package (or a list/map of them). */
    public static String toJsonString(Object value) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(value) + "\n";
    }

    public static void write(Object value, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJsonString(value));
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
