package work.typedcss.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.typedcss.model.Position;

/**
 * Read-only view of a version 3 source map, enough to trace generated positions back to the dialect source.
 */
public final class SourceMap {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private final List<String> sources;
    private final List<List<Segment>> lines;

    private SourceMap(List<String> sources, List<List<Segment>> lines) {
        this.sources = sources;
        this.lines = lines;
    }

    /** Generated column (0-based) mapped to a source index and 0-based original line/column. */
    private record Segment(int generatedColumn, int source, int line, int column) {}

    public record Mapping(String source, Position position) {}

    public static SourceMap parse(String json) throws IOException {
        JsonNode root = JSON.readTree(json);
        if (root == null || root.path("version").asInt() != 3) {
            throw new IOException("Unsupported source map version");
        }
        String sourceRoot = root.path("sourceRoot").asText("");
        var sources = new ArrayList<String>();
        for (JsonNode source : root.path("sources")) {
            String name = source.asText("");
            if (!sourceRoot.isEmpty() && !name.startsWith("/") && !name.contains(":")) {
                name = sourceRoot.endsWith("/") ? sourceRoot + name : sourceRoot + "/" + name;
            }
            sources.add(name);
        }
        return new SourceMap(List.copyOf(sources), decode(root.path("mappings").asText("")));
    }

    public List<String> sources() {
        return sources;
    }

    /**
     * Original position of a 1-based generated position: the closest mapped segment at or before it on the same line.
     */
    public Optional<Mapping> originalPositionFor(Position generated) {
        int lineIndex = generated.line() - 1;
        if (lineIndex >= lines.size()) {
            return Optional.empty();
        }
        Segment best = null;
        for (Segment segment : lines.get(lineIndex)) {
            if (segment.generatedColumn() > generated.column() - 1) {
                break;
            }
            if (segment.source() >= 0) {
                best = segment;
            }
        }
        if (best == null || best.source() >= sources.size()) {
            return Optional.empty();
        }
        return Optional.of(new Mapping(sources.get(best.source()), new Position(best.line() + 1, best.column() + 1)));
    }

    private static List<List<Segment>> decode(String mappings) throws IOException {
        var lines = new ArrayList<List<Segment>>();
        int source = 0;
        int line = 0;
        int column = 0;
        for (String group : mappings.split(";", -1)) {
            var segments = new ArrayList<Segment>();
            int generatedColumn = 0;
            for (String raw : group.split(",")) {
                if (raw.isEmpty()) {
                    continue;
                }
                int[] fields = decodeVlq(raw);
                generatedColumn += fields[0];
                if (fields.length >= 4) {
                    source += fields[1];
                    line += fields[2];
                    column += fields[3];
                    segments.add(new Segment(generatedColumn, source, line, column));
                } else {
                    segments.add(new Segment(generatedColumn, -1, -1, -1));
                }
            }
            segments.sort((a, b) -> Integer.compare(a.generatedColumn(), b.generatedColumn()));
            lines.add(segments);
        }
        return lines;
    }

    private static int[] decodeVlq(String segment) throws IOException {
        var values = new ArrayList<Integer>(5);
        int value = 0;
        int shift = 0;
        for (int i = 0; i < segment.length(); i++) {
            int digit = BASE64.indexOf(segment.charAt(i));
            if (digit < 0) {
                throw new IOException("Invalid base64 digit '" + segment.charAt(i) + "' in source map");
            }
            value += (digit & 31) << shift;
            if ((digit & 32) != 0) {
                shift += 5;
                continue;
            }
            boolean negative = (value & 1) == 1;
            value >>>= 1;
            values.add(negative ? -value : value);
            value = 0;
            shift = 0;
        }
        if (shift != 0) {
            throw new IOException("Truncated VLQ segment '" + segment + "' in source map");
        }
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
