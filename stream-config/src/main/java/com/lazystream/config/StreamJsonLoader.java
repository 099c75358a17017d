package com.lazystream.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lazystream.core.Combinator;
import com.lazystream.core.FiniteStream;
import com.lazystream.core.InfiniteStream;
import com.lazystream.core.Ops;
import com.lazystream.core.SourceResolver;
import com.lazystream.core.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a stream from a JSON definition:
 *
 * <pre>{@code
 * {
 *   "stream": "evens",
 *   "source": { "values": [1, 2, 3, 4, 5, 6] },
 *   "ops": [ {"skip": 1}, {"filter": "isEven"}, {"take": 2} ]
 * }
 * }</pre>
 *
 * A source is one of {@code values} (array literal), {@code value} (single scalar) or {@code generate}
 * (name of a registered producer, giving an infinite stream). {@code filter} and {@code map} ops name entries
 * of the {@link OpRegistry}.
 */
public final class StreamJsonLoader {
    private static final Logger log = LoggerFactory.getLogger(StreamJsonLoader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private StreamJsonLoader() {}

    public static Stream<Object> load(Path filePath, OpRegistry registry) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        try (InputStream in = Files.newInputStream(filePath)) {
            return load(in, registry);
        }
    }

    public static Stream<Object> load(InputStream in, OpRegistry registry) throws IOException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(registry, "registry");
        JsonNode root = OBJECT_MAPPER.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Stream definition must be a JSON object");

        JsonNode nameNode = req(root, "stream");
        if (!nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw new IOException("'stream' must be a non-empty string");
        }
        String name = nameNode.asText();

        Stream<Object> stream = buildSource(name, req(root, "source"), registry);

        JsonNode ops = root.path("ops");
        int opCount = 0;
        if (!ops.isMissingNode() && !ops.isNull()) {
            if (!ops.isArray()) throw new IOException("'ops' must be an array");
            for (JsonNode opNode : ops) {
                stream = applyOp(stream, opNode, registry);
                opCount++;
            }
        }
        log.info("loaded stream '{}' ({} ops, finite={})", name, opCount, stream.isFinite());
        return stream;
    }

    private static Stream<Object> buildSource(String name, JsonNode source, OpRegistry registry) throws IOException {
        if (!source.isObject() || source.size() != 1) {
            throw new IOException("'source' must be an object with exactly one of values, value, generate");
        }
        if (source.has("values")) {
            JsonNode values = source.get("values");
            if (!values.isArray()) throw new IOException("source 'values' must be an array");
            Object[] literal = new Object[values.size()];
            for (int i = 0; i < literal.length; i++) literal[i] = toJava(values.get(i));
            return SourceResolver.resolve(name, (Object) literal);
        }
        if (source.has("value")) {
            JsonNode value = source.get("value");
            if (value.isArray() || value.isObject() || value.isNull()) {
                throw new IOException("source 'value' must be a scalar");
            }
            return SourceResolver.resolve(name, toJava(value));
        }
        if (source.has("generate")) {
            String producer = textOf(source.get("generate"), "generate");
            if (!registry.hasProducer(producer)) throw new IOException("Unknown producer: " + producer);
            return SourceResolver.resolve(name, registry.getProducer(producer));
        }
        throw new IOException("Unsupported source: " + source);
    }

    private static Stream<Object> applyOp(Stream<Object> stream, JsonNode opNode, OpRegistry registry)
        throws IOException {
        if (opNode == null || !opNode.isObject() || opNode.size() != 1) {
            throw new IOException("Each op must be an object with a single key, got: " + opNode);
        }
        Map.Entry<String, JsonNode> op = opNode.fields().next();
        String kind = op.getKey();
        JsonNode arg = op.getValue();
        return switch (kind) {
            case "skip" -> stream.skip(count(arg, kind));
            case "take", "get" -> stream.take(count(arg, kind));
            case "group" -> {
                long size = count(arg, kind);
                if (size == 0 || size > Integer.MAX_VALUE) throw new IOException("'group' size must be in [1, 2^31)");
                yield append(stream, Ops.group((int) size));
            }
            case "filter" -> {
                String filter = textOf(arg, kind);
                if (!registry.hasFilter(filter)) throw new IOException("Unknown filter: " + filter);
                yield append(stream, Ops.filter(registry.getFilter(filter)));
            }
            case "map" -> {
                String transform = textOf(arg, kind);
                if (!registry.hasTransform(transform)) throw new IOException("Unknown transform: " + transform);
                yield append(stream, Ops.map(registry.getTransform(transform)));
            }
            default -> throw new IOException("Unsupported op: " + kind);
        };
    }

    @SuppressWarnings("unchecked")
    private static <R> Stream<Object> append(Stream<Object> stream, Combinator<Object, R> combinator) {
        Stream<?> next;
        if (stream instanceof FiniteStream<Object> finite) {
            next = finite.pipe(combinator);
        } else {
            next = ((InfiniteStream<Object>) stream).pipe(combinator);
        }
        return (Stream<Object>) next;
    }

    private static long count(JsonNode node, String field) throws IOException {
        if (!node.canConvertToLong() || !node.isIntegralNumber() || node.asLong() < 0) {
            throw new IOException("'" + field + "' must be a non-negative integer");
        }
        return node.asLong();
    }

    private static String textOf(JsonNode node, String field) throws IOException {
        if (node == null || !node.isTextual()) throw new IOException("'" + field + "' must be a string");
        return node.asText();
    }

    private static Object toJava(JsonNode node) throws IOException {
        if (node.isInt()) return node.intValue();
        if (node.isLong()) return node.longValue();
        if (node.isBigInteger()) return node.bigIntegerValue();
        if (node.isBigDecimal()) return node.decimalValue();
        if (node.isFloatingPointNumber()) return node.doubleValue();
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) list.add(toJava(it.next()));
            return List.copyOf(list);
        }
        throw new IOException("Unsupported value: " + node);
    }

    private static JsonNode req(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) throw new IOException("Missing required field '" + field + "'");
        return node;
    }
}
