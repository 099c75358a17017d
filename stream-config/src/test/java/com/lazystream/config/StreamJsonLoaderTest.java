package com.lazystream.config;

import com.lazystream.core.FiniteStream;
import com.lazystream.core.InfiniteStream;
import com.lazystream.core.Ops;
import com.lazystream.core.Stream;
import com.lazystream.core.Streams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public final class StreamJsonLoaderTest {

    private OpRegistry registry;

    @BeforeEach
    void setup() {
        registry = new OpRegistry()
            .registerFilter("isEven", Integer.class, v -> v % 2 == 0)
            .registerTransform("square", Integer.class, v -> v * v)
            .registerTransform("describe", Object.class, v -> "item:" + v);
    }

    private static Stream<Object> load(String json, OpRegistry registry) throws IOException {
        return StreamJsonLoader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), registry);
    }

    @Test
    void loadsDefinitionFromFile() throws Exception {
        Path file = Path.of(getClass().getResource("/streams/evens.json").toURI());

        Stream<Object> stream = StreamJsonLoader.load(file, registry);

        FiniteStream<Object> finite = assertInstanceOf(FiniteStream.class, stream);
        assertEquals("evens", finite.name());
        assertEquals(List.of(4, 16, 36), finite.pipe(Ops.toList()));
    }

    @Test
    void matchesTheProgrammaticPipeline() throws Exception {
        String json = """
            {
              "stream": "grouped",
              "source": { "values": [1, 2, 3, 4, 5] },
              "ops": [ { "group": 3 } ]
            }
            """;

        FiniteStream<Object> loaded = (FiniteStream<Object>) load(json, registry);
        List<List<Integer>> expected = Streams.of(1, 2, 3, 4, 5).pipe(Ops.group(3)).pipe(Ops.toList());

        assertEquals(expected, loaded.pipe(Ops.toList()));
        assertEquals("1 2 3 4 5", ((FiniteStream<Object>) load(json.replace("{ \"group\": 3 }", ""), registry))
            .pipe(Ops.printTo(new StringBuilder())).toString());
    }

    @Test
    void generateSourceIsInfiniteUntilTaken() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        registry.registerProducer("counter", counter::incrementAndGet);

        Stream<Object> unbounded = load("""
            { "stream": "ticks", "source": { "generate": "counter" }, "ops": [ { "map": "describe" } ] }
            """, registry);
        Stream<Object> bounded = load("""
            { "stream": "ticks", "source": { "generate": "counter" }, "ops": [ { "get": 2 } ] }
            """, registry);

        assertInstanceOf(InfiniteStream.class, unbounded);
        assertEquals("item:1", unbounded.pipe(Ops.nth(0)));
        FiniteStream<Object> finite = assertInstanceOf(FiniteStream.class, bounded);
        assertEquals(List.of(2, 3), finite.pipe(Ops.toList()));
    }

    @Test
    void singleValueSourceAndScalarTypes() throws Exception {
        FiniteStream<Object> single = (FiniteStream<Object>) load("""
            { "stream": "one", "source": { "value": "hello" } }
            """, registry);
        FiniteStream<Object> mixed = (FiniteStream<Object>) load("""
            { "stream": "mixed", "source": { "values": [1, 10000000000, 2.5, true, "x", 123456789012345678901234567890] } }
            """, registry);

        assertEquals(List.of("hello"), single.pipe(Ops.toList()));
        assertEquals(List.of(1, 10000000000L, 2.5, true, "x", new BigInteger("123456789012345678901234567890")),
            mixed.pipe(Ops.toList()));
    }

    @Test
    void largestGroupSizeIsAccepted() throws Exception {
        FiniteStream<Object> grouped = (FiniteStream<Object>) load("""
            { "stream": "all", "source": { "values": [1, 2, 3] }, "ops": [ { "group": 2147483647 } ] }
            """, registry);

        assertEquals(List.of(List.of(1, 2, 3)), grouped.pipe(Ops.toList()));
    }

    @Test
    void emptyValuesGiveAnEmptyFiniteStream() throws Exception {
        FiniteStream<Object> empty = (FiniteStream<Object>) load("""
            { "stream": "nothing", "source": { "values": [] }, "ops": [ { "skip": 2 } ] }
            """, registry);

        assertEquals(List.of(), empty.pipe(Ops.toList()));
    }

    @Test
    void rejectsMalformedDefinitions() {
        assertLoadFails("Missing required field 'stream'", """
            { "source": { "values": [1] } }
            """);
        assertLoadFails("Missing required field 'source'", """
            { "stream": "s" }
            """);
        assertLoadFails("'source' must be an object with exactly one of values, value, generate", """
            { "stream": "s", "source": { "values": [1], "value": 2 } }
            """);
        assertLoadFails("'ops' must be an array", """
            { "stream": "s", "source": { "values": [1] }, "ops": { "skip": 1 } }
            """);
        assertLoadFails("'skip' must be a non-negative integer", """
            { "stream": "s", "source": { "values": [1] }, "ops": [ { "skip": -1 } ] }
            """);
        assertLoadFails("'group' size must be in [1, 2^31)", """
            { "stream": "s", "source": { "values": [1] }, "ops": [ { "group": 0 } ] }
            """);
        assertLoadFails("Unknown filter: isOdd", """
            { "stream": "s", "source": { "values": [1] }, "ops": [ { "filter": "isOdd" } ] }
            """);
        assertLoadFails("Unknown producer: clock", """
            { "stream": "s", "source": { "generate": "clock" } }
            """);
        assertLoadFails("Unsupported op: sort", """
            { "stream": "s", "source": { "values": [1] }, "ops": [ { "sort": true } ] }
            """);
    }

    private void assertLoadFails(String expectedMessage, String json) {
        IOException exception = assertThrows(IOException.class, new LoadStreamTask(json, registry));
        assertEquals(expectedMessage, exception.getMessage());
    }

    private static final class LoadStreamTask implements Executable {
        private final String json;
        private final OpRegistry registry;

        private LoadStreamTask(String json, OpRegistry registry) {
            this.json = json;
            this.registry = registry;
        }

        @Override
        public void execute() throws Throwable {
            load(json, registry);
        }
    }
}
