package com.flowgraph.checkpoint.serde;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MsgPackSerializerTest {

    private MsgPackSerializer serializer;

    @BeforeEach
    public void setUp() {
        serializer = new MsgPackSerializer();
    }

    public enum Priority {
        LOW, HIGH {
            @Override
            public String toString() {
                return "high!";
            }
        }
    }

    public record Task(String title, Priority priority, long estimate, Set<String> labels) {
    }

    public record Board(String name, List<Task> tasks, Map<String, Integer> counts, double progress) {
    }

    public record Ledger(List<Long> entries, Map<String, Long> totals, Set<Short> codes, List<Float> weights,
                         Map<String, List<Long>> buckets) {
    }

    public static class Counter {
        private String name;
        private long hits;
        private transient String cache;

        public Counter() {
        }

        public Counter(String name, long hits) {
            this.name = name;
            this.hits = hits;
            this.cache = "derived";
        }
    }

    private Object roundTrip(Object value) {
        return serializer.deserialize(serializer.serialize(value));
    }

    @Test
    public void testScalars() {
        assertThat(roundTrip("text")).isEqualTo("text");
        assertThat(roundTrip(7)).isEqualTo(7);
        assertThat(roundTrip(true)).isEqualTo(true);
        assertThat(roundTrip(1.5d)).isEqualTo(1.5d);
        assertThat(roundTrip(null)).isNull();
        // Large longs keep their width
        assertThat(roundTrip(Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
        assertThat(roundTrip(-5_000_000_000L)).isEqualTo(-5_000_000_000L);
        assertThat((byte[]) roundTrip(new byte[] {1, 2, 3})).containsExactly(1, 2, 3);
    }

    @Test
    public void testMapsKeepInsertionOrder() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("zeta", 1);
        map.put("alpha", List.of("x", "y"));
        map.put("mid", Map.of("inner", true));

        Object restored = roundTrip(map);

        assertThat(restored).isInstanceOf(LinkedHashMap.class);
        assertThat(((Map<?, ?>) restored).keySet())
                .asInstanceOf(InstanceOfAssertFactories.ITERABLE)
                .containsExactly("zeta", "alpha", "mid");
        assertThat(restored).isEqualTo(map);
    }

    @Test
    public void testSetsComeBackAsSets() {
        Set<String> labels = new LinkedHashSet<>(Arrays.asList("b", "a", "c"));

        Object restored = roundTrip(labels);

        assertThat(restored).isInstanceOf(Set.class);
        assertThat(restored).asInstanceOf(InstanceOfAssertFactories.ITERABLE).containsExactly("b", "a", "c");
    }

    @Test
    public void testEnumsIncludingConstantBodies() {
        assertThat(roundTrip(Priority.LOW)).isSameAs(Priority.LOW);
        assertThat(roundTrip(Priority.HIGH)).isSameAs(Priority.HIGH);
    }

    @Test
    public void testNestedRecordsWithCoercedComponents() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("open", 2);
        Board board = new Board("sprint",
                List.of(new Task("write", Priority.HIGH, 3L, Set.of("doc")),
                        new Task("review", Priority.LOW, 1L, Set.of())),
                counts,
                0.25d);

        Object restored = roundTrip(board);

        assertThat(restored).isEqualTo(board);
        Board restoredBoard = (Board) restored;
        assertThat(restoredBoard.tasks().get(0).labels()).isInstanceOf(Set.class);
    }

    @Test
    public void testNumbersInsideCollectionsKeepDeclaredTypes() {
        // Create test data with small values that fit in a MessagePack int
        Map<String, Long> totals = new LinkedHashMap<>();
        totals.put("open", 3L);
        totals.put("closed", 40L);
        Map<String, List<Long>> buckets = new LinkedHashMap<>();
        buckets.put("week", List.of(1L, 2L));
        Ledger ledger = new Ledger(List.of(1L, 2L, 3L), totals, Set.of((short) 7), List.of(0.5f, 1.25f), buckets);

        Ledger restored = (Ledger) roundTrip(ledger);

        assertThat(restored).isEqualTo(ledger);
        assertThat(restored.entries().get(0)).isInstanceOf(Long.class);
        assertThat(restored.totals().get("open")).isInstanceOf(Long.class);
        assertThat(restored.codes().iterator().next()).isInstanceOf(Short.class);
        assertThat(restored.weights().get(1)).isInstanceOf(Float.class);
        assertThat(restored.buckets().get("week").get(1)).isInstanceOf(Long.class);
    }

    @Test
    public void testPlainObjectSkipsTransientFields() {
        Counter restored = (Counter) roundTrip(new Counter("visits", 12L));

        assertThat(restored.name).isEqualTo("visits");
        assertThat(restored.hits).isEqualTo(12L);
        assertThat(restored.cache).isNull();
    }

    @Test
    public void testBuiltinTypes() {
        UUID id = UUID.randomUUID();
        Instant instant = Instant.parse("2024-05-01T10:15:30Z");
        LocalDate date = LocalDate.of(2024, 5, 1);
        BigDecimal amount = new BigDecimal("12.50");

        assertThat(roundTrip(id)).isEqualTo(id);
        assertThat(roundTrip(instant)).isEqualTo(instant);
        assertThat(roundTrip(date)).isEqualTo(date);
        assertThat(roundTrip(amount)).isEqualTo(amount);
    }

    @Test
    public void testRegisteredTypeOverridesReflection() {
        serializer.registerType(Counter.class,
                counter -> counter.name + ":" + counter.hits,
                value -> {
                    String[] parts = ((String) value).split(":");
                    return new Counter(parts[0], Long.parseLong(parts[1]));
                });

        Counter restored = (Counter) roundTrip(new Counter("clicks", 3L));

        assertThat(restored.name).isEqualTo("clicks");
        assertThat(restored.hits).isEqualTo(3L);
        // Rebuilt through the constructor, so the derived field is set again
        assertThat(restored.cache).isEqualTo("derived");
    }

    @Test
    public void testUnknownTypeFallsBackToRawMap() {
        Map<String, Object> foreign = new LinkedHashMap<>();
        foreign.put("__type__", "com.example.Missing");
        foreign.put("fields", Map.of("a", 1));

        Object restored = roundTrip(foreign);

        assertThat(restored).isInstanceOf(Map.class);
        assertThat(((Map<?, ?>) restored).get("__type__")).isEqualTo("com.example.Missing");
    }

    @Test
    public void testRejectsBadInput() {
        assertThatThrownBy(() -> serializer.deserialize(null))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> serializer.deserialize(new byte[0]))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> serializer.registerType(String.class, null, value -> "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
