package ch.randelshofer.vavr.hamt;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HashTrieTest {

    /**
     * All keys collide on the full 32 bit hash.
     */
    private static final KeyHashing<String> CONSTANT_HASHING =
            KeyHashing.of((ToIntSerializable<String>) k -> 42, (EqualsSerializable<String>) Objects::equals);

    /**
     * Keys collide on the low bits only: "a0" and "b0" share the first level slot.
     */
    private static final KeyHashing<String> PREFIX_HASHING =
            KeyHashing.of((ToIntSerializable<String>) k -> k.charAt(1) | (k.charAt(0) << 10),
                    (EqualsSerializable<String>) Objects::equals);

    interface ToIntSerializable<T> extends java.util.function.ToIntFunction<T>, java.io.Serializable {
    }

    interface EqualsSerializable<T> extends java.util.function.BiPredicate<T, T>, java.io.Serializable {
    }

    // -- concrete scenario

    @Test
    public void shouldKeepOlderVersionsAfterInsertAndRemove() {
        final HashTrie<Integer, String> t0 = HashTrie.empty();
        final HashTrie<Integer, String> t1 = t0.put(1, "a");
        final HashTrie<Integer, String> t2 = t1.put(2, "b");
        final HashTrie<Integer, String> t3 = t2.remove(1);

        assertThat(t0.size()).isEqualTo(0);
        assertThat(t1.size()).isEqualTo(1);
        assertThat(t2.size()).isEqualTo(2);
        assertThat(t3.size()).isEqualTo(1);
        assertThat(t2.get(1)).isEqualTo(Option.some("a"));
        assertThat(t3.get(1)).isEqualTo(Option.none());
        assertThat(t3.get(2)).isEqualTo(Option.some("b"));
    }

    // -- get

    @Test
    public void shouldReturnNoneForMissingKey() {
        assertThat(HashTrie.<String, Integer>empty().get("x").isEmpty()).isTrue();
        assertThat(HashTrie.<String, Integer>empty().put("a", 1).get("b").isEmpty()).isTrue();
    }

    @Test
    public void shouldDistinguishNullValueFromMissingKey() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", null);
        assertThat(t.get("a")).isEqualTo(Option.some(null));
        assertThat(t.containsKey("a")).isTrue();
        assertThat(t.getOrElse("b", 7)).isEqualTo(7);
    }

    @Test
    public void shouldSupportNullKey() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put(null, 1).put("a", 2);
        assertThat(t.get(null)).isEqualTo(Option.some(1));
        assertThat(t.remove(null).containsKey(null)).isFalse();
        assertThat(t.remove(null).size()).isEqualTo(1);
    }

    // -- put

    @Test
    public void shouldReturnSameInstanceWhenPuttingSameValue() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", 1);
        assertThat(t.put("a", 1)).isSameAs(t);
    }

    @Test
    public void shouldReplaceValueWithoutChangingSize() {
        final HashTrie<String, Integer> t1 = HashTrie.<String, Integer>empty().put("a", 1).put("b", 2);
        final HashTrie<String, Integer> t2 = t1.put("a", 3);
        assertThat(t2.size()).isEqualTo(2);
        assertThat(t2.get("a")).isEqualTo(Option.some(3));
        assertThat(t1.get("a")).isEqualTo(Option.some(1));
    }

    @Test
    public void shouldNotModifyOriginalOnPut() {
        final HashTrie<Integer, Integer> t = HashTrie.ofEntries(List.range(0, 100).map(i -> Tuple.of(i, i)));
        final HashTrie<Integer, Integer> u = t.put(1000, 1000);
        assertThat(t.containsKey(1000)).isFalse();
        assertThat(t.size()).isEqualTo(100);
        assertThat(u.size()).isEqualTo(101);
    }

    // -- remove

    @Test
    public void shouldReturnSameInstanceWhenRemovingMissingKey() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", 1);
        assertThat(t.remove("b")).isSameAs(t);
    }

    @Test
    public void shouldReturnCanonicalEmptyWhenRemovingLastKey() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", 1);
        assertThat(t.remove("a")).isSameAs(HashTrie.empty());
    }

    @Test
    public void shouldCollapseToSameShapeAsDirectConstruction() {
        // "a0" and "b0" share the first level slot, so they live one level down
        final HashTrie<String, Integer> direct = HashTrie.<String, Integer>empty(PREFIX_HASHING).put("a0", 1);
        final HashTrie<String, Integer> collapsed = direct.put("b0", 2).remove("b0");

        assertThat(collapsed).isEqualTo(direct);
        assertThat(collapsed.root.nodeArity()).isEqualTo(0);
        assertThat(collapsed.root.dataArity()).isEqualTo(1);
        assertThat(collapsed.root.dataMap()).isEqualTo(direct.root.dataMap());
    }

    @Test
    public void shouldCollapseNestedBranchIntoParent() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty(PREFIX_HASHING)
                .put("a0", 1).put("b0", 2).put("c1", 3);
        final HashTrie<String, Integer> u = t.remove("b0");

        assertThat(u.size()).isEqualTo(2);
        assertThat(u.root.nodeArity()).isEqualTo(0);
        assertThat(u.root.dataArity()).isEqualTo(2);
        assertThat(u.get("a0")).isEqualTo(Option.some(1));
        assertThat(u.get("c1")).isEqualTo(Option.some(3));
    }

    // -- update

    @Test
    public void shouldInvokeUpdateFunctionExactlyOnce() {
        final AtomicInteger calls = new AtomicInteger();
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", 1);

        final HashTrie<String, Integer> u = t.update("a", old -> {
            calls.incrementAndGet();
            return old.getOrElse(0) + 10;
        });
        assertThat(calls.get()).isEqualTo(1);
        assertThat(u.get("a")).isEqualTo(Option.some(11));

        final HashTrie<String, Integer> v = u.update("b", old -> {
            calls.incrementAndGet();
            return old.isEmpty() ? -1 : 99;
        });
        assertThat(calls.get()).isEqualTo(2);
        assertThat(v.get("b")).isEqualTo(Option.some(-1));
        assertThat(v.size()).isEqualTo(2);
    }

    @Test
    public void shouldReturnSameInstanceWhenUpdateKeepsValue() {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty().put("a", 1);
        assertThat(t.update("a", old -> old.get())).isSameAs(t);
    }

    // -- collisions

    @Test
    public void shouldStoreCollidingKeys() {
        HashTrie<String, Integer> t = HashTrie.empty(CONSTANT_HASHING);
        for (int i = 0; i < 10; i++) {
            t = t.put("k" + i, i);
        }
        assertThat(t.size()).isEqualTo(10);
        for (int i = 0; i < 10; i++) {
            assertThat(t.get("k" + i)).isEqualTo(Option.some(i));
        }
        assertThat(t.get("k10").isEmpty()).isTrue();
        assertThat(t.put("k3", 33).get("k3")).isEqualTo(Option.some(33));
        assertThat(t.put("k3", 33).size()).isEqualTo(10);
    }

    @Test
    public void shouldRemoveCollidingKeysDownToCanonicalSingleton() {
        final HashTrie<String, Integer> one = HashTrie.<String, Integer>empty(CONSTANT_HASHING).put("x", 1);
        final HashTrie<String, Integer> t = one.put("y", 2).put("z", 3);

        final HashTrie<String, Integer> u = t.remove("y").remove("z");
        assertThat(u).isEqualTo(one);
        assertThat(u.root.nodeArity()).isEqualTo(0);
        assertThat(u.root.dataMap()).isEqualTo(one.root.dataMap());
        assertThat(u.remove("x").isEmpty()).isTrue();
    }

    // -- round trip

    @Test
    public void shouldAgreeWithHashMapOnRandomOperations() {
        final Random random = new Random(7);
        final Map<Integer, Integer> expected = new HashMap<>();
        HashTrie<Integer, Integer> actual = HashTrie.empty();
        for (int i = 0; i < 5000; i++) {
            final int key = random.nextInt(1000) - 500;
            if (random.nextInt(3) == 0) {
                expected.remove(key);
                actual = actual.remove(key);
            } else {
                expected.put(key, i);
                actual = actual.put(key, i);
            }
        }
        assertThat(actual.size()).isEqualTo(expected.size());
        for (Map.Entry<Integer, Integer> e : expected.entrySet()) {
            assertThat(actual.get(e.getKey())).isEqualTo(Option.some(e.getValue()));
        }
        final Map<Integer, Integer> iterated = new HashMap<>();
        for (Tuple2<Integer, Integer> e : actual) {
            assertThat(iterated.put(e._1, e._2)).isNull();
        }
        assertThat(iterated).isEqualTo(expected);
    }

    @Test
    public void shouldAgreeWithHashMapOnRandomCollidingKeys() {
        final KeyHashing<Integer> weak = KeyHashing.of(k -> k % 7, Objects::equals);
        final Random random = new Random(11);
        final Map<Integer, Integer> expected = new HashMap<>();
        HashTrie<Integer, Integer> actual = HashTrie.empty(weak);
        for (int i = 0; i < 2000; i++) {
            final int key = random.nextInt(60);
            if (random.nextBoolean()) {
                expected.remove(key);
                actual = actual.remove(key);
            } else {
                expected.put(key, i);
                actual = actual.put(key, i);
            }
            assertThat(actual.size()).isEqualTo(expected.size());
        }
        for (int key = 0; key < 60; key++) {
            assertThat(actual.get(key)).isEqualTo(Option.of(expected.get(key)));
        }
    }

    // -- structural sharing

    @Test
    public void shouldCopyOnlyThePathOfAnEdit() {
        final HashTrie<Integer, Integer> t = HashTrie.ofEntries(List.range(0, 10_000).map(i -> Tuple.of(i, i)));
        final Set<ChampTrie.Node<?>> oldNodes = Collections.newSetFromMap(new IdentityHashMap<>());
        collectNodes(t.root, oldNodes);

        final HashTrie<Integer, Integer> u = t.put(4711, -1);
        final java.util.List<ChampTrie.Node<?>> newNodes = new ArrayList<>();
        collectNodes(u.root, newNodes);
        final long fresh = newNodes.stream().filter(n -> !oldNodes.contains(n)).count();
        assertThat(fresh).isBetween(1L, (long) ChampTrie.Node.MAX_DEPTH + 1);
    }

    private static void collectNodes(ChampTrie.Node<?> node, java.util.Collection<ChampTrie.Node<?>> into) {
        into.add(node);
        for (int i = 0; i < node.nodeArity(); i++) {
            collectNodes(node.getNode(i), into);
        }
    }

    // -- bulk operations

    @Test
    public void shouldPutAllAndRemoveAll() {
        final HashTrie<Integer, String> t = HashTrie.<Integer, String>empty()
                .putAll(List.of(Tuple.of(1, "a"), Tuple.of(2, "b"), Tuple.of(3, "c")));
        assertThat(t.size()).isEqualTo(3);
        final HashTrie<Integer, String> u = t.removeAll(List.of(1, 3, 5));
        assertThat(u.size()).isEqualTo(1);
        assertThat(u.get(2)).isEqualTo(Option.some("b"));
        assertThat(t.size()).isEqualTo(3);
    }

    @Test
    public void shouldFilterEntries() {
        final HashTrie<Integer, Integer> t = HashTrie.ofEntries(List.range(0, 50).map(i -> Tuple.of(i, i * i)));
        final HashTrie<Integer, Integer> even = t.filter((k, v) -> k % 2 == 0);
        assertThat(even.size()).isEqualTo(25);
        assertThat(even.keysIterator().forAll(k -> k % 2 == 0)).isTrue();
        assertThat(t.filter((k, v) -> true)).isSameAs(t);
    }

    // -- indexed

    @Test
    public void shouldStoreIndexedElements() {
        final HashTrie<Integer, String> t = HashTrie.ofIndexed(List.of("a", "b", "c"));
        assertThat(t.size()).isEqualTo(3);
        assertThat(t.get(0)).isEqualTo(Option.some("a"));
        assertThat(t.get(2)).isEqualTo(Option.some("c"));
        assertThat(t.get(3).isEmpty()).isTrue();
        assertThat(t.hashing()).isSameAs(KeyHashing.indexed());
    }

    @Test
    public void shouldRejectNegativeIndex() {
        final HashTrie<Integer, String> t = HashTrie.ofIndexed(List.of("a"));
        assertThatThrownBy(() -> t.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> t.put(-1, "x")).isInstanceOf(IndexOutOfBoundsException.class);
    }

    // -- iteration

    @Test
    public void shouldIterateEachEntryOnceAndRestart() {
        final HashTrie<Integer, Integer> t = HashTrie.ofEntries(List.range(0, 300).map(i -> Tuple.of(i, -i)));
        final java.util.List<Integer> first = t.keysIterator().toJavaList();
        final java.util.List<Integer> second = t.keysIterator().toJavaList();
        assertThat(first).hasSize(300).doesNotHaveDuplicates();
        assertThat(second).isEqualTo(first);
        assertThat(t.valuesIterator().sum().intValue()).isEqualTo(-(299 * 300 / 2));
    }

    @Test
    public void shouldThrowWhenIteratingPastTheEnd() {
        final io.vavr.collection.Iterator<Tuple2<String, Integer>> it = HashTrie.<String, Integer>empty().iterator();
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(java.util.NoSuchElementException.class);
    }

    // -- equality

    @Test
    public void shouldBeEqualRegardlessOfInsertionOrder() {
        final HashTrie<Integer, Integer> a = HashTrie.ofEntries(List.range(0, 200).map(i -> Tuple.of(i, i)));
        final HashTrie<Integer, Integer> b = HashTrie.ofEntries(List.range(0, 200).reverse().map(i -> Tuple.of(i, i)));
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.put(0, 1)).isNotEqualTo(b);
        assertThat(a.remove(0)).isNotEqualTo(b);
    }

    @Test
    public void shouldNotBeEqualWhenHashingsDiffer() {
        final HashTrie<String, Integer> standard = HashTrie.<String, Integer>empty().put("x", 1).put("y", 2);
        final HashTrie<String, Integer> colliding = HashTrie.<String, Integer>empty(CONSTANT_HASHING)
                .put("x", 1).put("y", 2);
        assertThat(standard.equals(colliding)).isFalse();
        assertThat(colliding.equals(standard)).isFalse();

        final java.util.Set<HashTrie<String, Integer>> tries = new java.util.HashSet<>();
        tries.add(standard);
        tries.add(HashTrie.<String, Integer>empty().put("y", 2).put("x", 1));
        assertThat(tries).hasSize(1);
    }

    @Test
    public void shouldNotThrowWhenComparingTriesWithDifferentKeyTypes() {
        final HashTrie<String, String> strings = HashTrie.<String, String>empty().put("a", "a");
        final HashTrie<Integer, String> indexed = HashTrie.ofIndexed(List.of("a"));
        final HashTrie<Integer, String> ints = HashTrie.<Integer, String>empty().put(0, "a");
        assertThat(strings.equals(indexed)).isFalse();
        assertThat(indexed.equals(strings)).isFalse();
        assertThat(strings.equals(ints)).isFalse();
        assertThat(ints.equals(strings)).isFalse();
    }

    @Test
    public void shouldHaveEqualHashCodesWhenEqualWithCustomHashing() {
        final HashTrie<String, Integer> a = HashTrie.<String, Integer>empty(CONSTANT_HASHING)
                .put("x", 1).put("y", 2).put("z", 3);
        final HashTrie<String, Integer> b = HashTrie.<String, Integer>empty(CONSTANT_HASHING)
                .put("z", 3).put("y", 2).put("x", 1);
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    public void shouldPrintEntries() {
        assertThat(HashTrie.<String, Integer>empty().toString()).isEqualTo("HashTrie()");
        assertThat(HashTrie.<String, Integer>empty().put("a", 1).toString()).isEqualTo("HashTrie(a -> 1)");
    }

    // -- lazy values

    @Test
    public void shouldReplaceLazyValueByIdentity() {
        final LazyValue<Integer> l1 = LazyValue.val(1);
        final LazyValue<Integer> l2 = LazyValue.val(1);
        final HashTrie<String, LazyValue<Integer>> t = HashTrie.<String, LazyValue<Integer>>empty().put("a", l1);
        assertThat(t.put("a", l1)).isSameAs(t);
        assertThat(t.put("a", l2).get("a").get()).isSameAs(l2);
    }

    // -- serialization

    @Test
    public void shouldSerializeAndDeserialize() throws IOException, ClassNotFoundException {
        final HashTrie<Integer, String> t = HashTrie.ofEntries(List.range(0, 100).map(i -> Tuple.of(i, "v" + i)));
        final HashTrie<Integer, String> copy = roundTrip(t);
        assertThat(copy).isEqualTo(t);
        assertThat(copy.get(42)).isEqualTo(Option.some("v42"));
    }

    @Test
    public void shouldDeserializeEmptyAsCanonicalEmpty() throws IOException, ClassNotFoundException {
        assertThat(roundTrip(HashTrie.<String, String>empty())).isSameAs(HashTrie.empty());
    }

    @Test
    public void shouldSerializeWithCustomHashing() throws IOException, ClassNotFoundException {
        final HashTrie<String, Integer> t = HashTrie.<String, Integer>empty(CONSTANT_HASHING).put("a", 1).put("b", 2);
        final HashTrie<String, Integer> copy = roundTrip(t);
        assertThat(copy.get("b")).isEqualTo(Option.some(2));
        assertThat(copy.size()).isEqualTo(2);
    }

    @SuppressWarnings("unchecked")
    static <T> T roundTrip(T object) throws IOException, ClassNotFoundException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(object);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return (T) in.readObject();
        }
    }
}
