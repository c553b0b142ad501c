/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.hamt;

import io.vavr.Tuple2;
import io.vavr.control.Option;

import java.util.Objects;

/**
 * Access-time helpers for tries whose values may be {@link LazyValue}s.
 * <p>
 * A trie stores lazy values as they are; these helpers dereference them when
 * the value is read.
 */
public final class LazyValues {

    private LazyValues() {
    }

    public static boolean isLazy(Object o) {
        return o instanceof LazyValue;
    }

    /**
     * Returns the value of a lazy value, forcing it if needed, or the object
     * itself if it is not lazy.
     *
     * @param o an object
     * @return the dereferenced object
     */
    public static Object unlazy(Object o) {
        return (o instanceof LazyValue) ? ((LazyValue<?>) o).get() : o;
    }

    /**
     * Returns the value of a key, forcing it if it is lazy.
     *
     * @param trie a trie
     * @param key  a key
     * @param <K>  the key type
     * @return the dereferenced value, or {@link Option#none()} if the key is absent
     */
    public static <K> Option<Object> get(HashTrie<K, ?> trie, K key) {
        Objects.requireNonNull(trie, "trie is null");
        return trie.get(key).map(LazyValues::unlazy);
    }

    /**
     * Returns the value of a key as it is stored, without forcing it.
     *
     * @param trie a trie
     * @param key  a key
     * @param <K>  the key type
     * @param <V>  the value type
     * @return the stored value, or {@link Option#none()} if the key is absent
     */
    public static <K, V> Option<V> getLazy(HashTrie<K, V> trie, K key) {
        Objects.requireNonNull(trie, "trie is null");
        return trie.get(key);
    }

    /**
     * Checks if the value of a key can be read without running a computation.
     *
     * @param trie a trie
     * @param key  a key
     * @param <K>  the key type
     * @return false if the key is absent or its value is an unevaluated lazy value
     */
    public static <K> boolean isReady(HashTrie<K, ?> trie, K key) {
        Objects.requireNonNull(trie, "trie is null");
        return trie.get(key)
                .map(v -> !(v instanceof LazyValue) || ((LazyValue<?>) v).isEvaluated())
                .getOrElse(false);
    }

    /**
     * Returns the trie with every lazy value replaced by its forced value.
     *
     * @param trie a trie
     * @param <K>  the key type
     * @return a trie without lazy values, or the given trie if it has none
     */
    public static <K> HashTrie<K, Object> readyAll(HashTrie<K, ?> trie) {
        Objects.requireNonNull(trie, "trie is null");
        @SuppressWarnings("unchecked")
        final HashTrie<K, Object> t = (HashTrie<K, Object>) trie;
        final TransientHashTrie<K, Object> session = t.toTransient();
        for (Tuple2<K, Object> e : t) {
            if (e._2 instanceof LazyValue) {
                session.put(e._1, ((LazyValue<?>) e._2).get());
            }
        }
        return session.freeze();
    }

    /**
     * Returns an iterator over the entries of a trie whose lazy values are
     * forced as the iterator reaches them.
     *
     * @param trie a trie
     * @param <K>  the key type
     * @return a new iterator
     */
    public static <K> io.vavr.collection.Iterator<Tuple2<K, Object>> forcedIterator(HashTrie<K, ?> trie) {
        Objects.requireNonNull(trie, "trie is null");
        return trie.iterator().map(e -> new Tuple2<K, Object>(e._1, unlazy(e._2)));
    }
}
