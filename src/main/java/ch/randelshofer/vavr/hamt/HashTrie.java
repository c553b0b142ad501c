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

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.BiPredicate;
import java.util.function.Function;

import static ch.randelshofer.vavr.hamt.ChampTrie.BitmapIndexedNode.emptyNode;

/**
 * Implements a persistent hash trie that maps keys to values, using a
 * Compressed Hash-Array Mapped Prefix-tree (CHAMP).
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>uses a pluggable {@link KeyHashing}</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>get: O(1)</li>
 *     <li>toTransient: O(1) + O(log N) distributed across subsequent updates in the transient</li>
 *     <li>clone: O(1)</li>
 *     <li>iterator.next(): O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The trie contains nodes that may be shared with other tries.
 * <p>
 * If a write operation is performed on a node, then this trie creates a
 * copy of the node and of all parent nodes up to the root (copy-path-on-write).
 * Since the trie has a fixed maximal height, the cost is O(1).
 * <p>
 * All operations on this trie can be performed concurrently, without a need for
 * synchronisation.
 * <p>
 * Values may be {@link LazyValue}s. The trie never forces them, except in
 * {@link #equals(Object)} and {@link #hashCode()}; see {@link LazyValues} for
 * access that dereferences them.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class HashTrie<K, V> implements Iterable<Tuple2<K, V>>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final HashTrie<?, ?> EMPTY = new HashTrie<>(emptyNode(), 0, KeyHashing.standard());
    private static final HashTrie<?, ?> EMPTY_INDEXED = new HashTrie<>(emptyNode(), 0, KeyHashing.indexed());

    final ChampTrie.BitmapIndexedNode<SimpleImmutableEntry<K, V>> root;
    /**
     * The number of entries reachable from {@link #root}.
     */
    final int size;
    @SuppressWarnings("serial") // Written by the serialization proxy
    final KeyHashing<K> hashing;

    HashTrie(ChampTrie.BitmapIndexedNode<SimpleImmutableEntry<K, V>> root, int size, KeyHashing<K> hashing) {
        this.root = root;
        this.size = size;
        this.hashing = hashing;
    }

    /**
     * Returns the empty trie with {@link KeyHashing#standard()} hashing.
     *
     * @param <K> the key type
     * @param <V> the value type
     * @return the empty trie
     */
    @SuppressWarnings("unchecked")
    public static <K, V> HashTrie<K, V> empty() {
        return (HashTrie<K, V>) EMPTY;
    }

    /**
     * Returns the empty trie with the given hashing.
     *
     * @param hashing the key hashing
     * @param <K>     the key type
     * @param <V>     the value type
     * @return an empty trie
     */
    @SuppressWarnings("unchecked")
    public static <K, V> HashTrie<K, V> empty(KeyHashing<K> hashing) {
        Objects.requireNonNull(hashing, "hashing is null");
        if (hashing == KeyHashing.standard()) {
            return (HashTrie<K, V>) EMPTY;
        }
        if (hashing == (Object) KeyHashing.indexed()) {
            return (HashTrie<K, V>) EMPTY_INDEXED;
        }
        return new HashTrie<>(emptyNode(), 0, hashing);
    }

    /**
     * Returns the empty trie for sequence-like use, where the keys are the
     * positions of the elements.
     *
     * @param <V> the value type
     * @return the empty indexed trie
     */
    @SuppressWarnings("unchecked")
    public static <V> HashTrie<Integer, V> emptyIndexed() {
        return (HashTrie<Integer, V>) EMPTY_INDEXED;
    }

    /**
     * Creates a trie with standard hashing from the given entries.
     * Later entries replace earlier entries with the same key.
     *
     * @param entries the entries
     * @param <K>     the key type
     * @param <V>     the value type
     * @return a new trie
     */
    public static <K, V> HashTrie<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        return HashTrie.<K, V>empty().putAll(entries);
    }

    /**
     * Creates a sequence-like trie that maps the positions {@code 0..n-1}
     * to the given elements.
     *
     * @param elements the elements
     * @param <V>      the element type
     * @return a new indexed trie
     */
    public static <V> HashTrie<Integer, V> ofIndexed(Iterable<? extends V> elements) {
        Objects.requireNonNull(elements, "elements is null");
        final TransientHashTrie<Integer, V> t = HashTrie.<V>emptyIndexed().toTransient();
        int index = 0;
        for (V e : elements) {
            t.put(index++, e);
        }
        return t.freeze();
    }

    static <K, V> SimpleImmutableEntry<K, V> updateEntry(SimpleImmutableEntry<K, V> oldv, SimpleImmutableEntry<K, V> newv) {
        return isSameValue(oldv.getValue(), newv.getValue())
                ? oldv
                : new SimpleImmutableEntry<>(oldv.getKey(), newv.getValue());
    }

    // Lazy values are compared by identity: comparing them by value would force them.
    static boolean isSameValue(Object oldValue, Object newValue) {
        return oldValue == newValue
                || !(oldValue instanceof LazyValue) && !(newValue instanceof LazyValue)
                && Objects.equals(oldValue, newValue);
    }

    boolean entryKeyEquals(SimpleImmutableEntry<K, V> a, SimpleImmutableEntry<K, V> b) {
        return hashing.equals(a.getKey(), b.getKey());
    }

    int entryKeyHash(SimpleImmutableEntry<K, V> e) {
        return hashing.hash(e.getKey());
    }

    Object findEntry(K key) {
        return root.find(new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0, this::entryKeyEquals);
    }

    /**
     * Returns the hashing of the keys of this trie.
     *
     * @return the key hashing
     */
    public KeyHashing<K> hashing() {
        return hashing;
    }

    /**
     * Returns the value of the given key.
     *
     * @param key a key
     * @return the value, or {@link Option#none()} if this trie does not contain the key
     * @throws IndexOutOfBoundsException if this trie uses {@link KeyHashing#indexed()}
     *                                   and the key is null or negative
     */
    @SuppressWarnings("unchecked")
    public Option<V> get(K key) {
        final Object result = findEntry(key);
        return result == ChampTrie.Node.NO_DATA
                ? Option.none()
                : Option.some(((SimpleImmutableEntry<K, V>) result).getValue());
    }

    /**
     * Returns the value of the given key, or the default value if this trie
     * does not contain the key.
     *
     * @param key          a key
     * @param defaultValue the default value
     * @return the value or the default value
     */
    @SuppressWarnings("unchecked")
    public V getOrElse(K key, V defaultValue) {
        final Object result = findEntry(key);
        return result == ChampTrie.Node.NO_DATA
                ? defaultValue
                : ((SimpleImmutableEntry<K, V>) result).getValue();
    }

    public boolean containsKey(K key) {
        return findEntry(key) != ChampTrie.Node.NO_DATA;
    }

    /**
     * Returns a trie that maps the given key to the given value, and that
     * contains all other entries of this trie.
     *
     * @param key   a key
     * @param value a value
     * @return the updated trie, or {@code this} if the key is already mapped to the value
     */
    public HashTrie<K, V> put(K key, V value) {
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        final ChampTrie.BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRootNode =
                root.put(null, new SimpleImmutableEntry<>(key, value), hashing.hash(key), 0, details,
                        HashTrie::updateEntry, this::entryKeyEquals, this::entryKeyHash);
        if (details.isModified()) {
            if (details.isReplaced()) {
                return new HashTrie<>(newRootNode, size, hashing);
            }
            return new HashTrie<>(newRootNode, size + 1, hashing);
        }
        return this;
    }

    /**
     * Returns a trie that does not contain the given key, and that contains
     * all other entries of this trie.
     *
     * @param key a key
     * @return the updated trie, or {@code this} if this trie does not contain the key
     * @throws IndexOutOfBoundsException if this trie uses {@link KeyHashing#indexed()}
     *                                   and the key is null or negative
     */
    public HashTrie<K, V> remove(K key) {
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        final ChampTrie.BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRootNode =
                root.remove(null, new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0, details,
                        this::entryKeyEquals);
        if (details.isModified()) {
            return size == 1 ? empty(hashing) : new HashTrie<>(newRootNode, size - 1, hashing);
        }
        return this;
    }

    /**
     * Returns a trie in which the given key is mapped to the result of the
     * update function.
     * <p>
     * The update function receives the current value of the key, or
     * {@link Option#none()} if this trie does not contain the key. It is
     * invoked exactly once. The trie is descended only once.
     *
     * @param key            a key
     * @param updateFunction computes the new value from the current value
     * @return the updated trie, or {@code this} if the value is unchanged
     */
    public HashTrie<K, V> update(K key, Function<? super Option<V>, ? extends V> updateFunction) {
        Objects.requireNonNull(updateFunction, "updateFunction is null");
        final Option<V> absent = Option.none();
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        final ChampTrie.BitmapIndexedNode<SimpleImmutableEntry<K, V>> newRootNode =
                root.put(null, new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0, details,
                        keyOnly -> new SimpleImmutableEntry<K, V>(key, updateFunction.apply(absent)),
                        (oldv, keyOnly) -> {
                            final Option<V> present = Option.some(oldv.getValue());
                            return updateEntry(oldv, new SimpleImmutableEntry<K, V>(key, updateFunction.apply(present)));
                        },
                        this::entryKeyEquals, this::entryKeyHash);
        if (details.isModified()) {
            return new HashTrie<>(newRootNode, details.isAdded() ? size + 1 : size, hashing);
        }
        return this;
    }

    /**
     * Returns a trie that contains all entries of this trie and the given
     * entries. Later entries replace earlier entries with the same key.
     *
     * @param entries the entries to put
     * @return the updated trie, or {@code this} if nothing changed
     */
    public HashTrie<K, V> putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        final TransientHashTrie<K, V> t = toTransient();
        t.putAll(entries);
        return t.freeze();
    }

    /**
     * Returns a trie that contains the entries of this trie except those with
     * the given keys.
     *
     * @param keys the keys to remove
     * @return the updated trie, or {@code this} if nothing changed
     */
    public HashTrie<K, V> removeAll(Iterable<? extends K> keys) {
        final TransientHashTrie<K, V> t = toTransient();
        t.removeAll(keys);
        return t.freeze();
    }

    /**
     * Returns a trie that contains the entries of this trie that satisfy the
     * given predicate.
     *
     * @param predicate a predicate over key and value
     * @return the filtered trie, or {@code this} if all entries satisfy the predicate
     */
    public HashTrie<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        final TransientHashTrie<K, V> t = toTransient();
        t.filterAll(predicate);
        return t.freeze();
    }

    /**
     * Opens a transient session on this trie.
     *
     * @return a new transient session that starts with the entries of this trie
     */
    public TransientHashTrie<K, V> toTransient() {
        return new TransientHashTrie<>(this);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns an iterator over the entries of this trie.
     * <p>
     * The iteration order is stable for a given trie, but it is not the
     * insertion order.
     *
     * @return a new iterator
     */
    @Override
    public io.vavr.collection.Iterator<Tuple2<K, V>> iterator() {
        return new ChampIteration.IteratorFacade<>(spliterator());
    }

    public io.vavr.collection.Iterator<K> keysIterator() {
        return new ChampIteration.IteratorFacade<>(new ChampIteration.ChampSpliterator<>(root,
                SimpleImmutableEntry::getKey,
                Spliterator.DISTINCT | Spliterator.SIZED | Spliterator.SUBSIZED | Spliterator.IMMUTABLE, size));
    }

    public io.vavr.collection.Iterator<V> valuesIterator() {
        return new ChampIteration.IteratorFacade<>(new ChampIteration.ChampSpliterator<>(root,
                SimpleImmutableEntry::getValue,
                Spliterator.SIZED | Spliterator.SUBSIZED | Spliterator.IMMUTABLE, size));
    }

    @Override
    public Spliterator<Tuple2<K, V>> spliterator() {
        return new ChampIteration.ChampSpliterator<>(root, entry -> new Tuple2<>(entry.getKey(), entry.getValue()),
                Spliterator.DISTINCT | Spliterator.SIZED | Spliterator.SUBSIZED | Spliterator.IMMUTABLE, size);
    }

    /**
     * Two tries are equal if they use equal {@link KeyHashing}s, if they have
     * the same size, and if every entry of one trie is contained with an equal
     * value in the other trie. Lazy values are forced.
     * <p>
     * Tries with different hashings are never equal, because the hash code of
     * a trie is computed with its hashing.
     */
    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(final Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof HashTrie)) {
            return false;
        }
        final HashTrie<Object, Object> that = (HashTrie<Object, Object>) other;
        if (size != that.size || !Objects.equals(hashing, that.hashing)) {
            return false;
        }
        if (root == (Object) that.root) {
            return true;
        }
        for (Tuple2<K, V> entry : this) {
            final Object found = that.findEntry(entry._1);
            if (found == ChampTrie.Node.NO_DATA
                    || !Objects.equals(entry._2, ((SimpleImmutableEntry<Object, Object>) found).getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Tuple2<K, V> entry : this) {
            h += hashing.hash(entry._1) ^ Objects.hashCode(entry._2);
        }
        return h;
    }

    @Override
    public String toString() {
        return iterator().map(e -> e._1 + " -> " + e._2).mkString("HashTrie(", ", ", ")");
    }

    // -- Serialization

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    /**
     * A serialization proxy which, in this context, is used to deserialize
     * tries with final instance fields.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient HashTrie<K, V> trie;

        /**
         * Constructor for the case of serialization, called by {@link HashTrie#writeReplace()}.
         * <p/>
         * The constructor of a SerializationProxy takes an argument that concisely represents the logical state of
         * an instance of the enclosing class.
         *
         * @param trie a trie
         */
        SerializationProxy(HashTrie<K, V> trie) {
            this.trie = trie;
        }

        /**
         * Read an object from a deserialization stream.
         *
         * @param s An object deserialization stream.
         * @throws ClassNotFoundException If the object's class read from the stream cannot be found.
         * @throws InvalidObjectException If the stream contains a negative size.
         * @throws IOException            If an error occurs reading from the stream.
         */
        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final KeyHashing<K> hashing = (KeyHashing<K>) s.readObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            final TransientHashTrie<K, V> t = HashTrie.<K, V>empty(hashing).toTransient();
            for (int i = 0; i < size; i++) {
                final K key = (K) s.readObject();
                final V value = (V) s.readObject();
                t.put(key, value);
            }
            trie = t.freeze();
        }

        /**
         * {@code readResolve} method for the serialization proxy pattern.
         * <p>
         * Returns a logically equivalent instance of the enclosing class. The presence of this method causes the
         * serialization system to translate the serialization proxy back into an instance of the enclosing class
         * upon deserialization.
         *
         * @return A deserialized instance of the enclosing class.
         */
        private Object readResolve() {
            return trie;
        }

        /**
         * Write an object to a serialization stream.
         *
         * @param s An object serialization stream.
         * @throws IOException If an error occurs writing to the stream.
         */
        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeObject(trie.hashing);
            s.writeInt(trie.size());
            for (Tuple2<K, V> e : trie) {
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }
    }
}
