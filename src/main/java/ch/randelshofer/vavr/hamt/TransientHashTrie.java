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

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * A transient session over a {@link HashTrie}: supports efficient batches of
 * edits through transience.
 * <p>
 * The session is opened with {@link HashTrie#toTransient()} in O(1). Each edit
 * copies the nodes on its path that are still shared with the original trie,
 * and updates the nodes that the session has already copied in place. A
 * sequence of edits thus copies each distinct path at most once.
 * <p>
 * {@link #freeze()} ends the session and returns a persistent trie. After
 * that, every method except {@link #isFrozen()} throws an
 * {@link IllegalStateException}.
 * <p>
 * This class is not thread-safe. A session must be confined to one thread
 * from its creation until it is frozen.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TransientHashTrie<K, V> extends ChampTransience.AbstractTransientTrie<SimpleImmutableEntry<K, V>>
        implements Iterable<Tuple2<K, V>> {

    private final HashTrie<K, V> base;
    private final KeyHashing<K> hashing;

    TransientHashTrie(HashTrie<K, V> base) {
        super(base.root, base.size);
        this.base = base;
        this.hashing = base.hashing;
    }

    private boolean entryKeyEquals(SimpleImmutableEntry<K, V> a, SimpleImmutableEntry<K, V> b) {
        return hashing.equals(a.getKey(), b.getKey());
    }

    private int entryKeyHash(SimpleImmutableEntry<K, V> e) {
        return hashing.hash(e.getKey());
    }

    @SuppressWarnings("unchecked")
    public Option<V> get(K key) {
        checkNotFrozen();
        final Object result = root.find(new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0,
                this::entryKeyEquals);
        return result == ChampTrie.Node.NO_DATA
                ? Option.none()
                : Option.some(((SimpleImmutableEntry<K, V>) result).getValue());
    }

    public boolean containsKey(K key) {
        return get(key).isDefined();
    }

    /**
     * Maps the given key to the given value.
     *
     * @param key   a key
     * @param value a value
     * @return the previous value of the key, or {@link Option#none()} if the key was absent
     */
    public Option<V> put(K key, V value) {
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        root = root.put(makeOwner(), new SimpleImmutableEntry<>(key, value), hashing.hash(key), 0, details,
                HashTrie::updateEntry, this::entryKeyEquals, this::entryKeyHash);
        return afterPut(details);
    }

    /**
     * Maps the given key to the result of the update function, which receives
     * the current value of the key and is invoked exactly once.
     *
     * @param key            a key
     * @param updateFunction computes the new value from the current value
     * @return the previous value of the key, or {@link Option#none()} if the key was absent
     */
    public Option<V> update(K key, Function<? super Option<V>, ? extends V> updateFunction) {
        Objects.requireNonNull(updateFunction, "updateFunction is null");
        final Option<V> absent = Option.none();
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        root = root.put(makeOwner(), new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0, details,
                keyOnly -> new SimpleImmutableEntry<K, V>(key, updateFunction.apply(absent)),
                (oldv, keyOnly) -> {
                    final Option<V> present = Option.some(oldv.getValue());
                    return HashTrie.updateEntry(oldv, new SimpleImmutableEntry<K, V>(key, updateFunction.apply(present)));
                },
                this::entryKeyEquals, this::entryKeyHash);
        return afterPut(details);
    }

    private Option<V> afterPut(ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details) {
        if (details.isModified()) {
            modCount++;
            if (details.isAdded()) {
                size++;
                return Option.none();
            }
        }
        final SimpleImmutableEntry<K, V> oldData = details.getOldData();
        return oldData == null ? Option.none() : Option.some(oldData.getValue());
    }

    /**
     * Removes the given key.
     *
     * @param key a key
     * @return the removed value, or {@link Option#none()} if the key was absent
     */
    public Option<V> remove(K key) {
        final ChampTrie.ChangeEvent<SimpleImmutableEntry<K, V>> details = new ChampTrie.ChangeEvent<>();
        root = root.remove(makeOwner(), new SimpleImmutableEntry<>(key, null), hashing.hash(key), 0, details,
                this::entryKeyEquals);
        if (details.isModified()) {
            size--;
            modCount++;
            return Option.some(details.getOldData().getValue());
        }
        return Option.none();
    }

    /**
     * Puts all given entries.
     *
     * @param entries the entries
     * @return true if this session has been modified
     */
    public boolean putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        checkNotFrozen();
        final int oldModCount = modCount;
        for (Tuple2<? extends K, ? extends V> e : entries) {
            put(e._1, e._2);
        }
        return modCount != oldModCount;
    }

    /**
     * Removes all given keys.
     *
     * @param keys the keys
     * @return true if this session has been modified
     */
    public boolean removeAll(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        checkNotFrozen();
        if (isEmpty()) {
            return false;
        }
        final int oldModCount = modCount;
        for (K key : keys) {
            remove(key);
        }
        return modCount != oldModCount;
    }

    /**
     * Retains only the entries that satisfy the given predicate.
     *
     * @param predicate a predicate over key and value
     * @return true if this session has been modified
     */
    public boolean filterAll(BiPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        final List<K> rejected = new ArrayList<>();
        for (Tuple2<K, V> e : this) {
            if (!predicate.test(e._1, e._2)) {
                rejected.add(e._1);
            }
        }
        return removeAll(rejected);
    }

    /**
     * Returns an iterator over the current entries of this session.
     * The iterator fails with a {@link java.util.ConcurrentModificationException}
     * if the session is modified during the iteration.
     *
     * @return a new iterator
     */
    @Override
    public io.vavr.collection.Iterator<Tuple2<K, V>> iterator() {
        checkNotFrozen();
        return new ChampIteration.IteratorFacade<>(new ChampIteration.ChampSpliterator<>(root,
                entry -> new Tuple2<>(entry.getKey(), entry.getValue()),
                Spliterator.DISTINCT | Spliterator.SIZED | Spliterator.SUBSIZED, size),
                () -> modCount);
    }

    /**
     * Ends this session and returns a persistent trie with its entries.
     * <p>
     * The returned trie takes ownership of the nodes that this session has
     * created; the nodes that were shared with the original trie stay shared.
     *
     * @return the original trie if this session made no changes, otherwise a new trie
     * @throws IllegalStateException if this session has already been frozen
     */
    public HashTrie<K, V> freeze() {
        markFrozen();
        if (root == base.root) {
            return base;
        }
        return size == 0
                ? HashTrie.empty(hashing)
                : new HashTrie<>(root, size, hashing);
    }

    /**
     * Alias for {@link #freeze()}.
     *
     * @return the frozen trie
     */
    public HashTrie<K, V> toImmutable() {
        return freeze();
    }
}
