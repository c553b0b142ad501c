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

import java.util.Objects;
import java.util.Spliterator;
import java.util.function.Function;

/**
 * A transient session over a {@link HashTrieSet}.
 * <p>
 * Follows the same protocol as {@link TransientHashTrie}: edits copy shared
 * nodes on first write and update owned nodes in place; {@link #freeze()}
 * ends the session.
 * <p>
 * This class is not thread-safe.
 *
 * @param <E> the element type
 */
public final class TransientHashTrieSet<E> extends ChampTransience.AbstractTransientTrie<E>
        implements Iterable<E> {

    private final HashTrieSet<E> base;
    private final KeyHashing<E> hashing;

    TransientHashTrieSet(HashTrieSet<E> base) {
        super(base.root, base.size);
        this.base = base;
        this.hashing = base.hashing;
    }

    public boolean contains(E element) {
        checkNotFrozen();
        return root.find(element, hashing.hash(element), 0, hashing::equals) != ChampTrie.Node.NO_DATA;
    }

    /**
     * Adds an element.
     *
     * @param element an element
     * @return true if the element was absent
     */
    public boolean add(E element) {
        final ChampTrie.ChangeEvent<E> details = new ChampTrie.ChangeEvent<>();
        root = root.put(makeOwner(), element, hashing.hash(element), 0, details,
                HashTrieSet::updateElement, hashing::equals, hashing::hash);
        if (details.isModified()) {
            size++;
            modCount++;
        }
        return details.isModified();
    }

    /**
     * Removes an element.
     *
     * @param element an element
     * @return true if the element was present
     */
    public boolean remove(E element) {
        final ChampTrie.ChangeEvent<E> details = new ChampTrie.ChangeEvent<>();
        root = root.remove(makeOwner(), element, hashing.hash(element), 0, details, hashing::equals);
        if (details.isModified()) {
            size--;
            modCount++;
        }
        return details.isModified();
    }

    public boolean addAll(Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements is null");
        checkNotFrozen();
        boolean added = false;
        for (E e : elements) {
            added |= add(e);
        }
        return added;
    }

    public boolean removeAll(Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements is null");
        checkNotFrozen();
        boolean removed = false;
        for (E e : elements) {
            removed |= remove(e);
        }
        return removed;
    }

    @Override
    public io.vavr.collection.Iterator<E> iterator() {
        checkNotFrozen();
        return new ChampIteration.IteratorFacade<>(new ChampIteration.ChampSpliterator<>(root, Function.identity(),
                Spliterator.DISTINCT | Spliterator.SIZED | Spliterator.SUBSIZED, size),
                () -> modCount);
    }

    /**
     * Ends this session and returns a persistent set with its elements.
     *
     * @return the original set if this session made no changes, otherwise a new set
     * @throws IllegalStateException if this session has already been frozen
     */
    public HashTrieSet<E> freeze() {
        markFrozen();
        if (root == base.root) {
            return base;
        }
        return size == 0
                ? HashTrieSet.empty(hashing)
                : new HashTrieSet<>(root, size, hashing);
    }
}
