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

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.Function;

import static ch.randelshofer.vavr.hamt.ChampTrie.BitmapIndexedNode.emptyNode;

/**
 * Implements a persistent hash trie that stores a set of elements, using a
 * Compressed Hash-Array Mapped Prefix-tree (CHAMP).
 * <p>
 * The element is the whole entry: there is no value. Elements are unique
 * with respect to the {@link KeyHashing} of the set; adding an element that
 * is already present leaves the set unchanged.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 *
 * @param <E> the element type
 */
public final class HashTrieSet<E> implements Iterable<E>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final HashTrieSet<?> EMPTY = new HashTrieSet<>(emptyNode(), 0, KeyHashing.standard());

    final ChampTrie.BitmapIndexedNode<E> root;
    final int size;
    @SuppressWarnings("serial") // Written by the serialization proxy
    final KeyHashing<E> hashing;

    HashTrieSet(ChampTrie.BitmapIndexedNode<E> root, int size, KeyHashing<E> hashing) {
        this.root = root;
        this.size = size;
        this.hashing = hashing;
    }

    @SuppressWarnings("unchecked")
    public static <E> HashTrieSet<E> empty() {
        return (HashTrieSet<E>) EMPTY;
    }

    @SuppressWarnings("unchecked")
    public static <E> HashTrieSet<E> empty(KeyHashing<E> hashing) {
        Objects.requireNonNull(hashing, "hashing is null");
        return hashing == KeyHashing.standard()
                ? (HashTrieSet<E>) EMPTY
                : new HashTrieSet<>(emptyNode(), 0, hashing);
    }

    @SafeVarargs
    public static <E> HashTrieSet<E> of(E... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return HashTrieSet.<E>empty().addAll(java.util.Arrays.asList(elements));
    }

    public static <E> HashTrieSet<E> ofAll(Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements is null");
        return HashTrieSet.<E>empty().addAll(elements);
    }

    static <E> E updateElement(E oldElement, E newElement) {
        return oldElement;
    }

    public boolean contains(E element) {
        return root.find(element, hashing.hash(element), 0, hashing::equals) != ChampTrie.Node.NO_DATA;
    }

    /**
     * Returns a set that contains the given element and all elements of this set.
     *
     * @param element an element
     * @return the updated set, or {@code this} if the element is already present
     */
    public HashTrieSet<E> add(E element) {
        final ChampTrie.ChangeEvent<E> details = new ChampTrie.ChangeEvent<>();
        final ChampTrie.BitmapIndexedNode<E> newRootNode = root.put(null, element, hashing.hash(element), 0, details,
                HashTrieSet::updateElement, hashing::equals, hashing::hash);
        return details.isModified()
                ? new HashTrieSet<>(newRootNode, size + 1, hashing)
                : this;
    }

    /**
     * Returns a set that contains all elements of this set except the given one.
     *
     * @param element an element
     * @return the updated set, or {@code this} if the element is absent
     */
    public HashTrieSet<E> remove(E element) {
        final ChampTrie.ChangeEvent<E> details = new ChampTrie.ChangeEvent<>();
        final ChampTrie.BitmapIndexedNode<E> newRootNode = root.remove(null, element, hashing.hash(element), 0,
                details, hashing::equals);
        if (details.isModified()) {
            return size == 1 ? empty(hashing) : new HashTrieSet<>(newRootNode, size - 1, hashing);
        }
        return this;
    }

    public HashTrieSet<E> addAll(Iterable<? extends E> elements) {
        final TransientHashTrieSet<E> t = toTransient();
        t.addAll(elements);
        return t.freeze();
    }

    public HashTrieSet<E> removeAll(Iterable<? extends E> elements) {
        final TransientHashTrieSet<E> t = toTransient();
        t.removeAll(elements);
        return t.freeze();
    }

    public TransientHashTrieSet<E> toTransient() {
        return new TransientHashTrieSet<>(this);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public io.vavr.collection.Iterator<E> iterator() {
        return new ChampIteration.IteratorFacade<>(spliterator());
    }

    @Override
    public Spliterator<E> spliterator() {
        return new ChampIteration.ChampSpliterator<>(root, Function.identity(),
                Spliterator.DISTINCT | Spliterator.SIZED | Spliterator.SUBSIZED | Spliterator.IMMUTABLE, size);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof HashTrieSet)) {
            return false;
        }
        final HashTrieSet<Object> that = (HashTrieSet<Object>) other;
        // the hash code depends on the hashing, so sets with different hashings are never equal
        if (size != that.size || !Objects.equals(hashing, that.hashing)) {
            return false;
        }
        if (root == (Object) that.root) {
            return true;
        }
        for (E e : this) {
            if (!that.contains(e)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (E e : this) {
            h += hashing.hash(e);
        }
        return h;
    }

    @Override
    public String toString() {
        return iterator().mkString("HashTrieSet(", ", ", ")");
    }

    // -- Serialization

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<E> implements Serializable {

        private static final long serialVersionUID = 1L;

        private transient HashTrieSet<E> set;

        SerializationProxy(HashTrieSet<E> set) {
            this.set = set;
        }

        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final KeyHashing<E> hashing = (KeyHashing<E>) s.readObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            final TransientHashTrieSet<E> t = HashTrieSet.empty(hashing).toTransient();
            for (int i = 0; i < size; i++) {
                t.add((E) s.readObject());
            }
            set = t.freeze();
        }

        private Object readResolve() {
            return set;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeObject(set.hashing);
            s.writeInt(set.size());
            for (E e : set) {
                s.writeObject(e);
            }
        }
    }
}
