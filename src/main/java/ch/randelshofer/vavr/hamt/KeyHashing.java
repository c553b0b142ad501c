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

import java.io.Serializable;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/**
 * Hash function and equality predicate over the keys of a trie.
 * <p>
 * The hash function must be deterministic and stable for the lifetime of any
 * trie that uses it, and must be consistent with the equality predicate: keys
 * that are equal must have the same hash. A trie does not detect violations of
 * this contract; its behavior is undefined if the contract is violated.
 * <p>
 * Keys should never be {@link LazyValue}s.
 *
 * @param <K> the key type
 */
public interface KeyHashing<K> extends Serializable {

    /**
     * Returns the 32-bit hash of a key. All 32 bits are used for radix
     * addressing.
     *
     * @param key a key, may be null
     * @return the hash of the key
     */
    int hash(K key);

    /**
     * Tests two keys for equality.
     *
     * @param a a key, may be null
     * @param b a key, may be null
     * @return true if the keys are equal
     */
    boolean equals(K a, K b);

    /**
     * Returns the hashing that uses {@link Object#hashCode()} and
     * {@link Object#equals(Object)}, and that allows null keys.
     *
     * @param <K> the key type
     * @return the standard hashing
     */
    @SuppressWarnings("unchecked")
    static <K> KeyHashing<K> standard() {
        return (KeyHashing<K>) Standard.INSTANCE;
    }

    /**
     * Returns the hashing for tries whose keys are dense, non-negative
     * positions of a sequence. The hash of an index is the index itself.
     *
     * @return the index hashing
     */
    static KeyHashing<Integer> indexed() {
        return Indexed.INSTANCE;
    }

    /**
     * Creates a hashing from a hash function and an equality predicate.
     * <p>
     * The hashing is only serializable if both functions are serializable.
     *
     * @param hashFunction   the hash function
     * @param equalsFunction the equality predicate
     * @param <K>            the key type
     * @return a new hashing
     */
    static <K> KeyHashing<K> of(ToIntFunction<? super K> hashFunction, BiPredicate<? super K, ? super K> equalsFunction) {
        Objects.requireNonNull(hashFunction, "hashFunction is null");
        Objects.requireNonNull(equalsFunction, "equalsFunction is null");
        return new FunctionalHashing<>(hashFunction, equalsFunction);
    }

    enum Standard implements KeyHashing<Object> {
        INSTANCE;

        @Override
        public int hash(Object key) {
            return Objects.hashCode(key);
        }

        @Override
        public boolean equals(Object a, Object b) {
            return Objects.equals(a, b);
        }
    }

    enum Indexed implements KeyHashing<Integer> {
        INSTANCE;

        @Override
        public int hash(Integer index) {
            if (index == null || index < 0) {
                throw new IndexOutOfBoundsException("index: " + index);
            }
            return index;
        }

        @Override
        public boolean equals(Integer a, Integer b) {
            return Objects.equals(a, b);
        }
    }

    final class FunctionalHashing<K> implements KeyHashing<K> {
        private static final long serialVersionUID = 1L;

        @SuppressWarnings("serial") // Conditionally serializable
        private final ToIntFunction<? super K> hashFunction;
        @SuppressWarnings("serial") // Conditionally serializable
        private final BiPredicate<? super K, ? super K> equalsFunction;

        private FunctionalHashing(ToIntFunction<? super K> hashFunction, BiPredicate<? super K, ? super K> equalsFunction) {
            this.hashFunction = hashFunction;
            this.equalsFunction = equalsFunction;
        }

        @Override
        public int hash(K key) {
            return hashFunction.applyAsInt(key);
        }

        @Override
        public boolean equals(K a, K b) {
            return equalsFunction.test(a, b);
        }
    }
}
