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

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntSupplier;

/**
 * Iterators over the data entries of a CHAMP trie.
 */
final class ChampIteration {

    private ChampIteration() {
    }

    /**
     * Data iterator over a CHAMP trie.
     * <p>
     * Visits the trie depth-first. Within a node, the data entries are visited
     * in ascending slot order before the sub-nodes, which are also visited in
     * ascending slot order. The order is stable for a given trie.
     *
     * @param <K> the data type of the trie
     * @param <E> the element type of the spliterator
     */
    static class ChampSpliterator<K, E> extends Spliterators.AbstractSpliterator<E> {
        private final Function<K, E> mappingFunction;
        private final Deque<StackElement<K>> stack = new ArrayDeque<>(ChampTrie.Node.MAX_DEPTH + 1);
        private K current;

        ChampSpliterator(ChampTrie.Node<K> root, Function<K, E> mappingFunction, int characteristics, long size) {
            super(size, characteristics);
            if (root.hasData() || root.hasNodes()) {
                stack.push(new StackElement<>(root));
            }
            this.mappingFunction = mappingFunction;
        }

        E current() {
            return mappingFunction.apply(current);
        }

        boolean moveNext() {
            while (!stack.isEmpty()) {
                final StackElement<K> elem = stack.peek();
                final ChampTrie.Node<K> node = elem.node;
                if (elem.dataIndex < elem.dataArity) {
                    current = node.getData(elem.dataIndex++);
                    return true;
                }
                if (elem.nodeIndex < elem.nodeArity) {
                    stack.push(new StackElement<>(node.getNode(elem.nodeIndex++)));
                } else {
                    stack.pop();
                }
            }
            return false;
        }

        @Override
        public boolean tryAdvance(Consumer<? super E> action) {
            if (moveNext()) {
                action.accept(current());
                return true;
            }
            return false;
        }

        private static final class StackElement<K> {
            final ChampTrie.Node<K> node;
            final int dataArity;
            final int nodeArity;
            int dataIndex;
            int nodeIndex;

            StackElement(ChampTrie.Node<K> node) {
                this.node = node;
                this.dataArity = node.dataArity();
                this.nodeArity = node.nodeArity();
            }
        }
    }

    /**
     * Wraps a {@link Spliterator} into a vavr {@link io.vavr.collection.Iterator}.
     * <p>
     * If a modification counter is provided, the iterator fails fast with a
     * {@link ConcurrentModificationException} when the counter changes while
     * the iteration is in progress.
     *
     * @param <E> the element type
     */
    static class IteratorFacade<E> implements io.vavr.collection.Iterator<E>, Consumer<E> {
        private final Spliterator<E> spliterator;
        private final IntSupplier modCountSupplier;
        private final int expectedModCount;
        private boolean hasCurrent;
        private E current;

        IteratorFacade(Spliterator<E> spliterator) {
            this(spliterator, null);
        }

        IteratorFacade(Spliterator<E> spliterator, IntSupplier modCountSupplier) {
            this.spliterator = spliterator;
            this.modCountSupplier = modCountSupplier;
            this.expectedModCount = modCountSupplier == null ? 0 : modCountSupplier.getAsInt();
        }

        @Override
        public void accept(E e) {
            current = e;
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            if (!hasCurrent) {
                hasCurrent = spliterator.tryAdvance(this);
            }
            return hasCurrent;
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            hasCurrent = false;
            final E e = current;
            current = null;
            return e;
        }

        private void checkForComodification() {
            if (modCountSupplier != null && modCountSupplier.getAsInt() != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        @Override
        public String toString() {
            return stringPrefix() + "(?)";
        }
    }
}
