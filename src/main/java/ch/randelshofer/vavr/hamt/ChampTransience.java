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

/**
 * Provides abstract base classes for transient sessions over a CHAMP trie.
 */
final class ChampTransience {

    private ChampTransience() {
    }

    /**
     * Abstract base class for a transient session over a CHAMP trie.
     * <p>
     * The session starts with the root of a persistent trie. Nodes that the
     * session creates are tagged with the owner of the session, and are updated
     * in place by subsequent edits. Nodes that are shared with the persistent
     * trie are copied on first write.
     * <p>
     * Once the session has been frozen, the owner is dropped: the nodes that
     * the session has created can no longer be updated in place, and any
     * further use of the session fails with an {@link IllegalStateException}.
     * <p>
     * A session must be confined to a single thread.
     *
     * @param <D> the data type of the trie
     */
    abstract static class AbstractTransientTrie<D> {
        static final String FROZEN_MESSAGE = "transient session is frozen";

        /**
         * The current owner id of this session, or {@code null} if the session
         * has not created any node yet.
         */
        ChampTrie.IdentityObject owner;
        ChampTrie.BitmapIndexedNode<D> root;
        int size;
        /**
         * The number of times this session has been structurally modified.
         */
        int modCount;
        private boolean frozen;

        AbstractTransientTrie(ChampTrie.BitmapIndexedNode<D> root, int size) {
            this.root = root;
            this.size = size;
        }

        ChampTrie.IdentityObject makeOwner() {
            checkNotFrozen();
            if (owner == null) {
                owner = new ChampTrie.IdentityObject();
            }
            return owner;
        }

        void checkNotFrozen() {
            if (frozen) {
                throw new IllegalStateException(FROZEN_MESSAGE);
            }
        }

        /**
         * Terminates the session.
         */
        void markFrozen() {
            checkNotFrozen();
            frozen = true;
            owner = null;
        }

        /**
         * Returns the number of entries in this session.
         *
         * @return the current size
         * @throws IllegalStateException if the session is frozen
         */
        public int size() {
            checkNotFrozen();
            return size;
        }

        public boolean isEmpty() {
            return size() == 0;
        }

        /**
         * Returns true if this session has been frozen.
         *
         * @return whether the session is terminated
         */
        public boolean isFrozen() {
            return frozen;
        }

        /**
         * Removes all entries. The session stays open.
         */
        public void clear() {
            checkNotFrozen();
            root = ChampTrie.BitmapIndexedNode.emptyNode();
            size = 0;
            modCount++;
        }
    }
}
