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
import java.util.Arrays;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

/**
 * Provides the nodes of a Compressed Hash-Array Mapped Prefix-tree (CHAMP).
 * <p>
 * A CHAMP trie is a hash array mapped trie that stores data entries and
 * sub-nodes in two separate bitmaps, so that a node never contains empty
 * slots and so that every set of entries has exactly one canonical shape
 * (unless entries have fully identical hashes).
 * <p>
 * Each level of the trie consumes {@value Node#BIT_PARTITION_SIZE} bits of a
 * 32-bit hash. A node has up to 32 slots. A slot holds either a data entry
 * inline, or a sub-node. Entries whose hashes are identical in all 32 bits
 * are stored in a {@link HashCollisionNode}.
 * <p>
 * Nodes are immutable, unless they are owned by a transient session. A node
 * that has been created with a non-null {@link IdentityObject} owner may be
 * updated in place by any operation that is invoked with the same owner.
 * Operations that are invoked with a {@code null} owner always copy the path
 * from the edit point up to the root.
 * <p>
 * References:
 * <p>
 * The design of this class follows the CHAMP nodes of 'The Capsule Hash Trie
 * Collections Library' and of 'JHotDraw 8'.
 * <dl>
 *     <dt>Michael J. Steindorfer (2017).
 *     Efficient Immutable Collections.</dt>
 *     <dd><a href="https://michael.steindorfer.name/publications/phd-thesis-efficient-immutable-collections">michael.steindorfer.name</a>
 *     </dd>
 * </dl>
 */
final class ChampTrie {

    private ChampTrie() {
    }

    /**
     * An object with a unique identity within this VM.
     * <p>
     * Used as the owner token of a transient session.
     */
    static final class IdentityObject implements Serializable {

        private static final long serialVersionUID = 0L;

        IdentityObject() {
        }
    }

    /**
     * Receives the outcome of a single put or remove operation.
     *
     * @param <D> the data type
     */
    static final class ChangeEvent<D> {

        enum Type {
            UNCHANGED,
            ADDED,
            REMOVED,
            REPLACED
        }

        private Type type = Type.UNCHANGED;
        private D oldData;
        private D newData;

        ChangeEvent() {
        }

        void found(D data) {
            this.oldData = data;
        }

        void setAdded(D newData) {
            this.newData = newData;
            this.type = Type.ADDED;
        }

        void setRemoved(D oldData) {
            this.oldData = oldData;
            this.type = Type.REMOVED;
        }

        void setReplaced(D oldData, D newData) {
            this.oldData = oldData;
            this.newData = newData;
            this.type = Type.REPLACED;
        }

        Type getType() {
            return type;
        }

        /**
         * Returns the data that was found, replaced or removed.
         *
         * @return the old data, or {@code null} if no data was found
         */
        D getOldData() {
            return oldData;
        }

        /**
         * Returns the data that was added or that replaced the old data.
         *
         * @return the new data, or {@code null} if nothing was stored
         */
        D getNewData() {
            return newData;
        }

        boolean isModified() {
            return type != Type.UNCHANGED;
        }

        boolean isAdded() {
            return type == Type.ADDED;
        }

        boolean isReplaced() {
            return type == Type.REPLACED;
        }
    }

    /**
     * Abstract base class for a node of the trie.
     *
     * @param <D> the data type
     */
    abstract static class Node<D> {
        /**
         * Represents no data.
         * We can not use {@code null}, because we allow storing null-data in the trie.
         */
        static final Object NO_DATA = new Object();
        static final int HASH_CODE_LENGTH = 32;
        /**
         * Bit partition size in the range [1,5].
         * <p>
         * The bitmaps of a node are 32 bits wide, so we can not use more than 5 bits
         * per level.
         */
        static final int BIT_PARTITION_SIZE = 5;
        static final int BIT_PARTITION_MASK = (1 << BIT_PARTITION_SIZE) - 1;
        /**
         * Maximal number of bitmap-indexed levels on a path from the root.
         */
        static final int MAX_DEPTH = (HASH_CODE_LENGTH + BIT_PARTITION_SIZE - 1) / BIT_PARTITION_SIZE;

        Node() {
        }

        static int bitpos(int mask) {
            return 1 << mask;
        }

        static int mask(int dataHash, int shift) {
            return (dataHash >>> shift) & BIT_PARTITION_MASK;
        }

        static <D> Node<D> mergeTwoDataEntriesIntoNode(IdentityObject owner,
                                                      D data0, int dataHash0,
                                                      D data1, int dataHash1,
                                                      int shift) {
            if (shift >= HASH_CODE_LENGTH) {
                return HashCollisionNode.newHashCollisionNode(owner, dataHash0, new Object[]{data0, data1});
            }

            final int mask0 = mask(dataHash0, shift);
            final int mask1 = mask(dataHash1, shift);

            if (mask0 != mask1) {
                // both nodes fit on same level
                final int dataMap = bitpos(mask0) | bitpos(mask1);
                final Object[] entries = mask0 < mask1
                        ? new Object[]{data0, data1}
                        : new Object[]{data1, data0};
                return BitmapIndexedNode.newBitmapIndexedNode(owner, 0, dataMap, entries);
            }
            final Node<D> node = mergeTwoDataEntriesIntoNode(owner,
                    data0, dataHash0,
                    data1, dataHash1,
                    shift + BIT_PARTITION_SIZE);
            // values fit on next level
            final int nodeMap = bitpos(mask0);
            return BitmapIndexedNode.newBitmapIndexedNode(owner, nodeMap, 0, new Object[]{node});
        }

        abstract int dataArity();

        abstract int nodeArity();

        abstract D getData(int index);

        abstract Node<D> getNode(int index);

        boolean hasData() {
            return dataArity() != 0;
        }

        boolean hasNodes() {
            return nodeArity() != 0;
        }

        boolean hasDataArityOne() {
            return dataArity() == 1;
        }

        IdentityObject getOwner() {
            return null;
        }

        /**
         * Returns true if this node may be updated in place by an operation
         * that is invoked with the given owner.
         *
         * @param y the owner of the operation, may be null
         * @return true if the node is owned by {@code y}
         */
        boolean isAllowedToUpdate(IdentityObject y) {
            final IdentityObject x = getOwner();
            return x != null && x == y;
        }

        /**
         * Finds a data object in the subtree of this node.
         *
         * @param data           the provided data object (only its key part is relevant)
         * @param dataHash       the hash code of the data
         * @param shift          the shift for this node
         * @param equalsFunction a function that tests data objects for equality of their keys
         * @return the found data, returns {@link #NO_DATA} if no data in the trie
         * matches the provided data.
         */
        abstract Object find(D data, int dataHash, int shift, BiPredicate<D, D> equalsFunction);

        /**
         * Inserts or replaces a data object in the subtree of this node.
         *
         * @param owner          the owner of the operation, or {@code null} for a persistent update
         * @param newData        the data to be inserted
         * @param dataHash       the hash code of the data
         * @param shift          the shift for this node
         * @param details        receives the outcome of the operation
         * @param updateFunction decides which data is kept if the trie already contains data
         *                       with the same key: receives the old data and {@code newData};
         *                       returning the old data leaves the trie unchanged
         * @param equalsFunction a function that tests data objects for equality of their keys
         * @param hashFunction   a function that computes the hash code of a data object
         * @return the updated node, or {@code this} if the trie is unchanged
         */
        Node<D> put(IdentityObject owner, D newData, int dataHash, int shift, ChangeEvent<D> details,
                    BiFunction<D, D, D> updateFunction,
                    BiPredicate<D, D> equalsFunction,
                    ToIntFunction<D> hashFunction) {
            return put(owner, newData, dataHash, shift, details, UnaryOperator.identity(),
                    updateFunction, equalsFunction, hashFunction);
        }

        /**
         * Inserts or replaces a data object in the subtree of this node.
         * <p>
         * Unlike {@link #put(IdentityObject, Object, int, int, ChangeEvent, BiFunction, BiPredicate, ToIntFunction)}
         * the provided data object may be a placeholder that only carries the key:
         * {@code addFunction} turns it into the data object that is stored if the
         * trie contains no data with the same key. Exactly one of
         * {@code addFunction} and {@code updateFunction} is invoked, exactly once.
         *
         * @param owner          the owner of the operation, or {@code null} for a persistent update
         * @param newData        the data to be inserted, or a key-only placeholder for it
         * @param dataHash       the hash code of the data
         * @param shift          the shift for this node
         * @param details        receives the outcome of the operation
         * @param addFunction    computes the stored data if no data with the same key exists
         * @param updateFunction computes the stored data from the old data and {@code newData}
         * @param equalsFunction a function that tests data objects for equality of their keys
         * @param hashFunction   a function that computes the hash code of a data object
         * @return the updated node, or {@code this} if the trie is unchanged
         */
        abstract Node<D> put(IdentityObject owner, D newData, int dataHash, int shift, ChangeEvent<D> details,
                             UnaryOperator<D> addFunction,
                             BiFunction<D, D, D> updateFunction,
                             BiPredicate<D, D> equalsFunction,
                             ToIntFunction<D> hashFunction);

        /**
         * Removes a data object from the subtree of this node.
         *
         * @param owner          the owner of the operation, or {@code null} for a persistent update
         * @param data           the data to be removed (only its key part is relevant)
         * @param dataHash       the hash code of the data
         * @param shift          the shift for this node
         * @param details        receives the outcome of the operation
         * @param equalsFunction a function that tests data objects for equality of their keys
         * @return the updated node, or {@code this} if the trie is unchanged
         */
        abstract Node<D> remove(IdentityObject owner, D data, int dataHash, int shift, ChangeEvent<D> details,
                                BiPredicate<D, D> equalsFunction);
    }

    /**
     * Represents a bitmap-indexed node in a CHAMP trie.
     * <p>
     * The {@code mixed} array contains the data entries from the front, in the order of
     * their slots, followed by the sub-nodes in reversed slot order. This saves a field
     * for the offset of the first sub-node.
     *
     * @param <D> the data type
     */
    static class BitmapIndexedNode<D> extends Node<D> {
        private static final BitmapIndexedNode<?> EMPTY_NODE = new BitmapIndexedNode<>(0, 0, new Object[0]);

        // The fields are only written while the node is owned by a transient session.
        Object[] mixed;
        private int nodeMap;
        private int dataMap;

        BitmapIndexedNode(int nodeMap, int dataMap, Object[] mixed) {
            this.nodeMap = nodeMap;
            this.dataMap = dataMap;
            this.mixed = mixed;
            assert mixed.length == nodeArity() + dataArity();
        }

        @SuppressWarnings("unchecked")
        static <D> BitmapIndexedNode<D> emptyNode() {
            return (BitmapIndexedNode<D>) EMPTY_NODE;
        }

        static <D> BitmapIndexedNode<D> newBitmapIndexedNode(IdentityObject owner, int nodeMap,
                                                             int dataMap, Object[] mixed) {
            return owner == null
                    ? new BitmapIndexedNode<>(nodeMap, dataMap, mixed)
                    : new MutableBitmapIndexedNode<>(owner, nodeMap, dataMap, mixed);
        }

        int dataMap() {
            return dataMap;
        }

        int nodeMap() {
            return nodeMap;
        }

        int dataIndex(int bitpos) {
            return Integer.bitCount(dataMap & (bitpos - 1));
        }

        int nodeIndex(int bitpos) {
            return Integer.bitCount(nodeMap & (bitpos - 1));
        }

        @Override
        int dataArity() {
            return Integer.bitCount(dataMap);
        }

        @Override
        int nodeArity() {
            return Integer.bitCount(nodeMap);
        }

        @Override
        @SuppressWarnings("unchecked")
        D getData(int index) {
            return (D) mixed[index];
        }

        @Override
        @SuppressWarnings("unchecked")
        Node<D> getNode(int index) {
            return (Node<D>) mixed[mixed.length - 1 - index];
        }

        @SuppressWarnings("unchecked")
        Node<D> nodeAt(int bitpos) {
            return (Node<D>) mixed[mixed.length - 1 - nodeIndex(bitpos)];
        }

        @Override
        Object find(D data, int dataHash, int shift, BiPredicate<D, D> equalsFunction) {
            final int bitpos = bitpos(mask(dataHash, shift));
            if ((nodeMap & bitpos) != 0) {
                return nodeAt(bitpos).find(data, dataHash, shift + BIT_PARTITION_SIZE, equalsFunction);
            }
            if ((dataMap & bitpos) != 0) {
                final D k = getData(dataIndex(bitpos));
                if (equalsFunction.test(k, data)) {
                    return k;
                }
            }
            return NO_DATA;
        }

        @Override
        BitmapIndexedNode<D> put(IdentityObject owner, D newData, int dataHash, int shift, ChangeEvent<D> details,
                                 BiFunction<D, D, D> updateFunction,
                                 BiPredicate<D, D> equalsFunction,
                                 ToIntFunction<D> hashFunction) {
            return put(owner, newData, dataHash, shift, details, UnaryOperator.identity(),
                    updateFunction, equalsFunction, hashFunction);
        }

        @Override
        BitmapIndexedNode<D> put(IdentityObject owner, D newData, int dataHash, int shift, ChangeEvent<D> details,
                                 UnaryOperator<D> addFunction,
                                 BiFunction<D, D, D> updateFunction,
                                 BiPredicate<D, D> equalsFunction,
                                 ToIntFunction<D> hashFunction) {
            final int mask = mask(dataHash, shift);
            final int bitpos = bitpos(mask);
            if ((dataMap & bitpos) != 0) {
                final int dataIndex = dataIndex(bitpos);
                final D oldData = getData(dataIndex);
                if (equalsFunction.test(oldData, newData)) {
                    final D updatedData = updateFunction.apply(oldData, newData);
                    if (updatedData == oldData) {
                        details.found(oldData);
                        return this;
                    }
                    details.setReplaced(oldData, updatedData);
                    return copyAndSetData(owner, dataIndex, updatedData);
                }
                final D addedData = addFunction.apply(newData);
                final Node<D> updatedSubNode =
                        mergeTwoDataEntriesIntoNode(owner,
                                oldData, hashFunction.applyAsInt(oldData),
                                addedData, dataHash, shift + BIT_PARTITION_SIZE);
                details.setAdded(addedData);
                return copyAndMigrateFromDataToNode(owner, bitpos, updatedSubNode);
            } else if ((nodeMap & bitpos) != 0) {
                final Node<D> subNode = nodeAt(bitpos);
                final Node<D> updatedSubNode = subNode.put(owner, newData, dataHash, shift + BIT_PARTITION_SIZE,
                        details, addFunction, updateFunction, equalsFunction, hashFunction);
                return subNode == updatedSubNode ? this : copyAndSetNode(owner, bitpos, updatedSubNode);
            }
            final D addedData = addFunction.apply(newData);
            details.setAdded(addedData);
            return copyAndInsertData(owner, bitpos, addedData);
        }

        @Override
        BitmapIndexedNode<D> remove(IdentityObject owner, D data, int dataHash, int shift, ChangeEvent<D> details,
                                    BiPredicate<D, D> equalsFunction) {
            final int mask = mask(dataHash, shift);
            final int bitpos = bitpos(mask);
            if ((dataMap & bitpos) != 0) {
                return removeData(owner, data, dataHash, shift, details, bitpos, equalsFunction);
            }
            if ((nodeMap & bitpos) != 0) {
                return removeSubNode(owner, data, dataHash, shift, details, bitpos, equalsFunction);
            }
            return this;
        }

        private BitmapIndexedNode<D> removeData(IdentityObject owner, D data, int dataHash, int shift,
                                                ChangeEvent<D> details, int bitpos,
                                                BiPredicate<D, D> equalsFunction) {
            final int dataIndex = dataIndex(bitpos);
            final D oldData = getData(dataIndex);
            if (!equalsFunction.test(oldData, data)) {
                return this;
            }
            details.setRemoved(oldData);
            if (shift != 0 && dataArity() == 2 && !hasNodes()) {
                // The remaining entry shares the hash bits below 'shift' with the removed one,
                // so its slot at the root level can be computed from 'dataHash'.
                return newBitmapIndexedNode(owner, 0, bitpos(mask(dataHash, 0)),
                        new Object[]{getData(dataIndex ^ 1)});
            }
            return copyAndRemoveData(owner, dataIndex, bitpos);
        }

        private BitmapIndexedNode<D> removeSubNode(IdentityObject owner, D data, int dataHash, int shift,
                                                   ChangeEvent<D> details, int bitpos,
                                                   BiPredicate<D, D> equalsFunction) {
            final Node<D> subNode = nodeAt(bitpos);
            final Node<D> updatedSubNode =
                    subNode.remove(owner, data, dataHash, shift + BIT_PARTITION_SIZE, details, equalsFunction);
            if (subNode == updatedSubNode) {
                return this;
            }
            if (!updatedSubNode.hasNodes() && updatedSubNode.hasDataArityOne()) {
                if (!hasData() && nodeArity() == 1) {
                    // collapse: this node only holds the shrunk sub-node, propagate it upwards
                    return (BitmapIndexedNode<D>) updatedSubNode;
                }
                return copyAndMigrateFromNodeToData(owner, bitpos, updatedSubNode);
            }
            return copyAndSetNode(owner, bitpos, updatedSubNode);
        }

        private BitmapIndexedNode<D> copyAndSetData(IdentityObject owner, int dataIndex, D updatedData) {
            if (isAllowedToUpdate(owner)) {
                mixed[dataIndex] = updatedData;
                return this;
            }
            final Object[] newMixed = mixed.clone();
            newMixed[dataIndex] = updatedData;
            return newBitmapIndexedNode(owner, nodeMap, dataMap, newMixed);
        }

        private BitmapIndexedNode<D> copyAndSetNode(IdentityObject owner, int bitpos, Node<D> node) {
            final int idx = mixed.length - 1 - nodeIndex(bitpos);
            if (isAllowedToUpdate(owner)) {
                mixed[idx] = node;
                return this;
            }
            final Object[] newMixed = mixed.clone();
            newMixed[idx] = node;
            return newBitmapIndexedNode(owner, nodeMap, dataMap, newMixed);
        }

        private BitmapIndexedNode<D> copyAndInsertData(IdentityObject owner, int bitpos, D data) {
            final int idx = dataIndex(bitpos);
            final Object[] dst = new Object[mixed.length + 1];
            System.arraycopy(mixed, 0, dst, 0, idx);
            dst[idx] = data;
            System.arraycopy(mixed, idx, dst, idx + 1, mixed.length - idx);
            return updatedOrCopied(owner, nodeMap, dataMap | bitpos, dst);
        }

        private BitmapIndexedNode<D> copyAndRemoveData(IdentityObject owner, int dataIndex, int bitpos) {
            final Object[] dst = new Object[mixed.length - 1];
            System.arraycopy(mixed, 0, dst, 0, dataIndex);
            System.arraycopy(mixed, dataIndex + 1, dst, dataIndex, mixed.length - dataIndex - 1);
            return updatedOrCopied(owner, nodeMap, dataMap ^ bitpos, dst);
        }

        private BitmapIndexedNode<D> copyAndMigrateFromDataToNode(IdentityObject owner, int bitpos, Node<D> node) {
            final int idxOld = dataIndex(bitpos);
            final int idxNew = mixed.length - 1 - nodeIndex(bitpos);
            assert idxOld <= idxNew;

            // copy 'src' and remove 1 element(s) at position 'idxOld' and
            // insert 1 element(s) at position 'idxNew'
            final Object[] dst = new Object[mixed.length];
            System.arraycopy(mixed, 0, dst, 0, idxOld);
            System.arraycopy(mixed, idxOld + 1, dst, idxOld, idxNew - idxOld);
            dst[idxNew] = node;
            System.arraycopy(mixed, idxNew + 1, dst, idxNew + 1, mixed.length - idxNew - 1);
            return updatedOrCopied(owner, nodeMap | bitpos, dataMap ^ bitpos, dst);
        }

        private BitmapIndexedNode<D> copyAndMigrateFromNodeToData(IdentityObject owner, int bitpos, Node<D> node) {
            final int idxOld = mixed.length - 1 - nodeIndex(bitpos);
            final int idxNew = dataIndex(bitpos);

            // copy 'src' and remove 1 element(s) at position 'idxOld' and
            // insert 1 element(s) at position 'idxNew'
            final Object[] dst = new Object[mixed.length];
            assert idxOld >= idxNew;
            System.arraycopy(mixed, 0, dst, 0, idxNew);
            dst[idxNew] = node.getData(0);
            System.arraycopy(mixed, idxNew, dst, idxNew + 1, idxOld - idxNew);
            System.arraycopy(mixed, idxOld + 1, dst, idxOld + 1, mixed.length - idxOld - 1);
            return updatedOrCopied(owner, nodeMap ^ bitpos, dataMap | bitpos, dst);
        }

        private BitmapIndexedNode<D> updatedOrCopied(IdentityObject owner, int newNodeMap, int newDataMap,
                                                     Object[] newMixed) {
            if (isAllowedToUpdate(owner)) {
                this.nodeMap = newNodeMap;
                this.dataMap = newDataMap;
                this.mixed = newMixed;
                return this;
            }
            return newBitmapIndexedNode(owner, newNodeMap, newDataMap, newMixed);
        }
    }

    /**
     * A bitmap-indexed node that is owned by a transient session.
     *
     * @param <D> the data type
     */
    static class MutableBitmapIndexedNode<D> extends BitmapIndexedNode<D> {
        private final IdentityObject ownedBy;

        MutableBitmapIndexedNode(IdentityObject ownedBy, int nodeMap, int dataMap, Object[] nodes) {
            super(nodeMap, dataMap, nodes);
            this.ownedBy = ownedBy;
        }

        @Override
        IdentityObject getOwner() {
            return ownedBy;
        }
    }

    /**
     * Represents a hash-collision node in a CHAMP trie.
     * <p>
     * All entries of this node have the same 32-bit hash. Entries are kept in
     * insertion order; lookups scan them linearly.
     *
     * @param <D> the data type
     */
    static class HashCollisionNode<D> extends Node<D> {
        private final int hash;
        // Only written while the node is owned by a transient session.
        Object[] data;

        HashCollisionNode(int hash, Object[] data) {
            this.data = data;
            this.hash = hash;
        }

        static <D> HashCollisionNode<D> newHashCollisionNode(IdentityObject owner, int hash, Object[] entries) {
            return owner == null
                    ? new HashCollisionNode<>(hash, entries)
                    : new MutableHashCollisionNode<>(owner, hash, entries);
        }

        int hash() {
            return hash;
        }

        @Override
        int dataArity() {
            return data.length;
        }

        @Override
        int nodeArity() {
            return 0;
        }

        @Override
        boolean hasDataArityOne() {
            return false;
        }

        @Override
        @SuppressWarnings("unchecked")
        D getData(int index) {
            return (D) data[index];
        }

        @Override
        Node<D> getNode(int index) {
            throw new IllegalStateException("Is leaf node.");
        }

        @Override
        @SuppressWarnings("unchecked")
        Object find(D key, int dataHash, int shift, BiPredicate<D, D> equalsFunction) {
            if (hash != dataHash) {
                return NO_DATA;
            }
            for (Object entry : data) {
                if (equalsFunction.test((D) entry, key)) {
                    return entry;
                }
            }
            return NO_DATA;
        }

        @Override
        @SuppressWarnings("unchecked")
        Node<D> put(IdentityObject owner, D newData, int dataHash, int shift, ChangeEvent<D> details,
                    UnaryOperator<D> addFunction,
                    BiFunction<D, D, D> updateFunction,
                    BiPredicate<D, D> equalsFunction,
                    ToIntFunction<D> hashFunction) {
            assert this.hash == dataHash;

            for (int i = 0; i < data.length; i++) {
                final D oldData = (D) data[i];
                if (equalsFunction.test(oldData, newData)) {
                    final D updatedData = updateFunction.apply(oldData, newData);
                    if (updatedData == oldData) {
                        details.found(oldData);
                        return this;
                    }
                    details.setReplaced(oldData, updatedData);
                    if (isAllowedToUpdate(owner)) {
                        this.data[i] = updatedData;
                        return this;
                    }
                    final Object[] newKeys = data.clone();
                    newKeys[i] = updatedData;
                    return newHashCollisionNode(owner, dataHash, newKeys);
                }
            }

            // copy entries and add 1 more at the end
            final D addedData = addFunction.apply(newData);
            final Object[] entriesNew = Arrays.copyOf(data, data.length + 1);
            entriesNew[data.length] = addedData;
            details.setAdded(addedData);
            if (isAllowedToUpdate(owner)) {
                this.data = entriesNew;
                return this;
            }
            return newHashCollisionNode(owner, dataHash, entriesNew);
        }

        @Override
        @SuppressWarnings("unchecked")
        Node<D> remove(IdentityObject owner, D data, int dataHash, int shift, ChangeEvent<D> details,
                       BiPredicate<D, D> equalsFunction) {
            if (hash != dataHash) {
                return this;
            }
            for (int idx = 0; idx < this.data.length; idx++) {
                final D currentData = (D) this.data[idx];
                if (equalsFunction.test(currentData, data)) {
                    details.setRemoved(currentData);
                    if (this.data.length == 2) {
                        // Create a node with the remaining entry. This node will either
                        // become the new root, or be unwrapped and inlined by its parent.
                        return BitmapIndexedNode.newBitmapIndexedNode(owner, 0, bitpos(mask(dataHash, 0)),
                                new Object[]{getData(idx ^ 1)});
                    }
                    // copy entries and remove 1 element at position idx
                    final Object[] entriesNew = new Object[this.data.length - 1];
                    System.arraycopy(this.data, 0, entriesNew, 0, idx);
                    System.arraycopy(this.data, idx + 1, entriesNew, idx, this.data.length - idx - 1);
                    if (isAllowedToUpdate(owner)) {
                        this.data = entriesNew;
                        return this;
                    }
                    return newHashCollisionNode(owner, dataHash, entriesNew);
                }
            }
            return this;
        }
    }

    /**
     * A hash-collision node that is owned by a transient session.
     *
     * @param <D> the data type
     */
    static class MutableHashCollisionNode<D> extends HashCollisionNode<D> {
        private final IdentityObject ownedBy;

        MutableHashCollisionNode(IdentityObject ownedBy, int hash, Object[] entries) {
            super(hash, entries);
            this.ownedBy = ownedBy;
        }

        @Override
        IdentityObject getOwner() {
            return ownedBy;
        }
    }
}
