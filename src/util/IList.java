package util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Intrusive doubly linked list. Every element owns its {@link INode}, so an
 * element can be unlinked or re-inserted in O(1) without searching the list.
 *
 * @param <T> type of the elements
 * @param <P> type of the owner of the list (e.g. the block owning its instructions)
 */
public class IList<T, P> implements Iterable<IList.INode<T, P>> {
    private INode<T, P> entry; // head
    private INode<T, P> last;  // tail
    private final P val;       // owner
    private int numNode;

    public IList(P val) {
        this.val = val;
        this.numNode = 0;
        this.entry = null;
        this.last = null;
    }

    public P getVal() {
        return val;
    }

    public int getNumNode() {
        return numNode;
    }

    public boolean isEmpty() {
        return numNode == 0;
    }

    public INode<T, P> getEntry() {
        return entry;
    }

    public INode<T, P> getLast() {
        return last;
    }

    public Stream<INode<T, P>> stream() {
        return StreamSupport.stream(this.spliterator(), false);
    }

    @Override
    public Iterator<INode<T, P>> iterator() {
        return new IIterator(entry);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("IList(").append(numNode).append(") [");
        for (INode<T, P> cur = entry; cur != null; cur = cur.next) {
            sb.append(cur.getVal());
            if (cur.next != null) {
                sb.append(" <-> ");
            }
        }
        return sb.append("]").toString();
    }

    /**
     * The successor is captured before a node is handed out, so removing the
     * current node (directly or through {@link #remove()}) never breaks the walk.
     */
    private class IIterator implements Iterator<INode<T, P>> {
        private INode<T, P> current;
        private INode<T, P> next;

        IIterator(INode<T, P> head) {
            this.current = null;
            this.next = head;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public INode<T, P> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            current = next;
            next = next.getNext();
            return current;
        }

        @Override
        public void remove() {
            if (current == null || current.getParent() == null) {
                throw new IllegalStateException();
            }
            next = current.removeSelf();
            current = null;
        }
    }

    /**
     * A link of the list; holds the element and its neighbours.
     */
    public static class INode<T, P> {
        private final T val;
        private INode<T, P> prev;
        private INode<T, P> next;
        private IList<T, P> parent;

        public INode(T t) {
            this.val = t;
        }

        public T getVal() {
            return val;
        }

        public IList<T, P> getParent() {
            return parent;
        }

        public INode<T, P> getPrev() {
            return prev;
        }

        public INode<T, P> getNext() {
            return next;
        }

        public void insertAtEnd(IList<T, P> father) {
            if (father == null) {
                throw new IllegalArgumentException("Father list cannot be null.");
            }
            if (father.last == null) {
                linkAsOnly(father);
            } else {
                insertAfter(father.last);
            }
        }

        /**
         * Links this node directly before {@code next}, inside {@code next}'s list.
         */
        public void insertBefore(INode<T, P> next) {
            if (next == null || next.parent == null) {
                throw new IllegalArgumentException("Next node and its parent cannot be null.");
            }
            assert parent == null : "node is already linked";
            this.parent = next.parent;
            this.prev = next.prev;
            this.next = next;
            if (next.prev != null) {
                next.prev.next = this;
            } else {
                parent.entry = this;
            }
            next.prev = this;
            parent.numNode++;
        }

        /**
         * Links this node directly after {@code prev}, inside {@code prev}'s list.
         */
        public void insertAfter(INode<T, P> prev) {
            if (prev == null || prev.parent == null) {
                throw new IllegalArgumentException("Prev node and its parent cannot be null.");
            }
            assert parent == null : "node is already linked";
            this.parent = prev.parent;
            this.prev = prev;
            this.next = prev.next;
            if (prev.next != null) {
                prev.next.prev = this;
            } else {
                parent.last = this;
            }
            prev.next = this;
            parent.numNode++;
        }

        /**
         * Unlinks this node from its list.
         *
         * @return the node that followed this one, or null if it was the tail
         *         (or the node was not linked)
         */
        public INode<T, P> removeSelf() {
            if (parent == null) {
                return null;
            }
            INode<T, P> following = this.next;
            if (prev != null) {
                prev.next = next;
            } else {
                parent.entry = next;
            }
            if (next != null) {
                next.prev = prev;
            } else {
                parent.last = prev;
            }
            parent.numNode--;
            this.prev = null;
            this.next = null;
            this.parent = null;
            return following;
        }

        private void linkAsOnly(IList<T, P> father) {
            assert parent == null : "node is already linked";
            this.parent = father;
            this.prev = null;
            this.next = null;
            father.entry = this;
            father.last = this;
            father.numNode++;
        }
    }
}
