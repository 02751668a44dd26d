package util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import util.IList.INode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IListTest {
    private IList<String, Object> list;
    private INode<String, Object> a;
    private INode<String, Object> b;
    private INode<String, Object> c;

    @BeforeEach
    void setUp() {
        list = new IList<>(new Object());
        a = new INode<>("a");
        b = new INode<>("b");
        c = new INode<>("c");
    }

    private List<String> values() {
        return list.stream().map(INode::getVal).toList();
    }

    @Test
    void insertAtEndAndBeforeHeadKeepOrder() {
        b.insertAtEnd(list);
        c.insertAtEnd(list);
        a.insertBefore(b);

        assertThat(values()).containsExactly("a", "b", "c");
        assertThat(list.getNumNode()).isEqualTo(3);
        assertThat(list.getEntry()).isSameAs(a);
        assertThat(list.getLast()).isSameAs(c);
    }

    @Test
    void insertAfterTailMovesLast() {
        a.insertAtEnd(list);
        b.insertAfter(a);
        c.insertBefore(b);

        assertThat(values()).containsExactly("a", "c", "b");
        assertThat(list.getLast()).isSameAs(b);
        assertThat(b.getPrev()).isSameAs(c);
    }

    @Test
    void removeSelfReturnsFollowingNode() {
        a.insertAtEnd(list);
        b.insertAtEnd(list);
        c.insertAtEnd(list);

        assertThat(b.removeSelf()).isSameAs(c);
        assertThat(c.removeSelf()).isNull();
        assertThat(values()).containsExactly("a");
        assertThat(list.getLast()).isSameAs(a);
        assertThat(b.getParent()).isNull();
        assertThat(b.removeSelf()).isNull();
    }

    @Test
    void iterationSurvivesRemovalOfCurrentNode() {
        a.insertAtEnd(list);
        b.insertAtEnd(list);
        c.insertAtEnd(list);

        List<String> seen = new ArrayList<>();
        for (INode<String, Object> node : list) {
            seen.add(node.getVal());
            node.removeSelf();
        }

        assertThat(seen).containsExactly("a", "b", "c");
        assertThat(list.isEmpty()).isTrue();
        assertThat(list.getEntry()).isNull();
        assertThat(list.getLast()).isNull();
    }

    @Test
    void iteratorRemoveUnlinksNode() {
        a.insertAtEnd(list);
        b.insertAtEnd(list);

        Iterator<INode<String, Object>> it = list.iterator();
        it.next();
        it.remove();

        assertThat(values()).containsExactly("b");
        assertThatThrownBy(it::remove).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertingLinkedNodeIsRejected() {
        a.insertAtEnd(list);
        b.insertAtEnd(list);

        assertThatThrownBy(() -> a.insertAfter(b)).isInstanceOf(AssertionError.class);
    }
}
