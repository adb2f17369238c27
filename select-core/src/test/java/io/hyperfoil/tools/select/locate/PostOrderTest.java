package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.TreeCursor;
import org.junit.Test;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static io.hyperfoil.tools.select.TreeTestSupport.find;
import static io.hyperfoil.tools.select.TreeTestSupport.root;
import static io.hyperfoil.tools.select.TreeTestSupport.strings;
import static org.junit.Assert.*;

public class PostOrderTest {

    @Test
    public void testDescendantsBeforeAncestors() {
        TreeCursor root = root("(a (b c)) d");
        assertEquals(List.of("a", "b", "c", "(b c)", "(a (b c))", "d", "(a (b c)) d"),
                strings(PostOrder.of(root)));
    }

    @Test
    public void testStopsAtStart() {
        TreeCursor root = root("(a (b c)) d");
        TreeCursor inner = find(root, "(b c)");
        assertEquals(List.of("b", "c", "(b c)"), strings(PostOrder.of(inner)));
    }

    @Test
    public void testLeafStart() {
        TreeCursor root = root("(a b)");
        TreeCursor a = find(root, "a");
        assertEquals(List.of("a"), strings(PostOrder.of(a)));
    }

    @Test
    public void testSkipsTrivia() {
        TreeCursor root = root("( a ,b ;c\n)");
        assertEquals(List.of("a", "b", "( a ,b ;c\n)", "( a ,b ;c\n)"), strings(PostOrder.of(root)));
    }

    @Test
    public void testPrefixedForms() {
        TreeCursor root = root("'(x) ^:m y");
        assertEquals(List.of("x", "(x)", "'(x)", ":m", "y", "^:m y", "'(x) ^:m y"),
                strings(PostOrder.of(root)));
    }

    @Test
    public void testEmptySource() {
        assertEquals(List.of(""), strings(PostOrder.of(root(""))));
    }

    @Test
    public void testVisitsEveryNodeOnce() {
        TreeCursor root = root("(defn f [x] (let [y (inc x)] {:a [y #{x}]}))");
        Set<Object> seen = new HashSet<>();
        int count = 0;
        for (TreeCursor cursor : PostOrder.of(root)) {
            assertTrue("visited twice: " + cursor, seen.add(cursor.node()));
            count++;
        }
        assertEquals(19, count);
    }

    @Test
    public void testRestartable() {
        PostOrder order = PostOrder.of(root("(a b)"));
        assertEquals(strings(order), strings(order));
        assertEquals(4, order.stream().count());
    }

    @Test(expected = NoSuchElementException.class)
    public void testExhaustedIterator() {
        Iterator<TreeCursor> it = PostOrder.of(root("a")).iterator();
        it.next();
        it.next();
        it.next();
    }
}
