package com.nodegraph.topo.util;

import com.nodegraph.topo.api.GraphObserver;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeGraphObserverTest {

    private static GraphObserver named(List<String> log, String name) {
        return new GraphObserver() {
            @Override
            public void onGraphCleared() {
                log.add(name);
            }
        };
    }

    @Test
    public void testFanOutInAttachOrder() {
        List<String> log = new ArrayList<>();
        CompositeGraphObserver composite = new CompositeGraphObserver();
        composite.attach(named(log, "a"));
        composite.attach(named(log, "b"));

        composite.onGraphCleared();

        assertEquals(List.of("a", "b"), log);
    }

    @Test
    public void testDuplicateAttachIgnored() {
        CompositeGraphObserver composite = new CompositeGraphObserver();
        GraphObserver o = new GraphObserver() {
        };
        assertTrue(composite.attach(o));
        assertFalse(composite.attach(o));
        assertEquals(1, composite.size());
        assertTrue(composite.detach(o));
        assertFalse(composite.detach(o));
        assertEquals(0, composite.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullObserverRejected() {
        new CompositeGraphObserver().attach(null);
    }

    @Test
    public void testFailureIsIsolated() {
        List<String> log = new ArrayList<>();
        CompositeGraphObserver composite = new CompositeGraphObserver();
        composite.attach(new GraphObserver() {
            @Override
            public void onGraphCleared() {
                throw new RuntimeException("observer bug");
            }
        });
        composite.attach(named(log, "after"));

        composite.onGraphCleared();

        assertEquals(List.of("after"), log);
    }

    @Test
    public void testDetachDuringCallback() {
        List<String> log = new ArrayList<>();
        CompositeGraphObserver composite = new CompositeGraphObserver();
        GraphObserver second = named(log, "second");
        composite.attach(new GraphObserver() {
            @Override
            public void onGraphCleared() {
                composite.detach(this);
                log.add("first");
            }
        });
        composite.attach(second);

        composite.onGraphCleared();
        composite.onGraphCleared();

        assertEquals(List.of("first", "second", "second"), log);
        assertEquals(1, composite.size());
    }
}
