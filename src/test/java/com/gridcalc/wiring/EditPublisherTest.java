package com.gridcalc.wiring;

import com.gridcalc.api.Address;
import com.gridcalc.api.Value;
import com.gridcalc.engine.CircularReferenceException;
import com.gridcalc.expr.ParseException;
import com.gridcalc.fn.FunctionRegistry;
import com.gridcalc.grid.Grid;
import com.gridcalc.grid.GridConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class EditPublisherTest {
    private Grid grid;
    private EditPublisher publisher;
    private final Map<Long, Exception> failures = new ConcurrentHashMap<>();
    private volatile CountDownLatch applied;

    @Before
    public void setUp() {
        grid = new Grid(GridConfig.defaults(), FunctionRegistry.builtIns(url -> ""));
        publisher = new EditPublisher(grid, 64);
        publisher.setOutcomeCallback((sequence, address, raw, error) -> {
            if (error != null)
                failures.put(sequence, error);
            applied.countDown();
        });
        publisher.start();
    }

    @After
    public void tearDown() {
        publisher.close();
    }

    @Test
    public void testEditsApplyInOrder() throws InterruptedException {
        applied = new CountDownLatch(4);
        publisher.publishSet(Address.parse("A1"), "5");
        publisher.publishSet(Address.parse("B1"), "=A1*2");
        publisher.publishSet(Address.parse("A1"), "7");
        publisher.publishClear(Address.parse("C1"));
        assertTrue(applied.await(5, TimeUnit.SECONDS));

        assertTrue(failures.isEmpty());
        assertEquals(Value.number(14), grid.value("B1"));
        assertEquals(Value.EMPTY, grid.value("C1"));
    }

    @Test
    public void testRejectedEditsAreReported() throws InterruptedException {
        applied = new CountDownLatch(3);
        long ok = publisher.publishSet(Address.parse("A1"), "=B1");
        long cycle = publisher.publishSet(Address.parse("B1"), "=A1");
        long broken = publisher.publishSet(Address.parse("C1"), "=1+");
        assertTrue(applied.await(5, TimeUnit.SECONDS));

        assertFalse(failures.containsKey(ok));
        assertTrue(failures.get(cycle) instanceof CircularReferenceException);
        assertTrue(failures.get(broken) instanceof ParseException);
        assertFalse(grid.addresses().contains(Address.parse("B1")));
    }

    @Test
    public void testConcurrentProducers() throws InterruptedException {
        int threads = 4;
        int perThread = 50;
        applied = new CountDownLatch(threads * perThread);
        List<Thread> producers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int col = t;
            Thread th = new Thread(() -> {
                for (int row = 0; row < perThread; row++)
                    publisher.publishSet(new Address(row, col), String.valueOf(col * 1000 + row));
            });
            producers.add(th);
            th.start();
        }
        for (Thread th : producers)
            th.join();
        assertTrue(applied.await(10, TimeUnit.SECONDS));

        assertTrue(failures.isEmpty());
        assertEquals(threads * perThread, grid.addresses().size());
        assertEquals(Value.number(3049), grid.value(new Address(49, 3)));
        assertEquals(Value.number(0), grid.value(new Address(0, 0)));
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishAfterClose() {
        publisher.close();
        publisher.publishSet(Address.parse("A1"), "1");
    }

    @Test(expected = IllegalStateException.class)
    public void testDoubleStart() {
        publisher.start();
    }
}
