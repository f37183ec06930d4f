package com.questrail.lcn.protocol.pck.internal.exec;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PermitPoolTest {

    @Test
    void acquiresImmediatelyWhilePermitsAreFree() {
        PermitPool pool = new PermitPool(2);

        assertTrue(pool.acquire().isDone());
        assertTrue(pool.acquire().isDone());
        assertEquals(0, pool.available());
    }

    @Test
    void waitersAreServedInArrivalOrder() {
        PermitPool pool = new PermitPool(1);
        pool.acquire();

        CompletableFuture<Void> first = pool.acquire();
        CompletableFuture<Void> second = pool.acquire();
        assertFalse(first.isDone());
        assertFalse(second.isDone());

        pool.release();
        assertTrue(first.isDone());
        assertFalse(second.isDone());

        pool.release();
        assertTrue(second.isDone());
        assertEquals(0, pool.available());
    }

    @Test
    void cancelledWaiterIsSkipped() {
        PermitPool pool = new PermitPool(1);
        pool.acquire();

        CompletableFuture<Void> cancelled = pool.acquire();
        CompletableFuture<Void> next = pool.acquire();
        cancelled.cancel(false);

        pool.release();

        assertTrue(next.isDone());
        assertFalse(next.isCompletedExceptionally());
    }

    @Test
    void releaseWithoutWaitersRestoresPermit() {
        PermitPool pool = new PermitPool(3);
        pool.acquire();

        pool.release();

        assertEquals(3, pool.available());
        pool.release();
        assertEquals(3, pool.available(), "Never exceeds capacity");
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PermitPool(0));
    }
}
