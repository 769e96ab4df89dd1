package net.hexproc.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourcePoolTest {

    private final ResourcePool pool = ResourcePool.ofNew(1, Resources.of(100, 200, 300, 50), 50);

    @Test
    @DisplayName("credit(debit(p, r), r) == p")
    void debitThenCreditRestores() {
        Resources r = Resources.of(30, 0, 300, 49);
        ResourcePool after = pool.debit(r).credit(r);
        assertEquals(pool.available(), after.available());
        assertEquals(pool.total(), after.total());
    }

    @Test
    void canAdmitIsPerDimension() {
        assertTrue(pool.canAdmit(Resources.of(100, 200, 300, 50)));
        assertFalse(pool.canAdmit(Resources.of(1, 1, 1, 51)));
        assertTrue(pool.canAdmit(Resources.ZERO));
    }

    @Test
    @DisplayName("available 이 total 을 넘는 반환은 거부")
    void creditBeyondTotalRejected() {
        assertThrows(IllegalArgumentException.class, () -> pool.credit(Resources.cpu(1)));
        ResourcePool debited = pool.debit(Resources.cpu(10));
        assertThrows(IllegalArgumentException.class, () -> debited.credit(Resources.cpu(11)));
    }

    @Test
    void debitBeyondAvailableRejected() {
        assertThrows(IllegalArgumentException.class, () -> pool.debit(Resources.cpu(101)));
    }

    @Test
    void reserved() {
        assertEquals(Resources.of(10, 20, 0, 0), pool.debit(Resources.of(10, 20, 0, 0)).reserved());
        assertTrue(pool.reserved().isZero());
    }

    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ResourcePool(1L, Resources.cpu(1), Resources.cpu(2), 50, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> ResourcePool.ofNew(1, Resources.cpu(1), 101));
        assertThrows(IllegalArgumentException.class, () -> Resources.of(-1, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> Resources.cpu(1).minus(Resources.cpu(2)));
    }
}
