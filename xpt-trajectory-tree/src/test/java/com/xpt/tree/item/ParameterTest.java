package com.xpt.tree.item;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterTest {

    @Test
    void length_reflectsLifecycle() {
        Parameter p = new Parameter();
        assertEquals(0, p.length());
        assertTrue(p.isEmpty());

        p.set(1);
        assertEquals(1, p.length());

        p.explore(List.of(1, 2, 3, 4));
        assertEquals(4, p.length());
        assertTrue(p.isArray());
    }

    @Test
    void access_returnsLockedRowView() {
        Parameter p = new Parameter(0);
        p.explore(List.of(1, 2, 3, 4));

        Parameter view = p.access(2);

        assertEquals(3, view.get());
        assertTrue(view.isLocked());
        assertThrows(IndexOutOfBoundsException.class, () -> p.access(4));
    }

    @Test
    void access_unexploredReturnsItself() {
        Parameter p = new Parameter("a");

        assertSame(p, p.access(7));
        assertEquals("a", p.valueAt(7));
    }

    @Test
    void explore_rejectsOtherTypesAndEmptyList() {
        Parameter p = new Parameter(1);

        assertThrows(IllegalArgumentException.class, () -> p.explore(List.of(1, "two")));
        assertThrows(IllegalArgumentException.class, () -> p.explore(List.of(1.5)));
        assertThrows(IllegalArgumentException.class, () -> p.explore(List.of()));
        assertThrows(IllegalStateException.class, () -> new Parameter().explore(List.of(1)));
        assertFalse(p.isArray());
    }

    @Test
    void explore_integralTypesMix() {
        Parameter p = new Parameter(1);

        p.explore(List.of(1L, 2));

        assertEquals(2, p.length());
    }

    @Test
    void locked_rejectsMutationButAllowsExplore() {
        Parameter p = new Parameter(1);
        p.lock();

        assertThrows(ParameterLockedException.class, () -> p.set(2));
        assertThrows(ParameterLockedException.class, p::empty);
        assertThrows(ParameterLockedException.class, p::shrink);

        p.explore(List.of(1, 2));
        assertEquals(2, p.length());
        assertThrows(ParameterLockedException.class, () -> p.addItems(List.of(3)));
        assertThrows(ParameterLockedException.class, () -> p.changeValuesInArray(0, 5));
    }

    @Test
    void arrayOperations_requireExploredParameter() {
        Parameter p = new Parameter(1);

        assertThrows(ParameterNotArrayException.class, () -> p.addItems(List.of(2)));
        assertThrows(ParameterNotArrayException.class, () -> p.changeValuesInArray(0, 2));

        p.explore(List.of(1, 2));
        p.addItems(List.of(3));
        p.changeValuesInArray(0, 10);
        assertEquals(List.of(10, 2, 3), p.getRange());
    }

    @Test
    void set_discardsExploredRange() {
        Parameter p = new Parameter(1);
        p.explore(List.of(1, 2));

        p.set(5);

        assertFalse(p.isArray());
        assertEquals(1, p.length());
    }

    @Test
    void storeAndLoad_preserveFields() {
        Parameter p = new Parameter(1);
        p.explore(List.of(1, 2));
        Map<String, Object> stored = p.store();

        Parameter copy = new Parameter();
        copy.load(stored);

        assertEquals(1, copy.get());
        assertEquals(List.of(1, 2), copy.getRange());
        assertEquals(List.of("data", "explored_data"), List.copyOf(stored.keySet()));
    }

    @Test
    void result_fieldsKeepOrderAndRespectLock() {
        Result r = new Result();
        r.set("b", 2);
        r.set("a", 1);

        assertEquals(List.of("b", "a"), List.copyOf(r.getFieldNames()));
        r.removeFields(List.of("b"));
        assertFalse(r.contains("b"));

        r.lock();
        assertThrows(ParameterLockedException.class, () -> r.set("c", 3));
    }

    @Test
    void itemTypes_createsRegisteredTypes() {
        assertTrue(ItemTypes.create("Parameter") instanceof Parameter);
        assertTrue(ItemTypes.create("Result") instanceof Result);
        assertThrows(IllegalArgumentException.class, () -> ItemTypes.create("Unknown"));
    }
}
