/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.numble.expression;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorTest {

    @Test
    public void testApply() {
        assertEquals(80, Operator.ADD.apply(75, 5));
        assertEquals(70, Operator.SUBTRACT.apply(75, 5));
        assertEquals(375, Operator.MULTIPLY.apply(75, 5));
        assertEquals(15, Operator.DIVIDE.apply(75, 5));
    }

    @Test
    public void testSymbols() {
        assertEquals("+", Operator.ADD.symbol());
        assertEquals("-", Operator.SUBTRACT.symbol());
        assertEquals("×", Operator.MULTIPLY.symbol());
        assertEquals("÷", Operator.DIVIDE.symbol());
    }

    @Test
    public void testClasses() {
        for (Operator op : Operator.values()) {
            assertNotEquals(op.isAdditive(), op.isMultiplicative());
        }
        assertTrue(Operator.ADD.isCommutative());
        assertTrue(Operator.MULTIPLY.isCommutative());
        assertFalse(Operator.SUBTRACT.isCommutative());
        assertFalse(Operator.DIVIDE.isCommutative());
    }

    @Test
    public void testProfile() {
        OperatorProfile p = OperatorProfile.EMPTY;
        for (Operator op : Operator.values()) {
            p = p.plus(OperatorProfile.of(op));
            assertEquals(1, OperatorProfile.of(op).count(op));
            assertEquals(1, OperatorProfile.of(op).total());
        }
        assertEquals(new OperatorProfile(1, 1, 1, 1), p);
        // fewer divisions first, whatever the other counts
        assertTrue(new OperatorProfile(0, 3, 3, 3).compareTo(new OperatorProfile(1, 0, 0, 0)) < 0);
        assertTrue(new OperatorProfile(0, 0, 3, 3).compareTo(new OperatorProfile(0, 1, 0, 0)) < 0);
        assertTrue(new OperatorProfile(0, 0, 0, 3).compareTo(new OperatorProfile(0, 0, 1, 0)) < 0);
        assertTrue(new OperatorProfile(0, 0, 0, 1).compareTo(new OperatorProfile(0, 0, 0, 2)) < 0);
        assertEquals(0, p.compareTo(new OperatorProfile(1, 1, 1, 1)));
    }
}
