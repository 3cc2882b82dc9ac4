/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.type;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import gov.sandia.mixsig.eqset.Cases;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;

public class FormatTest
{
    @Test
    public void testIntUnion ()
    {
        assertEquals (IntFormat.unsigned (8), IntFormat.unsigned (4).union (IntFormat.unsigned (8)));
        assertEquals (IntFormat.signed   (6), IntFormat.signed   (6).union (IntFormat.signed   (3)));
        // An unsigned 8-bit value needs 9 bits once a sign bit is added.
        assertEquals (IntFormat.signed   (9), IntFormat.signed   (4).union (IntFormat.unsigned (8)));
        assertEquals (IntFormat.signed   (9), IntFormat.unsigned (8).union (IntFormat.signed   (4)));
    }

    @Test
    public void testRealUnion ()
    {
        RealFormat a = new RealFormat (2, 16, -10);
        RealFormat b = new RealFormat (5, 12, -8);
        RealFormat u = (RealFormat) a.union (b);
        assertEquals (5,   u.range, 0);
        assertEquals (16,  (int) u.width);
        assertEquals (-10, (int) u.exponent);

        // Unknown width on either side leaves the union unknown.
        RealFormat v = (RealFormat) a.union (new RealFormat (1));
        assertEquals (2, v.range, 0);
        assertNull (v.width);

        // Integers are widened to real when mixed with analog values.
        RealFormat w = (RealFormat) IntFormat.signed (8).union (new RealFormat (1));
        assertEquals (128, w.range, 0);
    }

    @Test
    public void testUnionOfCollection ()
    {
        assertNull (Format.union (Collections.<Format> emptyList ()));
        Format f = Format.union (Arrays.<Format> asList (new RealFormat (1), new RealFormat (3), new RealFormat (2)));
        assertEquals (new RealFormat (3), f);
    }

    @Test
    public void testTableFormats ()
    {
        Signal s = Signal.digitalInput ("s", 1, false);
        Operator table = ArraySelect.make (new double[] {0.5, -4}, s.access ());
        assertEquals (new RealFormat (4), table.getFormat ());

        // Only a single entry collapses. Equal entries still make a table.
        assertEquals (new Constant (3), ArraySelect.make (new double[] {3}, s.access ()));
        assertTrue (ArraySelect.make (new double[] {3, 3}, s.access ()) instanceof ArraySelect);

        Operator cases = Cases.eqnCase (Arrays.asList (new Constant (1), new Constant (-7)), Arrays.asList (s));
        assertEquals (new RealFormat (7), cases.getFormat ());
    }

    @Test
    public void testBit ()
    {
        assertTrue (IntFormat.BIT.isBit ());
        assertEquals (1, IntFormat.unsigned (1).max ());
        assertEquals (-8, IntFormat.signed (4).min ());
    }
}
