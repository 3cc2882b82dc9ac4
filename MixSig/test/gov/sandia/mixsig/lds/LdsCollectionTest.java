/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.mixsig.eqset.InternalConsistencyException;
import gov.sandia.mixsig.linear.MatrixDense;

public class LdsCollectionTest
{
    static LinearDynamicalSystem system (int states, int inputs, int outputs, double a)
    {
        return new LinearDynamicalSystem
        (
            new MatrixDense (states,  states,  a),
            new MatrixDense (states,  inputs,  a),
            new MatrixDense (outputs, states,  a),
            new MatrixDense (outputs, inputs,  a),
            true
        );
    }

    @Test
    public void testOrder ()
    {
        LdsCollection collection = new LdsCollection ();
        for (int a = 0; a < 4; a++) collection.append (a, system (1, 2, 1, a));
        assertEquals (4, collection.size ());
        assertEquals (1, collection.numStates ());
        assertEquals (2, collection.numInputs ());
        assertEquals (1, collection.numOutputs ());
        assertArrayEquals (new double[] {0, 1, 2, 3}, collection.getA (0, 0), 0);
        assertArrayEquals (new double[] {0, 1, 2, 3}, collection.getD (0, 1), 0);
    }

    @Test
    public void testMismatch ()
    {
        LdsCollection collection = new LdsCollection ();
        try
        {
            collection.append (0, null);
            fail ("missing system");
        }
        catch (InternalConsistencyException e) {}
        assertEquals (0, collection.size ());

        collection.append (system (1, 1, 1, 0));
        try
        {
            collection.append (system (2, 1, 1, 0));
            fail ("state count differs");
        }
        catch (InternalConsistencyException e) {}
        try
        {
            collection.append (3, system (1, 1, 1, 0));
            fail ("addresses must arrive in order");
        }
        catch (InternalConsistencyException e) {}
    }
}
