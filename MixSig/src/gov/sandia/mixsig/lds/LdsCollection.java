/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.mixsig.eqset.InternalConsistencyException;
import gov.sandia.mixsig.linear.MatrixDense;

/**
    Address-indexed set of systems, one per selector setting. Entry k belongs to address k.
    All entries have the same numbers of states, inputs and outputs.
**/
public class LdsCollection
{
    protected List<LinearDynamicalSystem> entries = new ArrayList<LinearDynamicalSystem> ();

    public void append (LinearDynamicalSystem lds)
    {
        if (lds == null) throw new InternalConsistencyException ("No system was produced for address " + entries.size ());
        if (! entries.isEmpty ())
        {
            LinearDynamicalSystem first = entries.get (0);
            if (! first.sameShape (lds))
            {
                throw new InternalConsistencyException ("System at address " + entries.size () + " has " + lds.shape () + ", but address 0 has " + first.shape ());
            }
        }
        entries.add (lds);
    }

    /**
        Appends with an explicit address, which must be the next one in sequence.
    **/
    public void append (int address, LinearDynamicalSystem lds)
    {
        if (address != entries.size ()) throw new InternalConsistencyException ("Expected system for address " + entries.size () + " but got address " + address);
        append (lds);
    }

    public int size ()
    {
        return entries.size ();
    }

    public LinearDynamicalSystem get (int address)
    {
        return entries.get (address);
    }

    public int numStates ()
    {
        if (entries.isEmpty ()) return 0;
        return entries.get (0).numStates ();
    }

    public int numInputs ()
    {
        if (entries.isEmpty ()) return 0;
        return entries.get (0).numInputs ();
    }

    public int numOutputs ()
    {
        if (entries.isEmpty ()) return 0;
        return entries.get (0).numOutputs ();
    }

    /// Element (row,column) of A across all addresses.
    public double[] getA (int row, int column)
    {
        return gather (0, row, column);
    }

    public double[] getB (int row, int column)
    {
        return gather (1, row, column);
    }

    public double[] getC (int row, int column)
    {
        return gather (2, row, column);
    }

    public double[] getD (int row, int column)
    {
        return gather (3, row, column);
    }

    protected double[] gather (int which, int row, int column)
    {
        double[] result = new double[entries.size ()];
        for (int k = 0; k < result.length; k++)
        {
            LinearDynamicalSystem lds = entries.get (k);
            MatrixDense M;
            switch (which)
            {
                case 0:  M = lds.A; break;
                case 1:  M = lds.B; break;
                case 2:  M = lds.C; break;
                default: M = lds.D;
            }
            result[k] = M.get (row, column);
        }
        return result;
    }
}
