/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import gov.sandia.mixsig.linear.MatrixDense;

/**
    State-space system
    <pre>
    x' = A x + B u    (continuous)  or  x[k+1] = A x[k] + B u[k]    (discrete)
    y  = C x + D u
    </pre>
**/
public class LinearDynamicalSystem
{
    public final MatrixDense A;  // states  x states
    public final MatrixDense B;  // states  x inputs
    public final MatrixDense C;  // outputs x states
    public final MatrixDense D;  // outputs x inputs
    public final boolean     discrete;

    public LinearDynamicalSystem (MatrixDense A, MatrixDense B, MatrixDense C, MatrixDense D, boolean discrete)
    {
        int s = A.rows ();
        int i = B.columns ();
        int o = C.rows ();
        if (A.columns () != s)                     throw new IllegalArgumentException ("A must be square, not " + s + "x" + A.columns ());
        if (B.rows () != s)                        throw new IllegalArgumentException ("B must have one row per state.");
        if (C.columns () != s)                     throw new IllegalArgumentException ("C must have one column per state.");
        if (D.rows () != o  ||  D.columns () != i) throw new IllegalArgumentException ("D must be outputs x inputs.");
        this.A        = A;
        this.B        = B;
        this.C        = C;
        this.D        = D;
        this.discrete = discrete;
    }

    public int numStates ()
    {
        return A.rows ();
    }

    public int numInputs ()
    {
        return B.columns ();
    }

    public int numOutputs ()
    {
        return C.rows ();
    }

    public boolean sameShape (LinearDynamicalSystem that)
    {
        return numStates () == that.numStates ()  &&  numInputs () == that.numInputs ()  &&  numOutputs () == that.numOutputs ();
    }

    public String shape ()
    {
        return numStates () + " states, " + numInputs () + " inputs, " + numOutputs () + " outputs";
    }

    public String toString ()
    {
        return (discrete ? "discrete" : "continuous") + " A=" + A + " B=" + B + " C=" + C + " D=" + D;
    }
}
