/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.Operator;

/**
    Defines how one signal gets its value in the generated circuit.
**/
public class Assignment
{
    public enum Timing
    {
        /// Combinational. The signal follows the expression within the same cycle.
        THIS_CYCLE,
        /// Registered. The signal takes the value of the expression at the next clock edge, and resets to its initial value.
        NEXT_CYCLE,
        /// Combinational, naming an expression as a new signal that the model did not declare in advance.
        BINDING
    }

    public final Signal   signal;
    public final Operator expression;
    public final Timing   timing;

    public Assignment (Signal signal, Operator expression, Timing timing)
    {
        if (signal == null  ||  expression == null  ||  timing == null) throw new IllegalArgumentException ("Incomplete assignment.");
        this.signal     = signal;
        this.expression = expression;
        this.timing     = timing;
    }

    public String toString ()
    {
        switch (timing)
        {
            case NEXT_CYCLE: return signal.name + "[k+1] = " + expression.render ();
            case BINDING:    return signal.name + " := "     + expression.render ();
            default:         return signal.name + " = "      + expression.render ();
        }
    }
}
