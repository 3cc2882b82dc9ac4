/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.type.Format;

/**
    Reference to a signal, or to one of its time derivatives.
    Order 0 is the signal itself. Order 1 marks the signal as a state of a continuous-time
    system, and is written with a trailing tick, as in z'.
**/
public class AccessSignal extends Operator
{
    public final Signal signal;
    public final int    order;

    public AccessSignal (Signal signal)
    {
        this (signal, 0);
    }

    public AccessSignal (Signal signal, int order)
    {
        if (order < 0  ||  order > 1) throw new IllegalArgumentException ("Only first-order derivatives are supported, not order " + order + " of " + signal.name);
        this.signal = signal;
        this.order  = order;
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.signal (this);
    }

    public String getName ()
    {
        return signal.name;
    }

    public boolean isDerivative ()
    {
        return order > 0;
    }

    public Format getFormat ()
    {
        return signal.format;
    }

    public String toString ()
    {
        String result = signal.name;
        for (int i = 0; i < order; i++) result += "'";
        return result;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AccessSignal)) return false;
        AccessSignal a = (AccessSignal) that;
        return order == a.order  &&  signal.name.equals (a.signal.name);
    }

    public int hashCode ()
    {
        return signal.name.hashCode () * 31 + order;
    }
}
