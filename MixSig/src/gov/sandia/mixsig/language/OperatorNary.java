/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
    Operator that combines any number of operands with the same associative operation.
**/
public abstract class OperatorNary extends Operator
{
    public final List<Operator> operands;

    protected OperatorNary (List<Operator> operands)
    {
        this.operands = Collections.unmodifiableList (new ArrayList<Operator> (operands));
    }

    /**
        Creates a node of the same kind over new operands.
        Subclasses apply their usual simplifications, so the result need not be of the same class.
    **/
    public abstract Operator rebuild (List<Operator> newOperands);

    /// Symbol placed between operands when rendering.
    public abstract String symbol ();

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator o : operands) o.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;

        boolean changed = false;
        List<Operator> newOperands = new ArrayList<Operator> (operands.size ());
        for (Operator o : operands)
        {
            Operator t = o.transform (transformer);
            if (t != o) changed = true;
            newOperands.add (t);
        }
        if (! changed) return this;
        return rebuild (newOperands);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        String middle = " " + symbol () + " ";
        boolean first = true;
        for (Operator o : operands)
        {
            if (! first) renderer.result.append (middle);
            first = false;
            renderOperand (renderer, o);
        }
    }

    public String toString ()
    {
        return render ();
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        return operands.equals (((OperatorNary) that).operands);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ operands.hashCode ();
    }
}
