/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

public abstract class OperatorBinary extends Operator
{
    public final Operator operand0;
    public final Operator operand1;

    protected OperatorBinary (Operator operand0, Operator operand1)
    {
        if (operand0 == null  ||  operand1 == null) throw new IllegalArgumentException ("Missing operand for " + getClass ().getSimpleName ());
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public abstract Operator rebuild (Operator newOperand0, Operator newOperand1);

    public abstract String symbol ();

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        Operator new0 = operand0.transform (transformer);
        Operator new1 = operand1.transform (transformer);
        if (new0 == operand0  &&  new1 == operand1) return this;
        return rebuild (new0, new1);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderOperand (renderer, operand0);
        renderer.result.append (" " + symbol () + " ");
        renderOperand (renderer, operand1);
    }

    public String toString ()
    {
        return render ();
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ (operand0.hashCode () * 31 + operand1.hashCode ());
    }
}
