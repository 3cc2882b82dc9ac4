/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;

/**
    Bitwise concatenation of digital values. The first operand occupies the most significant bits.
**/
public class Concatenate extends OperatorNary
{
    public Concatenate (List<Operator> operands)
    {
        super (operands);
        if (operands.isEmpty ()) throw new IllegalArgumentException ("Nothing to concatenate.");
        for (Operator o : operands)
        {
            if (! (o.getFormat () instanceof IntFormat)) throw new IllegalArgumentException ("Only digital values can be concatenated: " + o);
        }
    }

    public static Concatenate of (List<Signal> signals)
    {
        List<Operator> operands = new ArrayList<Operator> (signals.size ());
        for (Signal s : signals) operands.add (s.access ());
        return new Concatenate (operands);
    }

    public Operator rebuild (List<Operator> newOperands)
    {
        return new Concatenate (newOperands);
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.concatenate (this);
    }

    public String symbol ()
    {
        return ",";
    }

    public Format getFormat ()
    {
        int width = 0;
        for (Operator o : operands) width += ((IntFormat) o.getFormat ()).width;
        return IntFormat.unsigned (width);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("{");
        boolean first = true;
        for (Operator o : operands)
        {
            if (! first) renderer.result.append (", ");
            first = false;
            o.render (renderer);
        }
        renderer.result.append ("}");
    }
}
