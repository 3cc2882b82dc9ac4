/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.OperatorNary;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;
import gov.sandia.mixsig.language.type.RealFormat;

public class Multiply extends OperatorNary
{
    public Multiply (List<Operator> operands)
    {
        super (operands);
        if (operands.size () < 2) throw new IllegalArgumentException ("A product needs at least two operands.");
    }

    public static Operator make (Operator... operands)
    {
        return make (Arrays.asList (operands));
    }

    /**
        Builds a product with the usual simplifications:
        nested products are flattened, constant factors are folded into one leading constant,
        a factor of one is dropped, a factor of zero makes the whole product zero,
        and a single remaining operand is returned by itself. An empty product is the constant 1.
    **/
    public static Operator make (List<Operator> operands)
    {
        List<Operator> factors = new ArrayList<Operator> ();
        double constant = 1;
        for (Operator o : operands)
        {
            List<Operator> pieces;
            if (o instanceof Multiply) pieces = ((Multiply) o).operands;
            else                       pieces = Arrays.asList (o);
            for (Operator p : pieces)
            {
                if (p.isScalar ()) constant *= p.getDouble ();
                else               factors.add (p);
            }
        }

        if (constant == 0) return new Constant (0);
        if (constant != 1) factors.add (0, new Constant (constant));
        if (factors.isEmpty ()) return new Constant (constant);
        if (factors.size () == 1) return factors.get (0);
        return new Multiply (factors);
    }

    public Operator rebuild (List<Operator> newOperands)
    {
        return make (newOperands);
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.multiply (this);
    }

    public String symbol ()
    {
        return "*";
    }

    public int precedence ()
    {
        return 4;
    }

    public Format getFormat ()
    {
        boolean allInteger = true;
        boolean signed     = false;
        int     width      = 0;
        double  range      = 1;
        for (Operator o : operands)
        {
            Format f = o.getFormat ();
            if (f instanceof IntFormat)
            {
                IntFormat i = (IntFormat) f;
                width += i.width;
                signed |= i.signed;
            }
            else
            {
                allInteger = false;
            }
            range *= f.toReal ().range;
        }
        if (allInteger) return new IntFormat (width, signed);
        return new RealFormat (range);
    }
}
