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

public class Add extends OperatorNary
{
    /**
        Use make() unless an unsimplified node is specifically needed.
    **/
    public Add (List<Operator> operands)
    {
        super (operands);
        if (operands.size () < 2) throw new IllegalArgumentException ("A sum needs at least two operands.");
    }

    public static Operator make (Operator... operands)
    {
        return make (Arrays.asList (operands));
    }

    /**
        Builds a sum with the usual simplifications:
        nested sums are flattened, constant terms are folded into one trailing constant,
        a zero constant is dropped, and a single remaining operand is returned by itself.
        An empty sum is the constant 0.
    **/
    public static Operator make (List<Operator> operands)
    {
        List<Operator> terms = new ArrayList<Operator> ();
        double  constant    = 0;
        boolean hasConstant = false;
        for (Operator o : flatten (operands))
        {
            if (o.isScalar ())
            {
                constant += o.getDouble ();
                hasConstant = true;
            }
            else
            {
                terms.add (o);
            }
        }
        if (hasConstant  &&  constant != 0) terms.add (new Constant (constant));

        if (terms.isEmpty ()) return new Constant (0);
        if (terms.size () == 1) return terms.get (0);
        return new Add (terms);
    }

    protected static List<Operator> flatten (List<Operator> operands)
    {
        List<Operator> result = new ArrayList<Operator> ();
        for (Operator o : operands)
        {
            if (o instanceof Add) result.addAll (((Add) o).operands);
            else                  result.add (o);
        }
        return result;
    }

    public Operator rebuild (List<Operator> newOperands)
    {
        return make (newOperands);
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.add (this);
    }

    public String symbol ()
    {
        return "+";
    }

    public int precedence ()
    {
        return 5;
    }

    /**
        Integer sums keep an integer format. Anything else is a real whose range is the sum of the operand ranges.
    **/
    public Format getFormat ()
    {
        boolean allInteger = true;
        double  range      = 0;
        List<Format> formats = new ArrayList<Format> ();
        for (Operator o : operands)
        {
            Format f = o.getFormat ();
            formats.add (f);
            if (! (f instanceof IntFormat)) allInteger = false;
            range += f.toReal ().range;
        }
        if (allInteger) return Format.union (formats);
        return new RealFormat (range);
    }
}
