/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.operator;

import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.OperatorBinary;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;

/**
    Equality. In an equation system this states a constraint lhs = rhs.
    As a value it is a single bit.
**/
public class EQ extends OperatorBinary
{
    public EQ (Operator lhs, Operator rhs)
    {
        super (lhs, rhs);
    }

    public Operator lhs ()
    {
        return operand0;
    }

    public Operator rhs ()
    {
        return operand1;
    }

    public Operator rebuild (Operator newOperand0, Operator newOperand1)
    {
        return new EQ (newOperand0, newOperand1);
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.equal (this);
    }

    public String symbol ()
    {
        return "==";
    }

    public int precedence ()
    {
        return 8;
    }

    public Format getFormat ()
    {
        return IntFormat.BIT;
    }
}
