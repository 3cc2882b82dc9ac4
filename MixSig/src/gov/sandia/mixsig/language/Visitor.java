/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

/**
    Walks an expression tree in pre-order. Used for read-only passes such as collecting signal references.
**/
public interface Visitor
{
    /**
        @return false to skip the operands of this node.
    **/
    public boolean visit (Operator op);
}
