/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

/**
    Rewrites an expression tree top-down. Case substitution is the main user.
**/
public interface Transformer
{
    /**
        @return A replacement for the node, or null to keep it. A kept node still has its
        operands transformed, and is rebuilt if any of them changed.
    **/
    public Operator transform (Operator op);
}
