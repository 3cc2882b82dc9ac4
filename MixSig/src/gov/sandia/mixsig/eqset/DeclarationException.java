/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

/**
    Duplicate signal name, reference to an undeclared signal, a signal assigned more than once,
    or a signal left without any assignment at compile time.
**/
public class DeclarationException extends DataModelException
{
    public DeclarationException (String message)
    {
        super (message);
    }

    public DeclarationException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
