/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

/**
    A fault in the compiler itself, never caused by user input. Compilation aborts with no output.
**/
public class InternalConsistencyException extends DataModelException
{
    public InternalConsistencyException (String message)
    {
        super (message);
    }

    public InternalConsistencyException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
