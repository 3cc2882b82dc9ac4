/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

/**
    Base of all errors raised while describing or compiling a model.
    Each subclass names one kind of failure, so callers can tell a mistake in the model
    (which the user must fix) from an internal fault of the compiler.
**/
public class DataModelException extends RuntimeException
{
    public DataModelException (String message)
    {
        super (message);
    }

    public DataModelException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
