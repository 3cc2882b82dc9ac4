/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

/**
    Malformed case table: wrong number of cases for the selector count, a selector that is not
    a single unsigned bit, or an empty case list.
**/
public class CaseShapeException extends DataModelException
{
    public CaseShapeException (String message)
    {
        super (message);
    }

    public CaseShapeException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
