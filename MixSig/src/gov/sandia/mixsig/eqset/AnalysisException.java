/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

/**
    An equation system that can not be reduced to a linear dynamical system.
**/
public class AnalysisException extends DataModelException
{
    public AnalysisException (String message)
    {
        super (message);
    }

    public AnalysisException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
