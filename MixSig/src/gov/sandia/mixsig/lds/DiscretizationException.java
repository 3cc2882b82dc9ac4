/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.lds;

import gov.sandia.mixsig.eqset.DataModelException;

/**
    The continuous-time system could not be converted exactly at the requested sample interval.
**/
public class DiscretizationException extends DataModelException
{
    public DiscretizationException (String message)
    {
        super (message);
    }

    public DiscretizationException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
