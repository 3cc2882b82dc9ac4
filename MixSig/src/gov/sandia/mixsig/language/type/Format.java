/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.type;

/**
    Describes how the value of a signal or expression is represented in hardware.
    Formats form a lattice under union(), which returns the least format able to
    hold any value of either operand. Case tables and address-indexed arrays take
    the union across all their entries.
**/
public abstract class Format
{
    /**
        @return The smallest format that holds every value of both this and that.
    **/
    public abstract Format union (Format that);

    /**
        Real view of this format, used when an integer value takes part in analog arithmetic.
    **/
    public abstract RealFormat toReal ();

    /**
        Folds union() across all the given formats.
        @return null if the collection is empty.
    **/
    public static Format union (Iterable<? extends Format> formats)
    {
        Format result = null;
        for (Format f : formats)
        {
            if (result == null) result = f;
            else                result = result.union (f);
        }
        return result;
    }
}
