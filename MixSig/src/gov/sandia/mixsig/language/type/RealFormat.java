/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.type;

import java.util.Objects;

/**
    Fixed-point representation of an analog quantity.
    Only range is mandatory. Width and exponent are filled in later by the code generator
    when the user does not specify them, so either may be null.
**/
public class RealFormat extends Format
{
    public final double  range;     // largest magnitude the signal can reach
    public final Integer width;     // total bits, or null if left to the generator
    public final Integer exponent;  // power of the least significant bit, or null

    /// Range left to the instantiating module, as for analog ports whose range is a parameter.
    public static final RealFormat UNBOUNDED = new RealFormat (Double.POSITIVE_INFINITY);

    public RealFormat (double range)
    {
        this (range, null, null);
    }

    public RealFormat (double range, Integer width, Integer exponent)
    {
        if (range < 0  ||  Double.isNaN (range)) throw new IllegalArgumentException ("Range must be non-negative: " + range);
        this.range    = range;
        this.width    = width;
        this.exponent = exponent;
    }

    /**
        Format of a numeric literal. The range is exactly the magnitude of the value.
    **/
    public static RealFormat fromValue (double value)
    {
        return new RealFormat (Math.abs (value));
    }

    public Format union (Format that)
    {
        RealFormat r = that.toReal ();
        double  unionRange    = Math.max (range, r.range);
        Integer unionWidth    = null;
        Integer unionExponent = null;
        if (width    != null  &&  r.width    != null) unionWidth    = Math.max (width,    r.width);
        if (exponent != null  &&  r.exponent != null) unionExponent = Math.min (exponent, r.exponent);  // finer resolution wins
        return new RealFormat (unionRange, unionWidth, unionExponent);
    }

    public RealFormat toReal ()
    {
        return this;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof RealFormat)) return false;
        RealFormat r = (RealFormat) that;
        return range == r.range  &&  Objects.equals (width, r.width)  &&  Objects.equals (exponent, r.exponent);
    }

    public int hashCode ()
    {
        return Objects.hash (range, width, exponent);
    }

    public String toString ()
    {
        String result = "real(" + range;
        if (width    != null) result += ", width=" + width;
        if (exponent != null) result += ", exponent=" + exponent;
        return result + ")";
    }
}
