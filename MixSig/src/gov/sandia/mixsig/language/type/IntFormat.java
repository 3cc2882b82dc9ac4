/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language.type;

/**
    Two's complement or unsigned integer of a fixed bit width.
**/
public class IntFormat extends Format
{
    public final int     width;
    public final boolean signed;

    public static final IntFormat BIT = new IntFormat (1, false);

    public IntFormat (int width, boolean signed)
    {
        if (width < 1) throw new IllegalArgumentException ("Width must be at least 1: " + width);
        this.width  = width;
        this.signed = signed;
    }

    public static IntFormat unsigned (int width)
    {
        return new IntFormat (width, false);
    }

    public static IntFormat signed (int width)
    {
        return new IntFormat (width, true);
    }

    /**
        Case tables are addressed by single unsigned bits.
    **/
    public boolean isBit ()
    {
        return width == 1  &&  ! signed;
    }

    public long min ()
    {
        if (signed) return -(1L << (width - 1));
        return 0;
    }

    public long max ()
    {
        if (signed) return (1L << (width - 1)) - 1;
        return (1L << width) - 1;
    }

    public Format union (Format that)
    {
        if (! (that instanceof IntFormat)) return toReal ().union (that);

        IntFormat i = (IntFormat) that;
        if (signed == i.signed) return new IntFormat (Math.max (width, i.width), signed);

        // Mixed signedness. The unsigned operand needs one extra bit to fit under a sign bit.
        int unsignedWidth = signed ? i.width : width;
        int signedWidth   = signed ? width   : i.width;
        return new IntFormat (Math.max (unsignedWidth + 1, signedWidth), true);
    }

    public RealFormat toReal ()
    {
        return new RealFormat (Math.max (Math.abs ((double) min ()), (double) max ()));
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof IntFormat)) return false;
        IntFormat i = (IntFormat) that;
        return width == i.width  &&  signed == i.signed;
    }

    public int hashCode ()
    {
        return width * 2 + (signed ? 1 : 0);
    }

    public String toString ()
    {
        return (signed ? "sint(" : "uint(") + width + ")";
    }
}
