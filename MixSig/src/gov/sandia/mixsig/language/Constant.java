/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.Locale;

import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;
import gov.sandia.mixsig.language.type.RealFormat;

public class Constant extends Operator
{
    public static final double epsilon = Math.ulp (1.0f);  // for printing only

    public final double value;
    public final Format format;

    public Constant (double value)
    {
        this (value, RealFormat.fromValue (value));
    }

    public Constant (double value, Format format)
    {
        if (format instanceof IntFormat  &&  value != Math.rint (value)) throw new IllegalArgumentException ("Integer constant has a fractional part: " + value);
        this.value  = value;
        this.format = format;
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.constant (this);
    }

    public Format getFormat ()
    {
        return format;
    }

    public String toString ()
    {
        return print (value);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        Constant c = (Constant) that;
        return Double.compare (value, c.value) == 0  &&  format.equals (c.format);
    }

    public int hashCode ()
    {
        return Double.hashCode (value);
    }

    /**
        Shortest readable form for diagnostics. Integers lose the trailing ".0", and a value
        within single-precision noise of a short decimal is shown as that decimal.
    **/
    public static String print (double d)
    {
        if (Double.isNaN (d)  ||  Double.isInfinite (d)) return String.valueOf (d);
        if (d == Math.rint (d)  &&  Math.abs (d) < 1e15) return String.valueOf ((long) d);

        double scale = Math.max (1, Math.abs (d));
        for (int places = 1; places <= 3; places++)
        {
            String s = String.format (Locale.ROOT, "%." + places + "f", d);
            double v = Double.parseDouble (s);
            if (v != 0  &&  Math.abs (v - d) < epsilon * scale) return s;
        }

        String result = String.valueOf (d).toLowerCase ();
        result = result.replace (".0e", "e");
        if (result.endsWith (".0")) result = result.substring (0, result.length () - 2);
        return result;
    }
}
