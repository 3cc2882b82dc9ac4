/*
Copyright 2017-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.measure.MeasurementException;
import javax.measure.Unit;
import javax.measure.format.UnitFormat;

import tech.units.indriya.format.SimpleUnitFormat;
import tech.units.indriya.unit.Units;

/**
    A number with an optional unit suffix, such as "1", "1ms" or "20 ns".
**/
public class UnitValue
{
    public double  value;
    public Unit<?> unit;

    public static Pattern    floatParser = Pattern.compile ("[-+]?(NaN|Infinity|([0-9]*\\.?[0-9]*([eE][-+]?[0-9]+)?))");
    public static UnitFormat format      = SimpleUnitFormat.getInstance ();

    /**
        Parses the given string, which must be a properly-formatted number with optional unit at the end.
        @throws NumberFormatException if the number is missing or malformed.
        @throws IllegalArgumentException if the unit is not recognized.
    **/
    public UnitValue (String input)
    {
        input = input.trim ();
        int unitIndex = findUnits (input);
        String valueString = input.substring (0, unitIndex).trim ();
        String unitString  = input.substring (unitIndex).trim ();
        if (valueString.isEmpty ()) throw new NumberFormatException ("No number in \"" + input + "\"");
        value = Double.parseDouble (valueString);
        if (! unitString.isEmpty ())
        {
            try
            {
                unit = format.parse (unitString);
            }
            catch (MeasurementException e)
            {
                throw new IllegalArgumentException ("Unknown unit \"" + unitString + "\"", e);
            }
        }
    }

    /**
        Returns the value scaled according to the unit.
        For example, if the input was "1ms", then value=1, unit=milliseconds, and this function returns 0.001
    **/
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public double get ()
    {
        if (unit == null) return value;  // naked number, so assume already in SI
        Unit<?> systemUnit = unit.getSystemUnit ();
        return unit.getConverterTo ((Unit) systemUnit).convert (value);
    }

    /**
        @return true if there is no unit, or the unit measures time.
    **/
    public boolean isTime ()
    {
        if (unit == null) return true;
        return unit.getDimension ().equals (Units.SECOND.getDimension ());
    }

    public static int findUnits (String value)
    {
        Matcher m = floatParser.matcher (value);
        m.find ();
        return m.end ();
    }

    public String toString ()
    {
        String result = Constant.print (value);
        if (unit != null) result += format.format (unit);
        return result;
    }
}
