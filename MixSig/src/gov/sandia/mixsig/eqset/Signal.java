/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import gov.sandia.mixsig.language.AccessSignal;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;
import gov.sandia.mixsig.language.type.RealFormat;

/**
    A named value in the model. Signals are immutable handles; the SignalCatalog that
    registers them is the only owner. Expressions refer to a signal through AccessSignal.
**/
public class Signal
{
    public enum Role
    {
        ANALOG_INPUT,
        ANALOG_OUTPUT,
        ANALOG_STATE,
        DIGITAL_INPUT,
        DIGITAL_OUTPUT,
        DIGITAL_STATE,
        INTERNAL;

        public boolean isInput ()
        {
            return this == ANALOG_INPUT  ||  this == DIGITAL_INPUT;
        }

        public boolean isOutput ()
        {
            return this == ANALOG_OUTPUT  ||  this == DIGITAL_OUTPUT;
        }

        /// Signals that appear in the port list of the generated module.
        public boolean isIO ()
        {
            return isInput ()  ||  isOutput ();
        }
    }

    public final String name;
    public final Role   role;
    public final Format format;
    public final double init;  // value loaded by synchronous reset, for signals that receive a clocked assignment

    public Signal (String name, Format format)
    {
        this (name, Role.INTERNAL, format, 0);
    }

    public Signal (String name, Role role, Format format, double init)
    {
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("Signal name must not be empty.");
        if (format == null) throw new IllegalArgumentException ("Signal " + name + " needs a format.");
        this.name   = name;
        this.role   = role;
        this.format = format;
        this.init   = init;
    }

    public static Signal analogInput (String name)
    {
        return new Signal (name, Role.ANALOG_INPUT, RealFormat.UNBOUNDED, 0);
    }

    public static Signal analogInput (String name, double range)
    {
        return new Signal (name, Role.ANALOG_INPUT, new RealFormat (range), 0);
    }

    public static Signal analogOutput (String name, double init)
    {
        return new Signal (name, Role.ANALOG_OUTPUT, RealFormat.UNBOUNDED, init);
    }

    public static Signal analogState (String name, RealFormat format, double init)
    {
        return new Signal (name, Role.ANALOG_STATE, format, init);
    }

    public static Signal digitalInput (String name, int width, boolean signed)
    {
        return new Signal (name, Role.DIGITAL_INPUT, new IntFormat (width, signed), 0);
    }

    public static Signal digitalOutput (String name, int width, boolean signed, double init)
    {
        return new Signal (name, Role.DIGITAL_OUTPUT, new IntFormat (width, signed), init);
    }

    public static Signal digitalState (String name, int width, boolean signed, double init)
    {
        return new Signal (name, Role.DIGITAL_STATE, new IntFormat (width, signed), init);
    }

    public boolean isAnalog ()
    {
        return format instanceof RealFormat;
    }

    public boolean isDigital ()
    {
        return format instanceof IntFormat;
    }

    /**
        Determines if this signal can address a case table.
    **/
    public boolean isSelectorBit ()
    {
        return format instanceof IntFormat  &&  ((IntFormat) format).isBit ();
    }

    /**
        Copy of this signal under a new name, with the same format and no I/O role.
        Used for delay taps and other auxiliary registers derived from an existing signal.
    **/
    public Signal derive (String newName)
    {
        return new Signal (newName, Role.INTERNAL, format, init);
    }

    /// Convenience for building expressions.
    public AccessSignal access ()
    {
        return new AccessSignal (this);
    }

    /// The derivative marker of this signal, as it appears in continuous-time equations.
    public AccessSignal derivative ()
    {
        return new AccessSignal (this, 1);
    }

    public String toString ()
    {
        return name;
    }
}
