/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gov.sandia.mixsig.language.type.Format;

/**
    Address-indexed table of values. At run time the selector picks one entry.
    The code generator turns this into a hardware select construct.
**/
public class ArraySelect extends Operator
{
    public final List<Operator> values;
    public final Operator       selector;

    public ArraySelect (List<Operator> values, Operator selector)
    {
        if (values.size () < 2) throw new IllegalArgumentException ("An address-indexed array needs at least two entries.");
        if (selector == null) throw new IllegalArgumentException ("An address-indexed array needs a selector.");
        this.values   = Collections.unmodifiableList (new ArrayList<Operator> (values));
        this.selector = selector;
    }

    /**
        A table with exactly one entry collapses to that entry.
        @param selector May be null when there is a single entry.
    **/
    public static Operator make (List<Operator> values, Operator selector)
    {
        if (values.isEmpty ()) throw new IllegalArgumentException ("An address-indexed array needs at least one entry.");
        if (values.size () == 1) return values.get (0);
        return new ArraySelect (values, selector);
    }

    /**
        Builds a table of numeric constants.
    **/
    public static Operator make (double[] values, Operator selector)
    {
        List<Operator> constants = new ArrayList<Operator> (values.length);
        for (double v : values) constants.add (new Constant (v));
        return make (constants, selector);
    }

    /**
        @return true if every entry is the constant zero, so the table contributes nothing to a sum.
    **/
    public static boolean allZero (double[] values)
    {
        for (double v : values) if (v != 0) return false;
        return true;
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.arraySelect (this);
    }

    public Format getFormat ()
    {
        List<Format> formats = new ArrayList<Format> (values.size ());
        for (Operator v : values) formats.add (v.getFormat ());
        return Format.union (formats);
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator v : values) v.visit (visitor);
        selector.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;

        boolean changed = false;
        List<Operator> newValues = new ArrayList<Operator> (values.size ());
        for (Operator v : values)
        {
            Operator t = v.transform (transformer);
            if (t != v) changed = true;
            newValues.add (t);
        }
        Operator newSelector = selector.transform (transformer);
        if (! changed  &&  newSelector == selector) return this;
        return new ArraySelect (newValues, newSelector);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("[");
        for (int i = 0; i < values.size (); i++)
        {
            if (i > 0) renderer.result.append (", ");
            values.get (i).render (renderer);
        }
        renderer.result.append ("][");
        selector.render (renderer);
        renderer.result.append ("]");
    }

    public String toString ()
    {
        return render ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof ArraySelect)) return false;
        ArraySelect a = (ArraySelect) that;
        return values.equals (a.values)  &&  selector.equals (a.selector);
    }

    public int hashCode ()
    {
        return values.hashCode () * 31 + selector.hashCode ();
    }
}
