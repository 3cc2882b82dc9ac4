/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import gov.sandia.mixsig.eqset.AnalysisException;
import gov.sandia.mixsig.eqset.CaseShapeException;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.type.Format;

/**
    Table of 2^n alternative expressions, addressed by n single-bit selector signals.
    The first selector is the most significant bit of the address.
    Case nodes are resolved away before linear extraction, one address at a time.
**/
public class Case extends Operator
{
    public final List<Operator> cases;
    public final List<Signal>   selectors;

    public Case (List<Operator> cases, List<Signal> selectors)
    {
        if (cases == null  ||  cases.isEmpty ()) throw new CaseShapeException ("Case table is empty.");
        for (Signal s : selectors)
        {
            if (! s.isSelectorBit ()) throw new CaseShapeException ("Selector " + s.name + " is not a single unsigned bit: " + s.format);
        }
        if (selectors.size () > 30  ||  cases.size () != 1 << selectors.size ())
        {
            throw new CaseShapeException ("Case table has " + cases.size () + " entries, but " + selectors.size () + " selector bits require " + (1L << selectors.size ()));
        }
        this.cases     = Collections.unmodifiableList (new ArrayList<Operator> (cases));
        this.selectors = Collections.unmodifiableList (new ArrayList<Signal> (selectors));
    }

    /**
        Computes the address of this table under the given selector settings.
        Settings for signals that this table does not use are ignored.
    **/
    public int getAddress (Map<String,Integer> settings)
    {
        int address = 0;
        for (Signal s : selectors)
        {
            Integer bit = settings.get (s.name);
            if (bit == null) throw new AnalysisException ("No setting for selector " + s.name + " of case " + this);
            address = (address << 1) | (bit & 1);
        }
        return address;
    }

    public Operator getCase (Map<String,Integer> settings)
    {
        return cases.get (getAddress (settings));
    }

    public <T> T dispatch (Dispatcher<T> dispatcher)
    {
        return dispatcher.cases (this);
    }

    public Format getFormat ()
    {
        List<Format> formats = new ArrayList<Format> (cases.size ());
        for (Operator c : cases) formats.add (c.getFormat ());
        return Format.union (formats);
    }

    /**
        Visits the branches. Selector references are not visited, since they are not part of
        the value of the table. Analysis collects them separately from the selectors list.
    **/
    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator c : cases) c.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;

        boolean changed = false;
        List<Operator> newCases = new ArrayList<Operator> (cases.size ());
        for (Operator c : cases)
        {
            Operator t = c.transform (transformer);
            if (t != c) changed = true;
            newCases.add (t);
        }
        if (! changed) return this;
        return new Case (newCases, selectors);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("case(");
        for (int i = 0; i < selectors.size (); i++)
        {
            if (i > 0) renderer.result.append (",");
            renderer.result.append (selectors.get (i).name);
        }
        renderer.result.append ("){");
        for (int i = 0; i < cases.size (); i++)
        {
            if (i > 0) renderer.result.append ("; ");
            cases.get (i).render (renderer);
        }
        renderer.result.append ("}");
    }

    public String toString ()
    {
        return render ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Case)) return false;
        Case c = (Case) that;
        if (! cases.equals (c.cases)) return false;
        if (selectors.size () != c.selectors.size ()) return false;
        for (int i = 0; i < selectors.size (); i++)
        {
            if (! selectors.get (i).name.equals (c.selectors.get (i).name)) return false;
        }
        return true;
    }

    public int hashCode ()
    {
        int result = cases.hashCode ();
        for (Signal s : selectors) result = result * 31 + s.name.hashCode ();
        return result;
    }
}
