/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gov.sandia.mixsig.language.AccessSignal;
import gov.sandia.mixsig.language.Case;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.Visitor;
import gov.sandia.mixsig.language.operator.EQ;

/**
    An ordered list of equations that together describe one linear system.
    Equations may contain case tables. Use substitute() to resolve them for one selector setting.
**/
public class EquationSystem
{
    public final List<EQ> equations;

    public EquationSystem (List<EQ> equations)
    {
        this.equations = Collections.unmodifiableList (new ArrayList<EQ> (equations));
    }

    public EquationSystem (EQ... equations)
    {
        this (Arrays.asList (equations));
    }

    /**
        Collects every signal referenced in arithmetic position, including within all branches of case tables.
        Selectors are not included unless they are also used in arithmetic.
        @return Map from name to signal, in order of first appearance.
    **/
    public Map<String,Signal> getSignals ()
    {
        final Map<String,Signal> result = new LinkedHashMap<String,Signal> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof AccessSignal)
                {
                    Signal s = ((AccessSignal) op).signal;
                    if (! result.containsKey (s.name)) result.put (s.name, s);
                }
                return true;
            }
        });
        return result;
    }

    /**
        @return Signals that appear under a derivative marker, in order of first appearance.
    **/
    public Map<String,Signal> getDerivatives ()
    {
        final Map<String,Signal> result = new LinkedHashMap<String,Signal> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof AccessSignal)
                {
                    AccessSignal a = (AccessSignal) op;
                    if (a.isDerivative ()  &&  ! result.containsKey (a.getName ())) result.put (a.getName (), a.signal);
                }
                return true;
            }
        });
        return result;
    }

    /**
        @return Signals that address case tables anywhere in this system, including nested tables,
        in order of first appearance.
    **/
    public Map<String,Signal> getSelectors ()
    {
        final Map<String,Signal> result = new LinkedHashMap<String,Signal> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Case)
                {
                    for (Signal s : ((Case) op).selectors)
                    {
                        if (! result.containsKey (s.name)) result.put (s.name, s);
                    }
                }
                return true;
            }
        });
        return result;
    }

    public void visit (Visitor visitor)
    {
        for (EQ e : equations) e.visit (visitor);
    }

    /**
        @return A copy of this system with every case table resolved under the given settings.
    **/
    public EquationSystem substitute (Map<String,Integer> settings)
    {
        List<EQ> result = new ArrayList<EQ> (equations.size ());
        for (EQ e : equations)
        {
            Operator s = Cases.substitute (e, settings);
            result.add ((EQ) s);
        }
        return new EquationSystem (result);
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        for (EQ e : equations) result.append (e.render ()).append ("\n");
        return result.toString ();
    }
}
