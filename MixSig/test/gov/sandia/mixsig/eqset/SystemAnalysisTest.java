/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.mixsig.language.type.RealFormat;

public class SystemAnalysisTest
{
    SignalCatalog catalog;
    Signal        u;
    Signal        s;
    Signal        x;
    Signal        y;
    Signal        z;
    Set<String>   assigned;

    @Before
    public void setup ()
    {
        catalog  = new SignalCatalog ();
        u        = catalog.add (Signal.analogInput ("u"));
        s        = catalog.add (Signal.digitalInput ("s", 1, false));
        x        = catalog.add (Signal.analogState ("x", new RealFormat (10), 0));
        y        = catalog.add (Signal.analogOutput ("y", 0));
        z        = catalog.add (new Signal ("z", new RealFormat (1)));
        assigned = new HashSet<String> ();
    }

    static List<String> names (List<Signal> signals)
    {
        String[] result = new String[signals.size ()];
        for (int i = 0; i < result.length; i++) result[i] = signals.get (i).name;
        return Arrays.asList (result);
    }

    @Test
    public void testClassification ()
    {
        // x' = case(s){-x; -2*x} + u
        // y  = x
        EquationSystem system = new EquationSystem
        (
            x.derivative ().equalTo (Cases.eqnCase (Arrays.asList (x.access ().negate (), x.access ().times (-2)), Arrays.asList (s)).plus (u)),
            y.access ().equalTo (x)
        );
        SystemAnalysis analysis = new SystemAnalysis (system, catalog, assigned);
        assertEquals (Arrays.asList ("u"), names (analysis.inputs));
        assertEquals (Arrays.asList ("x"), names (analysis.states));
        assertEquals (Arrays.asList ("y"), names (analysis.outputs));
        assertEquals (Arrays.asList ("s"), names (analysis.selectors));
    }

    @Test
    public void testAssignedSignalIsInput ()
    {
        assigned.add ("z");
        EquationSystem system = new EquationSystem (y.access ().equalTo (z.access ().times (3)));
        SystemAnalysis analysis = new SystemAnalysis (system, catalog, assigned);
        assertEquals (Arrays.asList ("z"), names (analysis.inputs));
        assertEquals (Arrays.asList ("y"), names (analysis.outputs));
    }

    @Test
    public void testSelectorUsedArithmetically ()
    {
        EquationSystem system = new EquationSystem
        (
            y.access ().equalTo (Cases.eqnCase (Arrays.asList (u, 0), Arrays.asList (s)).plus (s))
        );
        SystemAnalysis analysis = new SystemAnalysis (system, catalog, assigned);
        assertEquals (Arrays.asList ("u", "s"), names (analysis.inputs));
        assertEquals (Arrays.asList ("s"),      names (analysis.selectors));
        assertEquals (Arrays.asList ("y"),      names (analysis.outputs));
    }

    @Test
    public void testUndeclared ()
    {
        Signal w = Signal.analogInput ("w");
        EquationSystem system = new EquationSystem (y.access ().equalTo (w));
        try
        {
            new SystemAnalysis (system, catalog, assigned);
            fail ("w was never declared");
        }
        catch (DeclarationException e)
        {
            assertTrue (e.getMessage ().contains ("w"));
        }
    }

    @Test
    public void testDerivativeOfInput ()
    {
        EquationSystem system = new EquationSystem (u.derivative ().equalTo (x));
        try
        {
            new SystemAnalysis (system, catalog, assigned);
            fail ("an input can't be a state");
        }
        catch (AnalysisException e) {}

        assigned.add ("z");
        system = new EquationSystem (z.derivative ().equalTo (x));
        try
        {
            new SystemAnalysis (system, catalog, assigned);
            fail ("an assigned signal can't be a state");
        }
        catch (AnalysisException e) {}
    }

    @Test
    public void testExtraOutputs ()
    {
        Signal w = new Signal ("w", new RealFormat (1));  // not in the catalog
        EquationSystem system = new EquationSystem
        (
            x.derivative ().equalTo (u.access ().minus (x)),
            w.access ().equalTo (x.access ().times (2))
        );
        List<Object> extras = Arrays.<Object> asList (w, "junk", x);
        SystemAnalysis analysis = new SystemAnalysis (system, catalog, assigned, extras);
        assertEquals (Arrays.asList ("w"), names (analysis.outputs));
        assertEquals (Arrays.asList ("x"), names (analysis.states));

        analysis = new SystemAnalysis (system, catalog, assigned, Collections.singletonList (w));
        assertEquals (Arrays.asList ("w"), names (analysis.outputs));
    }
}
