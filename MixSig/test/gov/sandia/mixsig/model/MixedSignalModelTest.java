/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import gov.sandia.mixsig.eqset.Cases;
import gov.sandia.mixsig.eqset.DeclarationException;
import gov.sandia.mixsig.eqset.EquationSystem;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.lds.DiscretizationException;
import gov.sandia.mixsig.lds.LdsCollection;
import gov.sandia.mixsig.lds.LinearDynamicalSystem;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Evaluator;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.Visitor;
import gov.sandia.mixsig.language.type.RealFormat;
import gov.sandia.mixsig.linear.MatrixDense;

public class MixedSignalModelTest
{
    static final double p = Math.exp (-1);

    static MixedSignalModel model (String name, double dt)
    {
        CompileSettings settings = new CompileSettings ();
        if (dt > 0) settings.setDt (dt);
        return new MixedSignalModel (name, settings);
    }

    static double evaluate (MixedSignalModel m, String name, Evaluator e)
    {
        return e.evaluate (m.getAssignment (name).expression);
    }

    static boolean containsArraySelect (Operator op)
    {
        final boolean[] found = new boolean[1];
        op.visit (new Visitor ()
        {
            public boolean visit (Operator o)
            {
                if (o instanceof ArraySelect) found[0] = true;
                return true;
            }
        });
        return found[0];
    }

    @Test
    public void testSingleState () throws IOException
    {
        MixedSignalModel m = model ("filter", 1);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        Signal x = m.addAnalogState ("x", 10);
        m.addEqnSys
        (
            x.derivative ().equalTo (u.access ().minus (x)),
            y.access ().equalTo (x)
        );

        assertEquals (Assignment.Timing.NEXT_CYCLE, m.getAssignment ("x").timing);
        assertEquals (Assignment.Timing.THIS_CYCLE, m.getAssignment ("y").timing);
        assertEquals (1 - p,     evaluate (m, "x", new Evaluator ().set ("u", 1).set ("x", 0)), 1e-12);
        assertEquals (p,         evaluate (m, "x", new Evaluator ().set ("u", 0).set ("x", 1)), 1e-12);
        assertEquals (0.5,       evaluate (m, "y", new Evaluator ().set ("u", 0).set ("x", 0.5)), 1e-12);
        for (Assignment a : m.getAssignments ()) assertFalse (a.toString (), containsArraySelect (a.expression));

        RecordingGenerator g = new RecordingGenerator ();
        m.compileModel (g);
        List<String> expected = Arrays.asList
        (
            "start filter [u, y]",
            "section Declaring internal variables.",
            "signal x",
            "section Assign signal: x"
        );
        assertEquals (expected, g.calls.subList (0, 4));
        assertTrue (g.calls.get (4).startsWith ("next x = "));
        assertTrue (g.calls.get (4).endsWith (" init 0.0"));
        assertEquals ("section Assign signal: y", g.calls.get (5));
        assertTrue (g.calls.get (6).startsWith ("this y = "));
        assertEquals ("end", g.calls.get (7));
        assertTrue (g.persisted);
    }

    @Test
    public void testTwoCases ()
    {
        MixedSignalModel m = model ("switched", 1);
        Signal u = m.addAnalogInput ("u");
        Signal s = m.addDigitalInput ("s");
        Signal x = m.addAnalogState ("x", 10);
        Signal y = m.addAnalogOutput ("y");
        Operator rate = Cases.eqnCase (Arrays.asList (x.access ().negate (), x.access ().times (-2)), Arrays.asList (s));
        LdsCollection collection = m.addEqnSys (new EquationSystem
        (
            x.derivative ().equalTo (rate.plus (u)),
            y.access ().equalTo (x)
        ), Collections.emptyList ());

        assertEquals (2, collection.size ());
        Operator next = m.getAssignment ("x").expression;
        assertTrue (containsArraySelect (next));

        assertEquals (Math.exp (-1), evaluate (m, "x", new Evaluator ().set ("u", 0).set ("x", 1).set ("s", 0)), 1e-12);
        assertEquals (Math.exp (-2), evaluate (m, "x", new Evaluator ().set ("u", 0).set ("x", 1).set ("s", 1)), 1e-12);
        assertEquals ((1 - Math.exp (-2)) / 2, evaluate (m, "x", new Evaluator ().set ("u", 1).set ("x", 0).set ("s", 1)), 1e-12);
        assertEquals (3, evaluate (m, "y", new Evaluator ().set ("u", 0).set ("x", 3).set ("s", 1)), 1e-12);
    }

    @Test
    public void testParallelMatchesSequential ()
    {
        String[] rendered = new String[2];
        for (int i = 0; i < 2; i++)
        {
            MixedSignalModel m = model ("par", 0.5);
            if (i == 1) m.settings.node.set ("1", "parallel");
            Signal u  = m.addAnalogInput ("u");
            Signal s0 = m.addDigitalInput ("s0");
            Signal s1 = m.addDigitalInput ("s1");
            Signal x  = m.addAnalogState ("x", 10);
            Operator rate = Cases.eqnCase (Arrays.asList (-1, -2, -3, -4), Arrays.asList (s0, s1));
            m.addEqnSys (x.derivative ().equalTo (rate.times (x).plus (u)));
            rendered[i] = m.getAssignment ("x").expression.render ();

            for (int address = 0; address < 4; address++)
            {
                Evaluator e = new Evaluator ().set ("u", 0).set ("x", 1).set ("s0", address >> 1).set ("s1", address & 1);
                assertEquals (Math.exp (-(address + 1) * 0.5), evaluate (m, "x", e), 1e-12);
            }
        }
        assertEquals (rendered[0], rendered[1]);
    }

    @Test
    public void testOffsetWithoutStates ()
    {
        MixedSignalModel m = model ("offset", 0);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        m.addEqnSys (y.access ().equalTo (u.access ().plus (1)));
        assertEquals (3, evaluate (m, "y", new Evaluator ().set ("u", 2)), 1e-12);
    }

    @Test
    public void testMissingDt ()
    {
        MixedSignalModel m = model ("nodt", 0);
        Signal x = m.addAnalogState ("x", 1);
        try
        {
            m.addEqnSys (x.derivative ().equalTo (x.access ().negate ()));
            fail ("continuous dynamics need dt");
        }
        catch (DiscretizationException e) {}
        assertFalse (m.hasAssignment ("x"));
    }

    @Test
    public void testExtraOutput ()
    {
        MixedSignalModel m = model ("extra", 1);
        Signal u = m.addAnalogInput ("u");
        Signal x = m.addAnalogState ("x", 10);
        Signal w = new Signal ("w", new RealFormat (20));
        m.addEqnSys
        (
            Arrays.asList
            (
                x.derivative ().equalTo (u.access ().minus (x)),
                w.access ().equalTo (x.access ().times (2))
            ),
            Arrays.asList (w)
        );
        assertTrue (m.hasSignal ("w"));
        assertEquals (Assignment.Timing.BINDING, m.getAssignment ("w").timing);
        assertEquals (6, evaluate (m, "w", new Evaluator ().set ("u", 0).set ("x", 3)), 1e-12);
    }

    @Test
    public void testMergeIntoBinding ()
    {
        MixedSignalModel m = model ("merge", 0);
        Signal u = m.addAnalogInput ("u");
        Signal b = m.bindName ("b", u.access ().times (2));

        LdsCollection collection = new LdsCollection ();
        collection.append (new LinearDynamicalSystem
        (
            new MatrixDense (0, 0),
            new MatrixDense (0, 1),
            new MatrixDense (1, 0),
            new MatrixDense (new double[][] {{3}}),
            true
        ));
        m.addDiscreteTimeLds (collection, Arrays.asList (u), Collections.<Signal> emptyList (), Arrays.asList (b), null);

        assertEquals (Assignment.Timing.BINDING, m.getAssignment ("b").timing);
        assertEquals (5, evaluate (m, "b", new Evaluator ().set ("u", 1)), 1e-12);
    }

    @Test
    public void testAssignmentErrors ()
    {
        MixedSignalModel m = model ("errors", 0);
        Signal u = m.addAnalogInput ("u");
        Signal z = m.addInternal ("z", new RealFormat (1));
        m.bindName ("k", 1);
        try
        {
            m.bindName ("k", 2);
            fail ("k is already bound");
        }
        catch (DeclarationException e) {}

        m.setThisCycle (z, u);
        try
        {
            m.setNextCycle (z, u);
            fail ("z is already assigned");
        }
        catch (DeclarationException e) {}

        try
        {
            m.setThisCycle (u, 0);
            fail ("inputs can't be assigned");
        }
        catch (DeclarationException e) {}

        try
        {
            m.setThisCycle (Signal.analogOutput ("ghost", 0), 0);
            fail ("ghost was never declared");
        }
        catch (DeclarationException e) {}

        try
        {
            m.addAnalogInput ("u");
            fail ("u is already declared");
        }
        catch (DeclarationException e) {}
    }

    @Test
    public void testUnassignedInternal () throws IOException
    {
        MixedSignalModel m = model ("incomplete", 0);
        m.addAnalogInput ("u");
        m.addAnalogState ("x", 1);
        RecordingGenerator g = new RecordingGenerator ();
        try
        {
            m.compileModel (g);
            fail ("x has no assignment");
        }
        catch (DeclarationException e)
        {
            assertTrue (e.getMessage ().contains ("x"));
        }
        assertFalse (g.persisted);
    }

    @Test
    public void testBindingAndProbe () throws IOException
    {
        MixedSignalModel m = model ("probed", 0);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        Signal k = m.bindName ("k", u.access ().times (3));
        m.setThisCycle (y, k);
        m.addProbe (k);
        m.settings.node.set ("top", "module");

        RecordingGenerator g = new RecordingGenerator ();
        m.compileModel (g);
        assertEquals ("start top [u, y]", g.calls.get (0));
        assertTrue (g.find ("signal").isEmpty ());
        assertEquals (Arrays.asList ("bind k = 3 * u"), g.find ("bind"));
        assertEquals (Arrays.asList ("this y = k"),     g.find ("this"));
        assertEquals ("probe k", g.calls.get (g.calls.size () - 2));
        assertEquals ("end",     g.calls.get (g.calls.size () - 1));
    }

    @Test
    public void testTransferFunction ()
    {
        MixedSignalModel m = model ("lowpass", 1);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        m.setTf (u, y, new double[] {1}, new double[] {1, 1});

        assertEquals (Assignment.Timing.NEXT_CYCLE, m.getAssignment ("y").timing);
        assertFalse (m.hasSignal ("u_1"));
        assertEquals (1 - p, evaluate (m, "y", new Evaluator ().set ("u", 1).set ("y", 0)), 1e-12);
        assertEquals (p,     evaluate (m, "y", new Evaluator ().set ("u", 0).set ("y", 1)), 1e-12);
    }

    @Test
    public void testTransferFunctionSecondOrder ()
    {
        MixedSignalModel m = model ("second", 0.1);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        m.setTf (u, y, new double[] {2}, new double[] {1, 3, 2});

        assertTrue (m.hasSignal ("u_1"));
        assertTrue (m.hasSignal ("y_1"));
        assertEquals (Assignment.Timing.NEXT_CYCLE, m.getAssignment ("u_1").timing);
        assertEquals (u.access (), m.getAssignment ("u_1").expression);
        assertEquals (y.access (), m.getAssignment ("y_1").expression);

        // Steady state: with u=1 everywhere, y settles at the DC gain of 1.
        Evaluator e = new Evaluator ().set ("u", 1).set ("u_1", 1).set ("y", 1).set ("y_1", 1);
        assertEquals (1, evaluate (m, "y", e), 1e-9);
    }

    @Test
    public void testTransferFunctionProper ()
    {
        MixedSignalModel m = model ("highpass", 1);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        m.setTf (u, y, new double[] {1, 0}, new double[] {1, 1});

        assertEquals (Assignment.Timing.THIS_CYCLE, m.getAssignment ("y").timing);
        assertTrue (m.hasSignal ("u_1"));
        assertTrue (m.hasSignal ("y_1"));
        assertEquals (1, evaluate (m, "y", new Evaluator ().set ("u", 1).set ("u_1", 0).set ("y_1", 0)), 1e-12);
        assertEquals (p, evaluate (m, "y", new Evaluator ().set ("u", 1).set ("u_1", 1).set ("y_1", 1)), 1e-12);
    }

    @Test
    public void testMakeHistory ()
    {
        MixedSignalModel m = model ("history", 0);
        Signal u = m.addAnalogInput ("u");
        List<Signal> chain = m.makeHistory (u, 3);
        assertEquals (3, chain.size ());
        assertEquals ("u",   chain.get (0).name);
        assertEquals ("u_1", chain.get (1).name);
        assertEquals ("u_2", chain.get (2).name);
        assertEquals (chain.get (1).access (), m.getAssignment ("u_2").expression);
    }

    @Test
    public void testTransferFunctionRejected ()
    {
        MixedSignalModel m = model ("rejected", 0.1);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        m.setThisCycle (y, 0);
        try
        {
            m.setTf (u, y, new double[] {1}, new double[] {1, 3, 2});
            fail ("y already has an assignment");
        }
        catch (DeclarationException e) {}
        assertFalse (m.hasSignal ("u_1"));
        assertFalse (m.hasSignal ("y_1"));
        assertEquals (2, m.getCatalog ().size ());
        assertEquals (1, m.getAssignments ().size ());

        // A tap name taken by some other signal also stops the call before anything is added.
        MixedSignalModel m2 = model ("taken", 0.1);
        Signal u2 = m2.addAnalogInput ("u");
        Signal y2 = m2.addAnalogOutput ("y");
        m2.addAnalogState ("y_1", 10);
        try
        {
            m2.setTf (u2, y2, new double[] {1}, new double[] {1, 3, 2});
            fail ("y_1 is already declared");
        }
        catch (DeclarationException e) {}
        assertFalse (m2.hasSignal ("u_1"));
        assertTrue (m2.getAssignments ().isEmpty ());

        // The same model accepts a corrected call.
        MixedSignalModel m3 = model ("retry", 0.1);
        Signal u3 = m3.addAnalogInput ("u");
        Signal y3 = m3.addAnalogOutput ("y");
        Signal z3 = m3.addAnalogOutput ("z");
        m3.setThisCycle (y3, 0);
        try
        {
            m3.setTf (u3, y3, new double[] {1}, new double[] {1, 3, 2});
            fail ("y already has an assignment");
        }
        catch (DeclarationException e) {}
        m3.setTf (u3, z3, new double[] {1}, new double[] {1, 3, 2});
        assertTrue (m3.hasSignal ("u_1"));
        assertTrue (m3.hasSignal ("z_1"));
        assertFalse (m3.hasSignal ("y_1"));
    }

    @Test
    public void testRejectedDeclarations ()
    {
        MixedSignalModel m = model ("ports", 0);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        try
        {
            m.addAssignment (new Assignment (y, u.access (), Assignment.Timing.BINDING));
            fail ("a port can't be bound to a name");
        }
        catch (DeclarationException e) {}
        assertFalse (m.hasAssignment ("y"));

        try
        {
            m.addProbe (Signal.analogState ("ghost", new RealFormat (1, null, null), 0));
            fail ("probe of an undeclared signal");
        }
        catch (DeclarationException e) {}
    }

    @Test
    public void testLookup ()
    {
        MixedSignalModel m = model ("lookup", 0);
        Signal u = m.addAnalogInput ("u");
        Signal d = m.addDigitalOutput ("d", 8, true, 3);
        m.setThisCycle (d, 5);

        assertEquals (u, m.findSignal ("u"));
        assertEquals (null, m.findSignal ("missing"));
        assertEquals (d, m.getSignal ("d"));
        assertEquals (Signal.Role.DIGITAL_OUTPUT, d.role);
        assertEquals (3, d.init, 0);
        assertEquals (2, m.getCatalog ().size ());
        assertEquals (1, m.getAssignments ().size ());
        try
        {
            m.getSignal ("missing");
            fail ("An undeclared name should be rejected.");
        }
        catch (DeclarationException e)
        {
        }
    }
}
