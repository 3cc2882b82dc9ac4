/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.backend.verilog;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import gov.sandia.mixsig.eqset.Cases;
import gov.sandia.mixsig.eqset.EquationSystem;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.model.CompileSettings;
import gov.sandia.mixsig.model.MixedSignalModel;

public class VerilogGeneratorTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder ();

    /**
        Switched first-order filter with a free-running 4-bit counter on the side.
    **/
    static MixedSignalModel switchedFilter (CompileSettings settings)
    {
        settings.setDt (1);
        MixedSignalModel m = new MixedSignalModel ("switched", settings);
        Signal u = m.addAnalogInput ("u");
        Signal s = m.addDigitalInput ("s");
        Signal y = m.addAnalogOutput ("y");
        Signal x = m.addAnalogState ("x", 10);
        Signal c = m.addDigitalState ("c", 4, false, 0);
        Operator rate = Cases.eqnCase (Arrays.asList (x.access ().negate (), x.access ().times (-2)), Arrays.asList (s));
        m.addEqnSys (new EquationSystem
        (
            x.derivative ().equalTo (rate.plus (u)),
            y.access ().equalTo (x)
        ), Collections.emptyList ());
        m.setNextCycle (c, c.access ().plus (1));
        return m;
    }

    static void assertContains (String text, String... fragments)
    {
        for (String f : fragments) assertTrue ("missing: " + f + "\n" + text, text.contains (f));
    }

    @Test
    public void testSwitchedFilter () throws IOException
    {
        MixedSignalModel m = switchedFilter (new CompileSettings ());
        VerilogGenerator g = new VerilogGenerator ();
        m.compileModel (g);
        String text = g.getText ();

        assertContains
        (
            text,
            "`timescale 1ns/1ps",
            "`include \"real.sv\"",
            "`include \"math.sv\"",
            "`default_nettype none",
            "module switched #(",
            "`DECL_REAL(u)",
            "`DECL_REAL(y)",
            "`INPUT_REAL(u)",
            "input wire logic [0:0] s",
            "`OUTPUT_REAL(y)",
            "// Declaring internal variables.",
            "`MAKE_REAL(x, 10.0);",
            "logic [3:0] c;",
            "// Assign signal: x",
            "`MAKE_CONST_REAL(",
            "`MUL_REAL(",
            "`ADD_REAL(",
            "case (s)",
            "default: ",
            "endcase",
            "`MEM_INTO_REAL(",
            "// Assign signal: y",
            "`ASSIGN_REAL(x, y);",
            "// Assign signal: c",
            "always @(posedge `CLK_MSDSL) begin",
            "if (`RST_MSDSL == 1'b1) begin",
            "c <= 0;",
            " = c + 1;",
            "endmodule",
            "`default_nettype wire"
        );

        assertTrue (text.indexOf ("`DECL_REAL(u)") < text.indexOf ("`INPUT_REAL(u)"));
        assertTrue (text.indexOf ("endmodule") < text.indexOf ("`default_nettype wire"));
        assertTrue (text.indexOf ("// Assign signal: x") < text.indexOf ("// Assign signal: y"));
    }

    @Test
    public void testNonZeroInit () throws IOException
    {
        MixedSignalModel m = new MixedSignalModel ("leaky", new CompileSettings ());
        m.settings.setDt (0.5);
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        Signal x = m.addAnalogState ("x", 4, 1.5);
        m.addEqnSys
        (
            x.derivative ().equalTo (u.access ().minus (x)),
            y.access ().equalTo (x)
        );
        VerilogGenerator g = new VerilogGenerator ();
        m.compileModel (g);
        assertContains (g.getText (), "`DFF_INTO_REAL(", ", x, `RST_MSDSL, `CLK_MSDSL, 1'b1, 1.5);");
    }

    @Test
    public void testBindingAndProbe () throws IOException
    {
        MixedSignalModel m = new MixedSignalModel ("gain", new CompileSettings ());
        Signal u = m.addAnalogInput ("u");
        Signal y = m.addAnalogOutput ("y");
        Signal k = m.bindName ("k", u.access ().times (3));
        m.setThisCycle (y, k.access ());
        m.addProbe (k);
        VerilogGenerator g = new VerilogGenerator ();
        m.compileModel (g);
        String text = g.getText ();
        assertContains (text, "// Assign signal: k", "`MAKE_CONST_REAL(3.0, ", ", k);", "`ASSIGN_REAL(k, y);", "`PROBE_REAL(k);");
        assertFalse (text.contains ("// Declaring internal variables."));
    }

    @Test
    public void testConfigure () throws IOException
    {
        CompileSettings settings = new CompileSettings ();
        settings.node.set ("1fs/1fs", "verilog", "timescale");
        settings.node.set ("",        "verilog", "include", "svreal.sv");
        settings.node.set ("gen_top", "module");
        MixedSignalModel m = switchedFilter (settings);

        Path path = folder.getRoot ().toPath ().resolve ("build").resolve ("gen_top.sv");
        VerilogGenerator g = new VerilogGenerator (path);
        m.compileModel (g);

        assertTrue (Files.exists (path));
        String text = new String (Files.readAllBytes (path), StandardCharsets.UTF_8);
        assertEquals (g.getText (), text);
        assertContains (text, "`timescale 1fs/1fs", "`include \"svreal.sv\"", "module gen_top #(");
        assertFalse (text.contains ("math.sv"));
    }

    @Test
    public void testPortString ()
    {
        assertEquals ("`INPUT_REAL(a)",                   VerilogGenerator.portString (Signal.analogInput ("a")));
        assertEquals ("`OUTPUT_REAL(b)",                  VerilogGenerator.portString (Signal.analogOutput ("b", 0)));
        assertEquals ("input wire logic [7:0] d",         VerilogGenerator.portString (Signal.digitalInput ("d", 8, false)));
        assertEquals ("output wire logic signed [3:0] e", VerilogGenerator.portString (Signal.digitalOutput ("e", 4, true, 0)));
        try
        {
            VerilogGenerator.portString (Signal.digitalState ("f", 2, false, 0));
            fail ("A state is not a port.");
        }
        catch (IllegalArgumentException e)
        {
        }
    }

    @Test
    public void testReal2str ()
    {
        assertEquals ("0.1",  VerilogGenerator.real2str (0.1));
        assertEquals ("-2.0", VerilogGenerator.real2str (-2));
        assertEquals (0.36787944117144233, Double.parseDouble (VerilogGenerator.real2str (Math.exp (-1))), 0);
        try
        {
            VerilogGenerator.real2str (Double.NaN);
            fail ("NaN can't be emitted.");
        }
        catch (IllegalArgumentException e)
        {
        }
    }

    @Test
    public void testMaxAnalogRange ()
    {
        assertEquals ("0", VerilogGenerator.maxAnalogRange (Collections.<String> emptyList ()));
        assertEquals ("`RANGE_PARAM_REAL(a)", VerilogGenerator.maxAnalogRange (Arrays.asList ("a")));
        assertEquals ("`MAX_MATH(`RANGE_PARAM_REAL(a), `MAX_MATH(`RANGE_PARAM_REAL(b), `RANGE_PARAM_REAL(c)))", VerilogGenerator.maxAnalogRange (Arrays.asList ("a", "b", "c")));
    }
}
