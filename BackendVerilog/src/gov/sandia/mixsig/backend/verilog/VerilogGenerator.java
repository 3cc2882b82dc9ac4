/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.backend.verilog;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.mixsig.db.MNode;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;
import gov.sandia.mixsig.language.type.RealFormat;
import gov.sandia.mixsig.model.CodeGenerator;
import gov.sandia.mixsig.model.Namer;

/**
    Emits a SystemVerilog module. Analog values use the fixed-point real-number macro library
    (MAKE_REAL, ADD_REAL, MUL_REAL and so on), which must be supplied by the included files.
    The clock and reset are the library's global CLK_MSDSL and RST_MSDSL.

    <p>Settings, under the "verilog" key:
    <dl>
    <dt>tab</dt><dd>Indent string.</dd>
    <dt>timescale</dt><dd>Default is 1ns/1ps.</dd>
    <dt>include</dt><dd>List of files to include, one child per file. Replaces the default list.</dd>
    </dl>
**/
public class VerilogGenerator extends CodeGenerator
{
    public String       timescale = "1ns/1ps";
    public List<String> includes  = new ArrayList<String> (Arrays.asList ("real.sv", "math.sv"));
    public Path         target;  // Where persist() writes. May be null, in which case the text stays in memory.

    protected ExpressionFlattener flattener = new ExpressionFlattener (this);
    protected Set<String>         undeclared = new HashSet<String> ();  // Analog internals whose format comes from their first assignment.

    private static Logger logger = Logger.getLogger (VerilogGenerator.class);

    public VerilogGenerator ()
    {
    }

    public VerilogGenerator (Path target)
    {
        this.target = target;
    }

    public String getName ()
    {
        return "verilog";
    }

    public void configure (MNode settings)
    {
        super.configure (settings);
        timescale = settings.getOrDefault (timescale, "timescale");
        MNode include = settings.child ("include");
        if (include != null  &&  include.size () > 0)
        {
            includes.clear ();
            for (MNode i : include)
            {
                String file = i.get ();
                if (file.isEmpty ()) file = i.key ();
                includes.add (file);
            }
        }
    }

    // Contract -------------------------------------------------------------

    public void startModule (String name, List<Signal> ios, Namer namer)
    {
        this.namer = namer;

        comment ("Model generated on " + LocalDateTime.now ());
        writeln ();
        writeln ("`timescale " + timescale);
        writeln ();
        for (String i : includes) writeln ("`include \"" + i + "\"");
        writeln ();
        writeln ("`default_nettype none");
        writeln ();

        write ("module " + name);

        List<String> parameters = new ArrayList<String> ();
        for (Signal s : ios) if (s.isAnalog ()) parameters.add ("`DECL_REAL(" + s.name + ")");
        if (! parameters.isEmpty ())
        {
            write (" #");
            commaSeparatedLines (parameters);
        }

        List<String> ports = new ArrayList<String> ();
        for (Signal s : ios) ports.add (portString (s));
        if (! ports.isEmpty ())
        {
            write (" ");
            commaSeparatedLines (ports);
        }

        write (";" + lineEnding);
        indent ();
    }

    public void makeSection (String label)
    {
        comment (label);
    }

    public void makeSignal (Signal s)
    {
        if (s.isAnalog ())
        {
            double range = ((RealFormat) s.format).range;
            if (Double.isInfinite (range)) undeclared.add (s.name);
            else                           macroCall ("MAKE_REAL", s.name, real2str (range));
        }
        else if (s.isDigital ())
        {
            writeln (digitalType ((IntFormat) s.format) + " " + s.name + ";");
        }
        else
        {
            throw new IllegalArgumentException ("Unsupported format for signal " + s.name);
        }
    }

    public void setThisCycle (Signal s, Operator expression)
    {
        if (logger.isDebugEnabled ()) logger.debug ("this cycle: " + s.name + " = " + expression);
        if (s.isAnalog ())
        {
            String value = flattener.flattenReal (expression);
            declareLate (s, value);
            macroCall ("ASSIGN_REAL", value, s.name);
        }
        else
        {
            writeln ("assign " + s.name + " = " + flattener.flattenInteger (expression, (IntFormat) s.format) + ";");
        }
    }

    public void setNextCycle (Signal s, Operator expression, double init)
    {
        if (logger.isDebugEnabled ()) logger.debug ("next cycle: " + s.name + " = " + expression + ", init " + init);
        if (s.isAnalog ())
        {
            String value = flattener.flattenReal (expression);
            declareLate (s, value);
            if (init == 0) macroCall ("MEM_INTO_REAL", value, s.name);
            else           macroCall ("DFF_INTO_REAL", value, s.name, "`RST_MSDSL", "`CLK_MSDSL", "1'b1", real2str (init));
        }
        else
        {
            String value = flattener.flattenInteger (expression, (IntFormat) s.format);
            alwaysBegin ("posedge `CLK_MSDSL");
            ifStatement ("`RST_MSDSL == 1'b1", s.name + " <= " + Math.round (init), s.name + " <= " + value);
            end ();
        }
    }

    public void bindName (Signal s, Operator expression)
    {
        if (logger.isDebugEnabled ()) logger.debug ("bind: " + s.name + " = " + expression);
        if (s.isAnalog ())
        {
            String value = flattener.flattenReal (expression);
            double range = ((RealFormat) s.format).range;
            if (Double.isInfinite (range)) macroCall ("COPY_FORMAT_REAL", value, s.name);
            else                           macroCall ("MAKE_REAL", s.name, real2str (range));
            macroCall ("ASSIGN_REAL", value, s.name);
        }
        else
        {
            String value = flattener.flattenInteger (expression, (IntFormat) s.format);
            writeln (digitalType ((IntFormat) s.format) + " " + s.name + ";");
            writeln ("assign " + s.name + " = " + value + ";");
        }
    }

    public void makeProbe (Signal s)
    {
        if (s.isAnalog ()) macroCall ("PROBE_REAL", s.name);
        else               macroCall ("PROBE_BITS", s.name);
    }

    public void endModule ()
    {
        dedent ();
        writeln ("endmodule");
        writeln ();
        writeln ("`default_nettype wire");
    }

    public void persist () throws IOException
    {
        if (target != null) writeToFile (target);
    }

    public void writeToFile (Path path) throws IOException
    {
        Path parent = path.toAbsolutePath ().getParent ();
        if (parent != null) Files.createDirectories (parent);
        try (Writer writer = Files.newBufferedWriter (path, StandardCharsets.UTF_8))
        {
            writer.write (getText ());
        }
        logger.info ("Wrote " + path);
    }

    // Helpers used by ExpressionFlattener ----------------------------------

    public String nextName ()
    {
        return namer.next ();
    }

    /**
        Claims the given name, or a fresh variant of it if already taken.
    **/
    public String reserve (String name)
    {
        if (namer.isTaken (name)) return namer.next (name + "_");
        namer.addName (name);
        return name;
    }

    public void macroCall (String macro, String... arguments)
    {
        writeln ("`" + macro + "(" + String.join (", ", arguments) + ");");
    }

    public String intToReal (String name, IntFormat format)
    {
        String result = nextName ();
        macroCall ("INT_TO_REAL", name, String.valueOf (format.width), result);
        return result;
    }

    /**
        Declares a new digital temporary and drives it with the given Verilog expression.
    **/
    public String digitalWire (IntFormat format, String value)
    {
        String result = nextName ();
        writeln (digitalType (format) + " " + result + ";");
        writeln ("assign " + result + " = " + value + ";");
        return result;
    }

    public void comment (String content)
    {
        writeln ("// " + content);
    }

    public void alwaysBegin (String sensitivity)
    {
        writeln ("always @(" + sensitivity + ") begin");
        indent ();
    }

    public void ifStatement (String condition, String actionIfTrue, String actionIfFalse)
    {
        writeln ("if (" + condition + ") begin");
        indent ();
        writeln (actionIfTrue + ";");
        dedent ();
        writeln ("end else begin");
        indent ();
        writeln (actionIfFalse + ";");
        end ();
    }

    public void end ()
    {
        dedent ();
        writeln ("end");
    }

    protected void commaSeparatedLines (List<String> lines)
    {
        write ("(" + lineEnding);
        for (int i = 0; i < lines.size (); i++)
        {
            write (tab + lines.get (i));
            if (i < lines.size () - 1) write (",");
            write (lineEnding);
        }
        write (")");
    }

    /**
        An analog internal with no fixed range takes the format of the first value assigned to it.
    **/
    protected void declareLate (Signal s, String value)
    {
        if (undeclared.remove (s.name)) macroCall ("COPY_FORMAT_REAL", value, s.name);
    }

    public static String portString (Signal s)
    {
        Format f = s.format;
        if (s.role == Signal.Role.ANALOG_INPUT)  return "`INPUT_REAL("  + s.name + ")";
        if (s.role == Signal.Role.ANALOG_OUTPUT) return "`OUTPUT_REAL(" + s.name + ")";
        if (f instanceof IntFormat)
        {
            if (s.role == Signal.Role.DIGITAL_INPUT)  return "input wire "  + digitalType ((IntFormat) f) + " " + s.name;
            if (s.role == Signal.Role.DIGITAL_OUTPUT) return "output wire " + digitalType ((IntFormat) f) + " " + s.name;
        }
        throw new IllegalArgumentException ("Signal " + s.name + " can't be a port: " + s.role + " " + f);
    }

    public static String digitalType (IntFormat f)
    {
        String result = "logic";
        if (f.signed) result += " signed";
        return result + " [" + (f.width - 1) + ":0]";
    }

    /**
        Formats a real literal. Full double precision, in a form Verilog accepts.
    **/
    public static String real2str (double value)
    {
        if (Double.isNaN (value)  ||  Double.isInfinite (value)) throw new IllegalArgumentException ("Can't emit non-finite value " + value);
        return Double.toString (value);
    }

    /**
        Builds a range expression covering all the given analog values.
    **/
    public static String maxAnalogRange (List<String> names)
    {
        if (names.isEmpty ()) return "0";
        String result = "`RANGE_PARAM_REAL(" + names.get (names.size () - 1) + ")";
        for (int i = names.size () - 2; i >= 0; i--) result = "`MAX_MATH(`RANGE_PARAM_REAL(" + names.get (i) + "), " + result + ")";
        return result;
    }
}
