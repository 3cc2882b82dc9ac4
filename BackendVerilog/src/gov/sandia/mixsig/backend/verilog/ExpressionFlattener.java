/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.backend.verilog;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.mixsig.language.AccessSignal;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Case;
import gov.sandia.mixsig.language.Concatenate;
import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.OperatorNary;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.EQ;
import gov.sandia.mixsig.language.operator.Multiply;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.IntFormat;
import gov.sandia.mixsig.language.type.RealFormat;

/**
    Breaks an expression into a sequence of declarations, one per node, and returns the
    name that holds the value of the root. Analog arithmetic goes through the real-number
    macro library, so each analog node gets its own temporary. Digital nodes become
    plain continuous assignments. Digital constants are returned as literals.
**/
public class ExpressionFlattener implements Operator.Dispatcher<String>
{
    protected VerilogGenerator generator;
    protected IntFormat        integer;  // When set, every node is rendered as integer arithmetic of this format.

    public ExpressionFlattener (VerilogGenerator generator)
    {
        this.generator = generator;
    }

    public String flatten (Operator op)
    {
        return op.dispatch (this);
    }

    /**
        Renders the expression for a digital target. Constants become integer literals
        even where the expression tree gives them a real format.
    **/
    public String flattenInteger (Operator op, IntFormat format)
    {
        IntFormat saved = integer;
        integer = format;
        try
        {
            return flatten (op);
        }
        finally
        {
            integer = saved;
        }
    }

    protected boolean isReal (Operator op)
    {
        return integer == null  &&  op.getFormat () instanceof RealFormat;
    }

    protected IntFormat integerFormat (Operator op)
    {
        Format f = op.getFormat ();
        if (f instanceof IntFormat) return (IntFormat) f;
        return integer;
    }

    /**
        Flattens the expression and converts the result to real if it is digital.
    **/
    public String flattenReal (Operator op)
    {
        String name = flatten (op);
        Format f = op.getFormat ();
        if (f instanceof IntFormat) return generator.intToReal (name, (IntFormat) f);
        return name;
    }

    public String constant (Constant op)
    {
        if (! isReal (op)) return Long.toString (Math.round (op.value));
        String name = generator.nextName ();
        generator.macroCall ("MAKE_CONST_REAL", VerilogGenerator.real2str (op.value), name);
        return name;
    }

    public String signal (AccessSignal op)
    {
        if (op.isDerivative ()) throw new IllegalArgumentException ("Derivative " + op + " can't appear in generated code.");
        return op.getName ();
    }

    public String add (Add op)
    {
        return arithmetic (op, "ADD_REAL", "+");
    }

    public String multiply (Multiply op)
    {
        return arithmetic (op, "MUL_REAL", "*");
    }

    protected String arithmetic (OperatorNary op, String macro, String symbol)
    {
        if (isReal (op))
        {
            String result = null;
            for (Operator o : op.operands)
            {
                String name = flattenReal (o);
                if (result == null)
                {
                    result = name;
                    continue;
                }
                String sum = generator.nextName ();
                generator.macroCall (macro, result, name, sum);
                result = sum;
            }
            return result;
        }

        List<String> names = new ArrayList<String> ();
        for (Operator o : op.operands) names.add (flatten (o));
        return generator.digitalWire (integerFormat (op), String.join (" " + symbol + " ", names));
    }

    public String equal (EQ op)
    {
        throw new IllegalArgumentException ("An equation can't be assigned to a signal: " + op);
    }

    public String concatenate (Concatenate op)
    {
        if (op.operands.size () == 1) return flatten (op.operands.get (0));
        List<String> names = new ArrayList<String> ();
        for (Operator o : op.operands) names.add (flatten (o));
        return generator.digitalWire ((IntFormat) op.getFormat (), "{" + String.join (", ", names) + "}");
    }

    public String arraySelect (ArraySelect op)
    {
        return select (op, op.values, flatten (op.selector));
    }

    public String cases (Case op)
    {
        if (op.cases.size () == 1) return flatten (op.cases.get (0));
        return select (op, op.cases, flatten (Concatenate.of (op.selectors)));
    }

    /**
        Emits a combinational case statement that picks one of the values by address.
    **/
    protected String select (Operator table, List<Operator> values, String address)
    {
        List<String> entries = new ArrayList<String> (values.size ());
        String result = generator.nextName ();
        if (isReal (table))
        {
            List<String> names = new ArrayList<String> (values.size ());
            for (Operator v : values) names.add (flattenReal (v));

            double range = ((RealFormat) table.getFormat ()).range;
            if (Double.isInfinite (range)) generator.macroCall ("MAKE_REAL", result, VerilogGenerator.maxAnalogRange (names));
            else                           generator.macroCall ("MAKE_REAL", result, VerilogGenerator.real2str (range));
            for (int k = 0; k < names.size (); k++)
            {
                String entry = generator.reserve (result + "_" + k);
                generator.macroCall ("COPY_FORMAT_REAL", result, entry);
                generator.macroCall ("ASSIGN_REAL", names.get (k), entry);
                entries.add (entry);
            }
        }
        else
        {
            for (Operator v : values) entries.add (flatten (v));
            generator.writeln (VerilogGenerator.digitalType (integerFormat (table)) + " " + result + ";");
        }

        generator.alwaysBegin ("*");
        generator.writeln ("case (" + address + ")");
        generator.indent ();
        for (int k = 0; k < entries.size (); k++) generator.writeln (k + ": " + result + " = " + entries.get (k) + ";");
        generator.writeln ("default: " + result + " = 0;");
        generator.dedent ();
        generator.writeln ("endcase");
        generator.end ();
        return result;
    }
}
