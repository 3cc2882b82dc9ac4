/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import gov.sandia.mixsig.eqset.DeclarationException;
import gov.sandia.mixsig.eqset.EquationSystem;
import gov.sandia.mixsig.eqset.InternalConsistencyException;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.eqset.SignalCatalog;
import gov.sandia.mixsig.eqset.SystemAnalysis;
import gov.sandia.mixsig.lds.Discretizer;
import gov.sandia.mixsig.lds.LdsCollection;
import gov.sandia.mixsig.lds.TransferFunction;
import gov.sandia.mixsig.language.Concatenate;
import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.EQ;
import gov.sandia.mixsig.language.operator.Multiply;
import gov.sandia.mixsig.language.type.Format;
import gov.sandia.mixsig.language.type.RealFormat;

/**
    A synchronous mixed-signal model under construction.
    Declare signals first, then define them with direct assignments, equation systems
    and transfer functions, and finally hand the model to a CodeGenerator.

    <p>Every signal that is not an input or output must receive exactly one assignment before
    compileModel(). Methods that add signals or assignments are synchronized, so only one
    equation system adds to a model at a time.
**/
public class MixedSignalModel
{
    public    String                 name;
    public    CompileSettings        settings;
    protected SignalCatalog          catalog     = new SignalCatalog ();
    protected Map<String,Assignment> assignments = new LinkedHashMap<String,Assignment> ();
    protected List<Signal>           probes      = new ArrayList<Signal> ();

    private static Logger logger = Logger.getLogger (MixedSignalModel.class);

    public MixedSignalModel (String name, Signal... ios)
    {
        this (name, new CompileSettings (), ios);
    }

    public MixedSignalModel (String name, CompileSettings settings, Signal... ios)
    {
        this.name     = name;
        this.settings = settings;
        for (Signal s : ios) addSignal (s);
    }

    // Signal declaration ---------------------------------------------------

    public synchronized Signal addSignal (Signal signal)
    {
        return catalog.add (signal);
    }

    public Signal addAnalogInput (String name)
    {
        return addSignal (Signal.analogInput (name));
    }

    public Signal addAnalogOutput (String name)
    {
        return addSignal (Signal.analogOutput (name, 0));
    }

    public Signal addAnalogOutput (String name, double init)
    {
        return addSignal (Signal.analogOutput (name, init));
    }

    public Signal addAnalogState (String name, double range)
    {
        return addAnalogState (name, range, null, null, 0);
    }

    public Signal addAnalogState (String name, double range, double init)
    {
        return addAnalogState (name, range, null, null, init);
    }

    public Signal addAnalogState (String name, double range, Integer width, Integer exponent, double init)
    {
        return addSignal (Signal.analogState (name, new RealFormat (range, width, exponent), init));
    }

    public Signal addDigitalInput (String name)
    {
        return addDigitalInput (name, 1, false);
    }

    public Signal addDigitalInput (String name, int width, boolean signed)
    {
        return addSignal (Signal.digitalInput (name, width, signed));
    }

    public Signal addDigitalOutput (String name, int width, boolean signed, double init)
    {
        return addSignal (Signal.digitalOutput (name, width, signed, init));
    }

    public Signal addDigitalState (String name, int width, boolean signed, double init)
    {
        return addSignal (Signal.digitalState (name, width, signed, init));
    }

    /**
        Declares an internal signal, which must later be defined by an assignment.
    **/
    public Signal addInternal (String name, Format format)
    {
        return addSignal (new Signal (name, format));
    }

    public boolean hasSignal (String name)
    {
        return catalog.contains (name);
    }

    /**
        @return The named signal, or null if it is not declared.
    **/
    public Signal findSignal (String name)
    {
        return catalog.find (name);
    }

    /**
        @throws DeclarationException if the name is not declared.
    **/
    public Signal getSignal (String name)
    {
        return catalog.get (name);
    }

    public SignalCatalog getCatalog ()
    {
        return catalog;
    }

    // Assignment -----------------------------------------------------------

    public synchronized void addAssignment (Assignment assignment)
    {
        Signal declared = checkAssignable (assignment.signal);
        if (assignment.timing == Assignment.Timing.BINDING  &&  declared.role.isIO ())
        {
            throw new DeclarationException ("The signal " + declared.name + " is a port and can't be bound to a name.");
        }
        assignments.put (declared.name, assignment);
        if (logger.isDebugEnabled ()) logger.debug ("Assign " + assignment);
    }

    /**
        @return The declared signal of the same name.
        @throws DeclarationException if the signal is undeclared, is an input, or already has an assignment.
    **/
    protected Signal checkAssignable (Signal s)
    {
        Signal declared = catalog.find (s.name);
        if (declared == null) throw new DeclarationException ("The signal " + s.name + " is assigned but has not been declared.");
        if (declared.role.isInput ()) throw new DeclarationException ("The signal " + s.name + " is an input and can't be assigned.");
        if (assignments.containsKey (s.name)) throw new DeclarationException ("The signal " + s.name + " has already been assigned.");
        return declared;
    }

    public void setThisCycle (Signal signal, Object expression)
    {
        addAssignment (new Assignment (signal, Operator.wrap (expression), Assignment.Timing.THIS_CYCLE));
    }

    public void setNextCycle (Signal signal, Object expression)
    {
        addAssignment (new Assignment (signal, Operator.wrap (expression), Assignment.Timing.NEXT_CYCLE));
    }

    /**
        Declares a new signal named after the given expression and defines it as that expression.
        The signal takes its format from the expression.
    **/
    public synchronized Signal bindName (String name, Object expression)
    {
        Operator e = Operator.wrap (expression);
        Signal result = addSignal (new Signal (name, e.getFormat ()));
        addAssignment (new Assignment (result, e, Assignment.Timing.BINDING));
        return result;
    }

    public boolean hasAssignment (String name)
    {
        return assignments.containsKey (name);
    }

    /**
        @return The assignment of the named signal, or null if it has none.
    **/
    public Assignment getAssignment (String name)
    {
        return assignments.get (name);
    }

    public Collection<Assignment> getAssignments ()
    {
        return Collections.unmodifiableCollection (assignments.values ());
    }

    public synchronized void addProbe (Signal signal)
    {
        if (! catalog.contains (signal.name)) throw new DeclarationException ("The signal " + signal.name + " is probed but has not been declared.");
        probes.add (signal);
    }

    // Equation systems -----------------------------------------------------

    public void addEqnSys (EQ... equations)
    {
        addEqnSys (new EquationSystem (equations), Collections.emptyList ());
    }

    public void addEqnSys (List<EQ> equations)
    {
        addEqnSys (new EquationSystem (equations), Collections.emptyList ());
    }

    public void addEqnSys (List<EQ> equations, List<?> extraOutputs)
    {
        addEqnSys (new EquationSystem (equations), extraOutputs);
    }

    /**
        Compiles the equation system and adds the resulting next-cycle assignments for its states
        and this-cycle assignments for its outputs.
        @param extraOutputs Additional signals to solve for. See SystemAnalysis.
        @return The collection of discrete systems, one per selector address.
    **/
    public synchronized LdsCollection addEqnSys (EquationSystem system, List<?> extraOutputs)
    {
        SystemAnalysis analysis = new SystemAnalysis (system, catalog, assignments.keySet (), extraOutputs);
        if (logger.isDebugEnabled ()) logger.debug ("Analysis: " + analysis);

        Discretizer discretizer = null;
        if (! analysis.states.isEmpty ()) discretizer = Discretizer.require (settings.getDt (), settings.getMethod ());

        SystemCompiler compiler = new SystemCompiler (system, analysis, discretizer, settings.isParallel ());
        LdsCollection collection = compiler.compile ();

        Operator selector = null;
        if (! analysis.selectors.isEmpty ()) selector = Concatenate.of (analysis.selectors);

        List<Object> inputTerms = new ArrayList<Object> (analysis.inputs);
        if (compiler.offset) inputTerms.add (new Constant (1));
        addDiscreteTimeLds (collection, inputTerms, analysis.states, analysis.outputs, selector);
        return collection;
    }

    /**
        Adds assignments that realize a collection of discrete systems.
        States receive next-cycle assignments. Outputs receive this-cycle assignments, except that
        an output with no declaration is bound as a new signal, and an output that already carries a
        binding has the new term added to that binding.
        @param inputs Signals or expressions, one per input column of the collection.
        @param selector Address of the active case, MSB first. May be null if the collection has one entry.
    **/
    public synchronized void addDiscreteTimeLds (LdsCollection collection, List<?> inputs, List<Signal> states, List<Signal> outputs, Operator selector)
    {
        List<Operator> stateTerms = Operator.wrap (states);
        List<Operator> inputTerms = Operator.wrap (inputs);
        if (outputs.size () != collection.numOutputs ()) throw new InternalConsistencyException ("Collection has " + collection.numOutputs () + " outputs but " + outputs.size () + " were given.");
        ModelAssembler assembler = new ModelAssembler (collection, stateTerms, inputTerms, selector);

        for (int r = 0; r < states.size (); r++) setNextCycle (states.get (r), assembler.stateUpdate (r));

        for (int r = 0; r < outputs.size (); r++)
        {
            Signal   output = outputs.get (r);
            Operator expr   = assembler.outputUpdate (r);
            Assignment existing = assignments.get (output.name);
            if (existing != null  &&  existing.timing == Assignment.Timing.BINDING)
            {
                Operator merged = Add.make (existing.expression, expr);
                assignments.put (output.name, new Assignment (existing.signal, merged, Assignment.Timing.BINDING));
                if (logger.isDebugEnabled ()) logger.debug ("Merged into binding " + output.name);
            }
            else if (catalog.contains (output.name))
            {
                setThisCycle (catalog.get (output.name), expr);
            }
            else
            {
                bindName (output.name, expr);
            }
        }
    }

    // Transfer functions ---------------------------------------------------

    /**
        Implements output = H(s) input, where H is given by numerator and denominator coefficients,
        highest power first. The function is discretized at the model's sample interval and realized
        as a difference equation over delay chains of the input and output.
    **/
    public synchronized void setTf (Signal input, Signal output, double[] numerator, double[] denominator)
    {
        Discretizer discretizer = Discretizer.require (settings.getDt (), settings.getMethod ());
        TransferFunction tf = new TransferFunction (numerator, denominator).discretize (discretizer);
        int n = tf.order ();

        // Nothing is added to the model until every check below has passed.
        if (input.name.equals (output.name)) throw new DeclarationException ("The transfer function " + input.name + " feeds its own input.");
        if (! catalog.contains (input.name)) throw new DeclarationException ("The signal " + input.name + " is used but has not been declared.");
        checkAssignable (output);
        boolean strictlyProper = n > 0  &&  tf.isStrictlyProper ();
        int length = strictlyProper ? n : n + 1;
        checkHistory (input,  length);
        checkHistory (output, length);
        logger.info ("Transfer function " + input.name + " -> " + output.name + ": " + tf);

        List<Operator> terms = new ArrayList<Operator> ();
        if (strictlyProper)
        {
            // y[k+1] = sum_{j>=1} b_j x[k+1-j] - sum_{j>=1} a_j y[k+1-j]
            List<Signal> x = makeHistory (input,  n);
            List<Signal> y = makeHistory (output, n);
            for (int j = 1; j <= n; j++)
            {
                terms.add (Multiply.make (new Constant ( tf.num[j]), x.get (j - 1).access ()));
                terms.add (Multiply.make (new Constant (-tf.den[j]), y.get (j - 1).access ()));
            }
            setNextCycle (output, Add.make (terms));
        }
        else
        {
            // y[k] = sum_{j>=0} b_j x[k-j] - sum_{j>=1} a_j y[k-j]
            List<Signal> x = makeHistory (input,  n + 1);
            List<Signal> y = makeHistory (output, n + 1);
            terms.add (Multiply.make (new Constant (tf.num[0]), x.get (0).access ()));
            for (int j = 1; j <= n; j++)
            {
                terms.add (Multiply.make (new Constant ( tf.num[j]), x.get (j).access ()));
                terms.add (Multiply.make (new Constant (-tf.den[j]), y.get (j).access ()));
            }
            setThisCycle (output, Add.make (terms));
        }
    }

    /**
        Builds a delay chain behind the given signal.
        Element 0 is the signal itself. Element k is a new signal named first_k, which takes
        the value of element k-1 at each clock edge.
    **/
    public synchronized List<Signal> makeHistory (Signal first, int length)
    {
        List<Signal> result = new ArrayList<Signal> (length);
        if (length <= 0) return result;
        checkHistory (first, length);
        result.add (first);
        for (int k = 1; k < length; k++)
        {
            Signal tap = addSignal (first.derive (first.name + "_" + k));
            setNextCycle (tap, result.get (k - 1).access ());
            result.add (tap);
        }
        return result;
    }

    /**
        @throws DeclarationException if any tap of a delay chain of the given length would reuse a declared name.
    **/
    protected void checkHistory (Signal first, int length)
    {
        for (int k = 1; k < length; k++)
        {
            String tap = first.name + "_" + k;
            if (catalog.contains (tap)) throw new DeclarationException ("The delay tap " + tap + " is already declared.");
        }
    }

    // Emission -------------------------------------------------------------

    /**
        Emits the finished model. Nothing is persisted unless every assignment was emitted without error.
    **/
    public synchronized void compileModel (CodeGenerator generator) throws IOException
    {
        String moduleName = settings.getModuleName (name);
        logger.info ("Compiling model " + moduleName + ": " + catalog.size () + " signals, " + assignments.size () + " assignments");

        List<Signal> ios       = new ArrayList<Signal> ();
        List<Signal> internals = new ArrayList<Signal> ();
        List<String> names     = new ArrayList<String> ();
        for (Signal s : catalog.all ())
        {
            names.add (s.name);
            if (s.role.isIO ())
            {
                ios.add (s);
                continue;
            }
            Assignment a = assignments.get (s.name);
            if (a == null) throw new DeclarationException ("The signal " + s.name + " has not been assigned.");
            if (a.timing != Assignment.Timing.BINDING) internals.add (s);
        }

        Namer namer = new Namer ("tmp", names);
        generator.configure (settings.getGenerator (generator.getName ()));
        generator.startModule (moduleName, ios, namer);

        if (! internals.isEmpty ()) generator.makeSection ("Declaring internal variables.");
        for (Signal s : internals) generator.makeSignal (s);

        for (Assignment a : assignments.values ())
        {
            generator.makeSection ("Assign signal: " + a.signal.name);
            switch (a.timing)
            {
                case THIS_CYCLE: generator.setThisCycle (a.signal, a.expression);                break;
                case NEXT_CYCLE: generator.setNextCycle (a.signal, a.expression, a.signal.init); break;
                case BINDING:    generator.bindName     (a.signal, a.expression);                break;
                default: throw new InternalConsistencyException ("Invalid timing " + a.timing + " for signal " + a.signal.name);
            }
        }

        for (Signal s : probes) generator.makeProbe (s);
        generator.endModule ();
        generator.persist ();
        logger.info ("Finished model " + moduleName);
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append (name).append (Arrays.asList (catalog.all ().toArray ())).append ("\n");
        for (Assignment a : assignments.values ()) result.append ("  ").append (a).append ("\n");
        return result.toString ();
    }
}
