/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
    Classifies the signals of an equation system relative to the model that holds it.
    The four lists are disjoint except that a selector bit which also appears in arithmetic
    is listed both as a selector and as an input. Each list is in catalog declaration order.
**/
public class SystemAnalysis
{
    public List<Signal> inputs;
    public List<Signal> states;
    public List<Signal> outputs;
    public List<Signal> selectors;

    private static Logger logger = Logger.getLogger (SystemAnalysis.class);

    public SystemAnalysis (EquationSystem system, SignalCatalog catalog, Set<String> assigned)
    {
        this (system, catalog, assigned, Collections.emptyList ());
    }

    /**
        @param assigned Names of signals that already carry an assignment in the model.
        These are treated as known values, the same as declared inputs.
        @param extraOutputs Additional values to solve for. Entries that are not signals,
        or that are already classified, are skipped with a warning. Signals listed here
        need not be declared in the catalog.
    **/
    public SystemAnalysis (EquationSystem system, SignalCatalog catalog, Set<String> assigned, Collection<?> extraOutputs)
    {
        Map<String,Signal> referenced  = system.getSignals ();
        Map<String,Signal> derivatives = system.getDerivatives ();
        Map<String,Signal> selected    = system.getSelectors ();

        List<String> extraNames = new ArrayList<String> ();
        for (Object o : extraOutputs) if (o instanceof Signal) extraNames.add (((Signal) o).name);

        // Every reference must resolve before any other work.
        for (String name : referenced.keySet ())
        {
            if (! catalog.contains (name)  &&  ! extraNames.contains (name)) throw new DeclarationException ("The signal " + name + " is used in an equation but has not been declared.");
        }
        for (String name : selected.keySet ())
        {
            if (! catalog.contains (name)) throw new DeclarationException ("The selector " + name + " is used in a case table but has not been declared.");
        }

        inputs    = new ArrayList<Signal> ();
        states    = new ArrayList<Signal> ();
        outputs   = new ArrayList<Signal> ();
        selectors = new ArrayList<Signal> ();
        for (Signal s : catalog.all ())
        {
            String name = s.name;
            if (selected.containsKey (name)) selectors.add (s);
            if (derivatives.containsKey (name))
            {
                if (s.role.isInput ()  ||  assigned.contains (name)) throw new AnalysisException ("The signal " + name + " appears under a derivative, but it is an input or already assigned.");
                states.add (s);
                continue;
            }
            if (! referenced.containsKey (name)) continue;
            if (s.role.isInput ()  ||  assigned.contains (name)) inputs .add (s);
            else if (! selected.containsKey (name))              outputs.add (s);
        }

        for (Object o : extraOutputs)
        {
            if (! (o instanceof Signal))
            {
                logger.warn ("Skipping extra output " + o + " since it is not a signal.");
                continue;
            }
            Signal s = (Signal) o;
            if (contains (outputs, s.name))
            {
                logger.warn ("Skipping extra output " + s.name + " since it is already an output of the system.");
                continue;
            }
            if (contains (inputs, s.name)  ||  contains (states, s.name))
            {
                logger.warn ("Skipping extra output " + s.name + " since it is already an input or state of the system.");
                continue;
            }
            outputs.add (s);
        }
    }

    public static boolean contains (List<Signal> list, String name)
    {
        for (Signal s : list) if (s.name.equals (name)) return true;
        return false;
    }

    public String toString ()
    {
        return "inputs=" + inputs + " states=" + states + " outputs=" + outputs + " selectors=" + selectors;
    }
}
