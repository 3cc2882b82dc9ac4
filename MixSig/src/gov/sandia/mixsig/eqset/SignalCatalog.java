/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
    Registry of declared signals, keyed by name and kept in declaration order.
    Not thread-safe. Only one equation system may add to a given catalog at a time.
**/
public class SignalCatalog
{
    protected Map<String,Signal> signals = new LinkedHashMap<String,Signal> ();

    public Signal add (Signal signal)
    {
        if (signals.containsKey (signal.name)) throw new DeclarationException ("The signal " + signal.name + " has already been declared.");
        signals.put (signal.name, signal);
        return signal;
    }

    public boolean contains (String name)
    {
        return signals.containsKey (name);
    }

    /**
        @return The signal with the given name, or null if it is not declared.
    **/
    public Signal find (String name)
    {
        return signals.get (name);
    }

    /**
        Same as find(), but treats an unknown name as an error.
    **/
    public Signal get (String name)
    {
        Signal result = signals.get (name);
        if (result == null) throw new DeclarationException ("The signal " + name + " has not been declared.");
        return result;
    }

    /// All signals in declaration order.
    public Collection<Signal> all ()
    {
        return Collections.unmodifiableCollection (signals.values ());
    }

    public int size ()
    {
        return signals.size ();
    }
}
