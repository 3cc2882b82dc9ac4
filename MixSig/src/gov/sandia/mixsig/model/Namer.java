/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.mixsig.eqset.DeclarationException;

/**
    Issues fresh names that collide with nothing already taken.
    One namer serves one compilation session. It is passed explicitly to whoever needs fresh names,
    so independent sessions never share a counter.
**/
public class Namer
{
    protected Set<String> taken = new HashSet<String> ();
    protected String      prefix;
    protected int         next;

    private static Logger logger = Logger.getLogger (Namer.class);

    public Namer ()
    {
        this ("tmp");
    }

    public Namer (String prefix)
    {
        this.prefix = prefix;
    }

    public Namer (String prefix, Collection<String> reserved)
    {
        this (prefix);
        taken.addAll (reserved);
    }

    /**
        Reserves a specific name.
    **/
    public void addName (String name)
    {
        if (! taken.add (name)) throw new DeclarationException ("The name " + name + " is already taken.");
    }

    public boolean isTaken (String name)
    {
        return taken.contains (name);
    }

    public String next ()
    {
        return next (prefix);
    }

    public String next (String prefix)
    {
        String result;
        do
        {
            result = prefix + next++;
        }
        while (taken.contains (result));
        taken.add (result);
        if (logger.isDebugEnabled ()) logger.debug ("Issued name " + result);
        return result;
    }
}
