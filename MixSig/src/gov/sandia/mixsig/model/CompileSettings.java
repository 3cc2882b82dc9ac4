/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

import gov.sandia.mixsig.db.MNode;
import gov.sandia.mixsig.db.MVolatile;
import gov.sandia.mixsig.db.Schema;
import gov.sandia.mixsig.lds.Discretizer;
import gov.sandia.mixsig.lds.DiscretizationException;
import gov.sandia.mixsig.language.UnitValue;

/**
    Compiler settings, held in an MNode tree. Recognized keys:
    <dl>
    <dt>dt</dt><dd>Sample interval, with optional time unit, for example "1ms". Plain numbers are seconds.</dd>
    <dt>module</dt><dd>Name of the generated module. Overrides the model name.</dd>
    <dt>parallel</dt><dd>"1" to resolve, extract and discretize the selector addresses concurrently.</dd>
    <dt>discretize</dt><dd>"exact" (default) or "solve". See Discretizer.Method.</dd>
    </dl>
    Each code generator reads its own sub-tree, keyed by its name.
**/
public class CompileSettings
{
    public MNode node;

    public CompileSettings ()
    {
        this (new MVolatile ());
    }

    public CompileSettings (MNode node)
    {
        this.node = node;
    }

    public static CompileSettings read (Reader reader) throws IOException
    {
        MNode node = new MVolatile ();
        Schema.readAll (node, reader);
        return new CompileSettings (node);
    }

    public static CompileSettings load (Path path) throws IOException
    {
        try (Reader reader = Files.newBufferedReader (path))
        {
            return read (reader);
        }
    }

    /**
        @return The sample interval in seconds, or null if none was given.
        @throws DiscretizationException if dt is present but malformed, not a time, or not positive.
    **/
    public Double getDt ()
    {
        String value = node.get ("dt").trim ();
        if (value.isEmpty ()) return null;
        UnitValue uv;
        try
        {
            uv = new UnitValue (value);
        }
        catch (IllegalArgumentException e)  // includes NumberFormatException
        {
            throw new DiscretizationException ("Can't parse sample interval dt=" + value, e);
        }
        if (! uv.isTime ()) throw new DiscretizationException ("Sample interval dt=" + value + " is not a time.");
        double result = uv.get ();
        if (! (result > 0)  ||  Double.isInfinite (result)) throw new DiscretizationException ("Sample interval dt must be positive, not " + value);
        return result;
    }

    public void setDt (double dt)
    {
        node.set (dt, "dt");
    }

    public void setDt (String dt)
    {
        node.set (dt, "dt");
    }

    public String getModuleName (String defaultName)
    {
        return node.getOrDefault (defaultName, "module");
    }

    public boolean isParallel ()
    {
        return node.getBoolean ("parallel");
    }

    public Discretizer.Method getMethod ()
    {
        return Discretizer.Method.parse (node.get ("discretize"));
    }

    /**
        @return Settings sub-tree for the named code generator. Empty if none were given.
    **/
    public MNode getGenerator (String name)
    {
        return node.childOrEmpty (name);
    }
}
