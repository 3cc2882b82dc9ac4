/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.io.IOException;
import java.util.List;

import gov.sandia.mixsig.db.MNode;
import gov.sandia.mixsig.eqset.Signal;
import gov.sandia.mixsig.language.Operator;

/**
    Renders a compiled model as text for some hardware description target.
    MixedSignalModel.compileModel() calls these methods in a fixed order:
    <ol>
    <li>startModule()
    <li>makeSignal() for each internal signal, after a section marker
    <li>for each assignment in declaration order, a section marker followed by
        setThisCycle(), setNextCycle() or bindName()
    <li>makeProbe() for each probe
    <li>endModule()
    <li>persist()
    </ol>
    persist() is reached only if every earlier step succeeded.
**/
public abstract class CodeGenerator
{
    public    String        tab        = "    ";
    public    String        lineEnding = "\n";
    protected int           tabLevel;
    protected StringBuilder text       = new StringBuilder ();
    protected Namer         namer;

    /**
        Key of the settings sub-tree this generator reads.
    **/
    public String getName ()
    {
        return getClass ().getSimpleName ();
    }

    /**
        Picks up generator-specific settings. The base class reads only the indent string.
        @param settings The sub-tree for this generator, never null.
    **/
    public void configure (MNode settings)
    {
        tab = settings.getOrDefault (tab, "tab");
    }

    public void indent ()
    {
        tabLevel++;
    }

    public void dedent ()
    {
        if (tabLevel == 0) throw new IllegalStateException ("Unbalanced indentation.");
        tabLevel--;
    }

    public void write (String string)
    {
        text.append (string);
    }

    public void writeln ()
    {
        writeln ("");
    }

    public void writeln (String line)
    {
        for (int i = 0; i < tabLevel; i++) text.append (tab);
        text.append (line);
        text.append (lineEnding);
    }

    public String getText ()
    {
        return text.toString ();
    }

    /**
        @param namer Source of fresh names for this session. Already holds the name of every declared signal.
    **/
    public abstract void startModule (String name, List<Signal> ios, Namer namer);

    /// Advisory label for traceability. Has no effect on behavior.
    public abstract void makeSection (String label);

    public abstract void makeSignal (Signal signal);

    public abstract void setThisCycle (Signal signal, Operator expression);

    public abstract void setNextCycle (Signal signal, Operator expression, double init);

    public abstract void bindName (Signal signal, Operator expression);

    public abstract void makeProbe (Signal signal);

    public abstract void endModule ();

    /**
        Stores the finished artifact.
    **/
    public abstract void persist () throws IOException;
}
