/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.language;

/**
    Accumulates the text form of an expression for log messages and error reports.
    A subclass may take over the rendering of selected nodes.
**/
public class Renderer
{
    public StringBuilder result;

    public Renderer ()
    {
        result = new StringBuilder ();
    }

    public Renderer (StringBuilder result)
    {
        this.result = result;
    }

    /**
        @return true if the node was written here, false to let the node write itself.
    **/
    public boolean render (Operator op)
    {
        return false;
    }
}
