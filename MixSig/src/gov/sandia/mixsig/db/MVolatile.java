/*
Copyright 2016-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.db;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
    In-memory node. Children keep the order in which they were first set,
    which for a settings file is the order they were written.
**/
public class MVolatile extends MNode
{
    protected String             name;
    protected String             value;
    protected Map<String,MNode>  children;

    public MVolatile ()
    {
    }

    public MVolatile (String value, String name)
    {
        this.name  = name;
        this.value = value;
    }

    public String key ()
    {
        if (name == null) return "";
        return name;
    }

    public synchronized String value ()
    {
        return value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    protected synchronized MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new LinkedHashMap<String,MNode> ();
        MNode result = children.get (key);
        if (result == null)
        {
            result = new MVolatile (value, key);
            children.put (key, result);
        }
        else
        {
            result.set (value);
        }
        return result;
    }

    public synchronized int size ()
    {
        if (children == null) return 0;
        return children.size ();
    }

    public synchronized void clear ()
    {
        children = null;
    }

    /**
        Iterates over a snapshot of the children, so the tree may be changed while iterating.
    **/
    public synchronized Iterator<MNode> iterator ()
    {
        if (children == null) return new ArrayList<MNode> ().iterator ();
        return new ArrayList<MNode> (children.values ()).iterator ();
    }
}
