/*
Copyright 2016-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.db;

import java.io.StringWriter;

/**
    A hierarchical key-value tree. Compiler settings are held in one of these,
    so that a backend can read its own sub-tree without the core knowing its keys.

    <p>Every node has a key, an optional value and an ordered list of children.
    A node with no value is "undefined", which reads the same as "" through get().
    Only data() tells the two apart. A path of keys addresses a node at any depth.
    Reading a path that doesn't exist yields "" or the given default, never null.
**/
public abstract class MNode implements Iterable<MNode>
{
    public abstract String key ();

    /**
        @return The value of this node, or null if undefined.
    **/
    public abstract String value ();

    /**
        Sets the value of this node. null makes it undefined.
    **/
    public abstract void set (String value);

    /**
        @return The immediate child with the given key, or null.
    **/
    protected abstract MNode getChild (String key);

    /**
        Sets the value of the immediate child with the given key, creating it if needed.
        @return The child.
    **/
    public abstract MNode set (String value, String key);

    public abstract int size ();

    /**
        Removes all children. The value of this node is unchanged.
    **/
    public abstract void clear ();

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    public boolean data ()
    {
        return value () != null;
    }

    public boolean data (String... keys)
    {
        MNode c = child (keys);
        return c != null  &&  c.data ();
    }

    /**
        @return The node at the end of the path, or null if any step is missing.
        An empty path gives this node.
    **/
    public synchronized MNode child (String... keys)
    {
        MNode result = this;
        for (int i = 0; i < keys.length  &&  result != null; i++) result = result.getChild (keys[i]);
        return result;
    }

    /**
        Like child(), but creates undefined nodes along the path wherever they are missing.
    **/
    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode next = result.getChild (key);
            if (next == null) next = result.set (null, key);
            result = next;
        }
        return result;
    }

    /**
        Like child(), but returns a detached empty node rather than null,
        so the caller can read from or iterate over it unconditionally.
    **/
    public MNode childOrEmpty (String... keys)
    {
        MNode result = child (keys);
        if (result == null) return new MVolatile ();
        return result;
    }

    public String get ()
    {
        String result = value ();
        if (result == null) return "";
        return result;
    }

    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        @return The value at the end of the path, or defaultValue if it is missing or "".
    **/
    public String getOrDefault (String defaultValue, String... keys)
    {
        String result = get (keys);
        if (result.isEmpty ()) return defaultValue;
        return result;
    }

    public boolean getOrDefault (boolean defaultValue, String... keys)
    {
        String result = get (keys).trim ();
        if (result.isEmpty ()) return defaultValue;
        return result.equals ("1")  ||  result.equalsIgnoreCase ("true");
    }

    /**
        Reads an integer. A value written as a float is rounded. Anything unparsable gives the default.
    **/
    public int getOrDefault (int defaultValue, String... keys)
    {
        String result = get (keys).trim ();
        if (result.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (result);
        }
        catch (NumberFormatException e)
        {
            return (int) Math.round (getOrDefault ((double) defaultValue, keys));
        }
    }

    public double getOrDefault (double defaultValue, String... keys)
    {
        String result = get (keys).trim ();
        if (result.isEmpty ()) return defaultValue;
        try
        {
            return Double.parseDouble (result);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    /**
        True only for "1" or "true". Missing is false.
    **/
    public boolean getBoolean (String... keys)
    {
        return getOrDefault (false, keys);
    }

    /**
        A flag is set by merely existing, unless its value is "0".
    **/
    public boolean getFlag (String... keys)
    {
        MNode c = child (keys);
        return c != null  &&  ! c.get ().equals ("0");
    }

    /**
        Sets the value at the end of the path, creating nodes as needed.
        Booleans are stored as "1" or "0". Other objects by their string form.
    **/
    public synchronized MNode set (Object value, String... keys)
    {
        String text = null;
        if      (value instanceof Boolean) text = (Boolean) value ? "1" : "0";
        else if (value != null)            text = value.toString ();
        MNode result = childOrCreate (keys);
        result.set (text);
        return result;
    }

    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        Schema.latest ().write (this, writer);
        return writer.toString ();
    }
}
