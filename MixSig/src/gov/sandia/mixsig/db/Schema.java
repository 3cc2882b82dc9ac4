/*
Copyright 2017-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
    Text serialization of an MNode tree. The first line of a file is a header of the form
    <pre>MixSig.schema=1</pre>
    optionally followed by ",type". Everything after that is one "key:value" per line,
    with children indented one space deeper than their parent. A value of "|" starts a
    block of text that continues through all following lines indented deeper than the key.
    Blank lines inside a block belong to it. Blank lines at its end do not.
    A key that contains a colon, or starts with a quote, is wrapped in quotes, with a quote
    inside it written twice.
**/
public class Schema
{
    public static final String HEADER = "MixSig.schema";

    public int    version;
    public String type;

    public Schema (int version, String type)
    {
        this.version = version;
        this.type    = type;
    }

    public static Schema latest ()
    {
        return new Schema (1, "");
    }

    /**
        Reads the header, then loads everything after it as children of the given node.
        The reader is left open.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        BufferedReader br;
        if (reader instanceof BufferedReader) br = (BufferedReader) reader;
        else                                  br = new BufferedReader (reader);
        Schema result = readHeader (br.readLine ());
        result.read (node, br);
        return result;
    }

    public static Schema readHeader (String line) throws IOException
    {
        if (line == null) throw new IOException ("Settings file is empty.");
        line = line.trim ();
        if (! line.startsWith (HEADER + "=")) throw new IOException ("Expected a " + HEADER + " header line, but found: " + line);

        String[] pieces = line.substring (HEADER.length () + 1).split (",", 2);
        int version;
        try
        {
            version = Integer.parseInt (pieces[0].trim ());
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Malformed schema version: " + pieces[0], e);
        }
        if (version != 1) throw new IOException ("Unsupported schema version " + version);
        return new Schema (version, pieces.length > 1 ? pieces[1].trim () : "");
    }

    /**
        Replaces the children of the node with the entries in the stream.
        The value of the node itself is untouched.
    **/
    public void read (MNode node, Reader reader) throws IOException
    {
        node.clear ();
        Lines lines = new Lines (reader);
        if (lines.line != null) readChildren (node, lines, lines.indent);
    }

    /**
        Reads sibling entries at the given indent, descending into deeper lines as children.
        Returns at end of input or at the first line indented less than this level.
    **/
    protected void readChildren (MNode parent, Lines lines, int indent) throws IOException
    {
        while (lines.line != null  &&  lines.indent >= indent)
        {
            String   text = lines.line.trim ();
            String[] kv   = splitKey (text);
            String   key  = kv[0];
            String   value = kv[1];
            lines.next ();

            if (value != null  &&  value.startsWith ("|")) value = readBlock (lines, indent);

            MNode child = parent.set (value, key);
            if (lines.line != null  &&  lines.indent > indent) readChildren (child, lines, lines.indent);
        }
    }

    /**
        Collects every following line indented deeper than the owning key, with the common indent removed.
    **/
    protected String readBlock (Lines lines, int ownerIndent) throws IOException
    {
        StringBuilder result = new StringBuilder ();
        if (lines.line == null  ||  lines.indent <= ownerIndent) return "";
        int blockIndent = lines.indent;
        boolean first = true;
        while (lines.line != null  &&  lines.indent >= blockIndent)
        {
            if (! first) for (int i = 0; i <= lines.blanks; i++) result.append ("\n");
            first = false;
            result.append (lines.line.substring (blockIndent));
            lines.next ();
        }
        return result.toString ();
    }

    /**
        Separates a trimmed line into key and value. The value is null if there is no colon.
    **/
    public static String[] splitKey (String text)
    {
        StringBuilder key = new StringBuilder ();
        int i = 0;
        int length = text.length ();
        if (length > 0  &&  text.charAt (0) == '"')
        {
            for (i = 1; i < length; i++)
            {
                char c = text.charAt (i);
                if (c == '"')
                {
                    if (i + 1 < length  &&  text.charAt (i + 1) == '"')
                    {
                        key.append ('"');
                        i++;
                        continue;
                    }
                    i++;
                    break;
                }
                key.append (c);
            }
        }
        int colon = text.indexOf (':', i);
        if (colon < 0)
        {
            key.append (text.substring (i));
            return new String[] {key.toString ().trim (), null};
        }
        key.append (text, i, colon);
        return new String[] {key.toString ().trim (), text.substring (colon + 1).trim ()};
    }

    public static String quoteKey (String key)
    {
        if (key.isEmpty ()  ||  key.startsWith ("\"")  ||  key.contains (":")) return "\"" + key.replace ("\"", "\"\"") + "\"";
        return key;
    }

    /**
        Writes the header, then each child of the node. The node itself is only a container.
    **/
    public void writeAll (MNode node, Writer writer) throws IOException
    {
        writer.write (HEADER + "=" + version);
        if (! type.isEmpty ()) writer.write ("," + type);
        writer.write ("\n");
        for (MNode c : node) write (c, writer, "");
    }

    /**
        Writes the node and its subtree, for diagnostic display.
    **/
    public void write (MNode node, Writer writer)
    {
        try
        {
            write (node, writer, "");
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);
        }
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        writer.write (indent);
        writer.write (quoteKey (node.key ()));
        if (node.data ())
        {
            String value = node.get ();
            writer.write (":");
            if (value.contains ("\n")  ||  value.startsWith ("|"))
            {
                String inner = indent + " ";
                writer.write ("|\n" + inner + value.replace ("\n", "\n" + inner));
            }
            else
            {
                writer.write (value);
            }
        }
        writer.write ("\n");
        for (MNode c : node) write (c, writer, indent + " ");
    }

    /**
        Cursor over the non-blank lines of a stream, with the indent of the current line
        and the number of blank lines skipped to reach it.
    **/
    public static class Lines
    {
        public BufferedReader reader;
        public String         line;    // null at end of input
        public int            indent;
        public int            blanks;

        public Lines (Reader reader) throws IOException
        {
            if (reader instanceof BufferedReader) this.reader = (BufferedReader) reader;
            else                                  this.reader = new BufferedReader (reader);
            next ();
        }

        public void next () throws IOException
        {
            blanks = 0;
            while (true)
            {
                line = reader.readLine ();
                if (line == null  ||  ! line.trim ().isEmpty ()) break;
                blanks++;
            }

            indent = 0;
            if (line == null) return;
            while (indent < line.length ()  &&  line.charAt (indent) == ' ') indent++;
        }
    }
}
