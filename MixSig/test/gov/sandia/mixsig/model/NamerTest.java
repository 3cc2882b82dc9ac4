/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import gov.sandia.mixsig.eqset.DeclarationException;

public class NamerTest
{
    @Test
    public void testFresh ()
    {
        Namer namer = new Namer ("tmp", Arrays.asList ("tmp0", "tmp2"));
        assertEquals ("tmp1", namer.next ());
        assertEquals ("tmp3", namer.next ());
        assertTrue (namer.isTaken ("tmp3"));
        assertEquals ("x4", namer.next ("x"));
    }

    @Test
    public void testIndependentSessions ()
    {
        assertEquals ("tmp0", new Namer ().next ());
        assertEquals ("tmp0", new Namer ().next ());
    }

    @Test
    public void testAddName ()
    {
        Namer namer = new Namer ();
        namer.addName ("tmp0");
        assertEquals ("tmp1", namer.next ());
        try
        {
            namer.addName ("tmp1");
            fail ("tmp1 was already issued");
        }
        catch (DeclarationException e) {}
    }
}
