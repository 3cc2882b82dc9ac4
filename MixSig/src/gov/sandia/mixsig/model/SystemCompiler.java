/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import gov.sandia.mixsig.eqset.Cases;
import gov.sandia.mixsig.eqset.EquationSystem;
import gov.sandia.mixsig.eqset.InternalConsistencyException;
import gov.sandia.mixsig.eqset.LinearExtractor;
import gov.sandia.mixsig.eqset.SystemAnalysis;
import gov.sandia.mixsig.lds.Discretizer;
import gov.sandia.mixsig.lds.LdsCollection;
import gov.sandia.mixsig.lds.LinearDynamicalSystem;

/**
    Builds the LdsCollection of one equation system: for each selector address in ascending order,
    resolve the case tables, extract the linear system, and discretize it.
    The addresses are independent of each other, so they may be processed on separate threads.
    The collection is always filled in address order.
**/
public class SystemCompiler
{
    protected EquationSystem  system;
    protected SystemAnalysis  analysis;
    protected Discretizer     discretizer;  // null if the system has no states
    protected boolean         parallel;

    public LdsCollection collection;
    public boolean       offset;  // The collection carries a trailing input column for constant terms.

    private static Logger logger = Logger.getLogger (SystemCompiler.class);

    public SystemCompiler (EquationSystem system, SystemAnalysis analysis, Discretizer discretizer, boolean parallel)
    {
        this.system      = system;
        this.analysis    = analysis;
        this.discretizer = discretizer;
        this.parallel    = parallel;
    }

    public int addressCount ()
    {
        return 1 << analysis.selectors.size ();
    }

    public LdsCollection compile ()
    {
        final int count = addressCount ();
        logger.info ("Compiling equation system with " + analysis.selectors.size () + " selector bits (" + count + " addresses), "
                     + analysis.inputs.size () + " inputs, " + analysis.states.size () + " states, " + analysis.outputs.size () + " outputs");

        final LinearExtractor extractor = new LinearExtractor (analysis.inputs, analysis.states, analysis.outputs);

        // Phase 1: resolve and expand every address.
        final LinearExtractor.Expansion[] expansions = new LinearExtractor.Expansion[count];
        runAll (count, new Task ()
        {
            public void run (int address)
            {
                Map<String,Integer> settings = Cases.addressToSettings (address, analysis.selectors);
                EquationSystem resolved = system.substitute (settings);
                expansions[address] = extractor.expand (resolved);
            }
        });

        // All addresses must agree on the input count, so the offset column is all or nothing.
        offset = false;
        for (LinearExtractor.Expansion e : expansions) if (e.hasOffset ()) offset = true;

        // Phase 2: solve and discretize.
        final LinearDynamicalSystem[] results = new LinearDynamicalSystem[count];
        runAll (count, new Task ()
        {
            public void run (int address)
            {
                LinearDynamicalSystem lds = extractor.solve (expansions[address], offset);
                if (lds.numStates () == 0) lds = new LinearDynamicalSystem (lds.A, lds.B, lds.C, lds.D, true);
                else                       lds = discretizer.discretize (lds);
                results[address] = lds;
                if (logger.isDebugEnabled ()) logger.debug ("Address " + address + ": " + lds.shape ());
            }
        });

        collection = new LdsCollection ();
        for (int a = 0; a < count; a++) collection.append (a, results[a]);
        logger.info ("Finished equation system: collection of " + collection.size () + " systems" + (offset ? " with offset column" : ""));
        return collection;
    }

    public interface Task
    {
        public void run (int address);
    }

    /**
        Executes the task for every address, either in sequence or on worker threads.
        Workers run in batches no larger than the processor count.
        The first error in address order is rethrown. An Error from a worker comes back
        wrapped in an InternalConsistencyException.
    **/
    protected void runAll (int count, final Task task)
    {
        if (! parallel  ||  count == 1)
        {
            for (int a = 0; a < count; a++) task.run (a);
            return;
        }

        int batch = Math.max (1, Runtime.getRuntime ().availableProcessors ());
        for (int first = 0; first < count; first += batch)
        {
            int last = Math.min (count, first + batch);
            List<ThreadTrap> threads = new ArrayList<ThreadTrap> (last - first);
            for (int a = first; a < last; a++)
            {
                ThreadTrap t = new ThreadTrap (task, a);
                t.setDaemon (true);
                t.start ();
                threads.add (t);
            }
            Throwable error   = null;
            int       address = 0;
            for (ThreadTrap t : threads)
            {
                try
                {
                    t.join ();
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread ().interrupt ();
                    throw new InternalConsistencyException ("Interrupted while compiling address " + t.address, e);
                }
                if (error == null  &&  t.error != null)
                {
                    error   = t.error;
                    address = t.address;
                }
            }
            if (error instanceof RuntimeException) throw (RuntimeException) error;
            if (error != null) throw new InternalConsistencyException ("Failed while compiling address " + address + ": " + error, error);
        }
    }

    /**
        Runs one address and keeps anything it throws for the caller to rethrow.
    **/
    public static class ThreadTrap extends Thread
    {
        protected Task      task;
        protected int       address;
        protected Throwable error;

        public ThreadTrap (Task task, int address)
        {
            super ("MixSig address " + address);
            this.task    = task;
            this.address = address;
        }

        public void run ()
        {
            try
            {
                task.run (address);
            }
            catch (Throwable e)
            {
                error = e;
            }
        }
    }
}
