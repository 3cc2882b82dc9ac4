/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.model;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.mixsig.eqset.InternalConsistencyException;
import gov.sandia.mixsig.lds.LdsCollection;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.Multiply;

/**
    Turns an address-indexed collection of discrete systems into update expressions.
    Each coefficient becomes a table over all addresses, indexed by the selector.
    A table with a single entry is just that entry, and a table of all zeros is left out.
**/
public class ModelAssembler
{
    protected LdsCollection  collection;
    protected List<Operator> stateTerms;
    protected List<Operator> inputTerms;
    protected Operator       selector;

    /**
        @param stateTerms One expression per state column of the collection, usually a reference to the state signal.
        @param inputTerms One expression per input column. A constant 1 here carries offsets.
        @param selector Address of the current case. May be null if the collection has a single entry.
    **/
    public ModelAssembler (LdsCollection collection, List<Operator> stateTerms, List<Operator> inputTerms, Operator selector)
    {
        if (collection.size () == 0) throw new InternalConsistencyException ("Nothing to assemble: the collection is empty.");
        if (collection.size () > 1  &&  selector == null) throw new InternalConsistencyException ("A collection with " + collection.size () + " entries needs a selector.");
        if (stateTerms.size () != collection.numStates ()) throw new InternalConsistencyException ("Collection has " + collection.numStates () + " states but " + stateTerms.size () + " were given.");
        if (inputTerms.size () != collection.numInputs ()) throw new InternalConsistencyException ("Collection has " + collection.numInputs () + " inputs but " + inputTerms.size () + " were given.");
        this.collection = collection;
        this.stateTerms = stateTerms;
        this.inputTerms = inputTerms;
        this.selector   = selector;
    }

    /**
        @return The next value of the state at the given row: sum_c A[row][c]*state_c + sum_i B[row][i]*input_i
    **/
    public Operator stateUpdate (int row)
    {
        List<Operator> terms = new ArrayList<Operator> ();
        for (int c = 0; c < stateTerms.size (); c++) addTerm (terms, collection.getA (row, c), stateTerms.get (c));
        for (int i = 0; i < inputTerms.size (); i++) addTerm (terms, collection.getB (row, i), inputTerms.get (i));
        return Add.make (terms);
    }

    /**
        @return The value of the output at the given row: sum_c C[row][c]*state_c + sum_i D[row][i]*input_i
    **/
    public Operator outputUpdate (int row)
    {
        List<Operator> terms = new ArrayList<Operator> ();
        for (int c = 0; c < stateTerms.size (); c++) addTerm (terms, collection.getC (row, c), stateTerms.get (c));
        for (int i = 0; i < inputTerms.size (); i++) addTerm (terms, collection.getD (row, i), inputTerms.get (i));
        return Add.make (terms);
    }

    protected void addTerm (List<Operator> terms, double[] coefficients, Operator factor)
    {
        if (ArraySelect.allZero (coefficients)) return;
        terms.add (Multiply.make (ArraySelect.make (coefficients, selector), factor));
    }
}
