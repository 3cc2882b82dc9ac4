/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.mixsig.eqset;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gov.sandia.mixsig.lds.LinearDynamicalSystem;
import gov.sandia.mixsig.language.AccessSignal;
import gov.sandia.mixsig.language.ArraySelect;
import gov.sandia.mixsig.language.Case;
import gov.sandia.mixsig.language.Concatenate;
import gov.sandia.mixsig.language.Constant;
import gov.sandia.mixsig.language.Operator;
import gov.sandia.mixsig.language.operator.Add;
import gov.sandia.mixsig.language.operator.EQ;
import gov.sandia.mixsig.language.operator.Multiply;
import gov.sandia.mixsig.linear.FactorQR;
import gov.sandia.mixsig.linear.MatrixDense;

/**
    Converts a case-free equation system into state-space form.
    The unknowns are the derivatives of the states and the outputs. The knowns are the states and the inputs.
    Each equation lhs==rhs is expanded into the affine form sum(m*unknown) + sum(n*known) + c == 0,
    and the whole set is solved simultaneously, so equations may come in any order and may be implicit.

    <p>Extraction happens in two phases. expand() reduces each equation to coefficients.
    solve() then builds the matrices. Between the two, the caller can check hasOffset() across
    every address of a switched system and decide whether all of them need a constant input column.
**/
public class LinearExtractor
{
    public static double rankTolerance     = 1e-10;
    public static double residualTolerance = 1e-9;

    protected List<Signal>        inputs;
    protected List<Signal>        states;
    protected List<Signal>        outputs;
    protected Map<String,Integer> unknownIndex = new HashMap<String,Integer> ();
    protected Map<String,Integer> knownIndex   = new HashMap<String,Integer> ();
    protected int                 unknownCount;
    protected int                 knownCount;

    public LinearExtractor (List<Signal> inputs, List<Signal> states, List<Signal> outputs)
    {
        this.inputs  = inputs;
        this.states  = states;
        this.outputs = outputs;

        for (Signal s : states)  unknownIndex.put (s.derivative ().toString (), unknownIndex.size ());
        for (Signal s : outputs) unknownIndex.put (s.name,                      unknownIndex.size ());
        for (Signal s : states)  knownIndex  .put (s.name,                      knownIndex  .size ());
        for (Signal s : inputs)  knownIndex  .put (s.name,                      knownIndex  .size ());
        unknownCount = unknownIndex.size ();
        knownCount   = knownIndex  .size ();
    }

    /**
        Linear combination of unknowns and knowns, plus a constant.
    **/
    public static class Affine
    {
        public double[] unknown;
        public double[] known;
        public double   constant;

        public Affine (int unknownCount, int knownCount)
        {
            unknown = new double[unknownCount];
            known   = new double[knownCount];
        }

        public boolean isConstant ()
        {
            for (double d : unknown) if (d != 0) return false;
            for (double d : known)   if (d != 0) return false;
            return true;
        }

        public void accumulate (Affine that, double scale)
        {
            for (int i = 0; i < unknown.length; i++) unknown[i] += that.unknown[i] * scale;
            for (int i = 0; i < known.length;   i++) known[i]   += that.known[i]   * scale;
            constant += that.constant * scale;
        }
    }

    /**
        Coefficients for every equation of one resolved system.
    **/
    public static class Expansion
    {
        public List<Affine> rows     = new ArrayList<Affine> ();
        public List<EQ>     sources  = new ArrayList<EQ> ();

        public boolean hasOffset ()
        {
            for (Affine a : rows) if (a.constant != 0) return true;
            return false;
        }
    }

    public Expansion expand (EquationSystem system)
    {
        Expansion result = new Expansion ();
        for (EQ e : system.equations)
        {
            Expander expander = new Expander (e);
            Affine row = e.lhs ().dispatch (expander);
            row.accumulate (e.rhs ().dispatch (expander), -1);
            result.rows.add (row);
            result.sources.add (e);
        }
        return result;
    }

    /**
        Convenience for a system with no constant terms, or where the caller does not need
        to coordinate the offset column across several systems.
    **/
    public LinearDynamicalSystem extract (EquationSystem system)
    {
        Expansion expansion = expand (system);
        return solve (expansion, expansion.hasOffset ());
    }

    /**
        Solves the expanded equations for the unknowns.
        @param offsetColumn Append a column to B and D which multiplies a constant input of 1.
        This carries the constant terms of the equations.
        @return Continuous-time system. Its input count is inputs.size() plus 1 if offsetColumn is set.
    **/
    public LinearDynamicalSystem solve (Expansion expansion, boolean offsetColumn)
    {
        int ns = states.size ();
        int ni = inputs.size () + (offsetColumn ? 1 : 0);
        int no = outputs.size ();
        int nk = ns + ni;

        if (! offsetColumn  &&  expansion.hasOffset ()) throw new AnalysisException ("Equations have constant terms, but no offset column was requested.");

        int neq = expansion.rows.size ();
        MatrixDense M = new MatrixDense (neq, unknownCount);
        MatrixDense K = new MatrixDense (neq, nk);  // negated known side, so that M*X = K
        for (int r = 0; r < neq; r++)
        {
            Affine a = expansion.rows.get (r);
            for (int c = 0; c < unknownCount; c++) M.set (r, c, a.unknown[c]);
            for (int c = 0; c < knownCount;   c++) K.set (r, c, -a.known[c]);
            if (offsetColumn) K.set (r, nk - 1, -a.constant);
        }

        MatrixDense X;  // unknowns x knowns
        if (unknownCount == 0)
        {
            X = new MatrixDense (0, nk);
        }
        else
        {
            if (neq < unknownCount) throw new AnalysisException ("The unknowns are not determined: " + neq + " equations for " + unknownCount + " unknowns " + unknownNames ());
            FactorQR qr = new FactorQR (M);
            int rank = qr.rankRelative (rankTolerance);
            if (rank < unknownCount) throw new AnalysisException ("The unknowns are not determined: the equations constrain only " + rank + " of " + unknownCount + " unknowns " + unknownNames ());
            X = qr.solve (K);
        }

        // Any equation beyond those needed to fix the unknowns must agree with the solution.
        MatrixDense residual = unknownCount == 0 ? K : M.multiply (X).subtract (K);
        double scale = Math.max (1, K.normInfinity ());
        for (int r = 0; r < neq; r++)
        {
            for (int c = 0; c < nk; c++)
            {
                if (Math.abs (residual.get (r, c)) > residualTolerance * scale)
                {
                    throw new AnalysisException ("The equation " + expansion.sources.get (r).render () + " is inconsistent with the others.");
                }
            }
        }

        MatrixDense A = new MatrixDense (ns, ns);
        MatrixDense B = new MatrixDense (ns, ni);
        MatrixDense C = new MatrixDense (no, ns);
        MatrixDense D = new MatrixDense (no, ni);
        for (int r = 0; r < ns; r++)
        {
            for (int c = 0; c < ns; c++) A.set (r, c, X.get (r, c));
            for (int c = 0; c < ni; c++) B.set (r, c, X.get (r, ns + c));
        }
        for (int r = 0; r < no; r++)
        {
            for (int c = 0; c < ns; c++) C.set (r, c, X.get (ns + r, c));
            for (int c = 0; c < ni; c++) D.set (r, c, X.get (ns + r, ns + c));
        }
        return new LinearDynamicalSystem (A, B, C, D, false);
    }

    protected List<String> unknownNames ()
    {
        List<String> result = new ArrayList<String> ();
        for (Signal s : states)  result.add (s.derivative ().toString ());
        for (Signal s : outputs) result.add (s.name);
        return result;
    }

    /**
        Reduces one side of an equation to affine form.
    **/
    public class Expander implements Operator.Dispatcher<Affine>
    {
        protected EQ equation;  // for error messages

        public Expander (EQ equation)
        {
            this.equation = equation;
        }

        protected Affine zero ()
        {
            return new Affine (unknownCount, knownCount);
        }

        public Affine constant (Constant op)
        {
            Affine result = zero ();
            result.constant = op.value;
            return result;
        }

        public Affine signal (AccessSignal op)
        {
            Affine result = zero ();
            String key = op.toString ();
            Integer index = unknownIndex.get (key);
            if (index != null)
            {
                result.unknown[index] = 1;
                return result;
            }
            index = knownIndex.get (key);
            if (index != null)
            {
                result.known[index] = 1;
                return result;
            }
            throw new AnalysisException ("Unresolved reference to " + key + " in equation " + equation.render ());
        }

        public Affine add (Add op)
        {
            Affine result = zero ();
            for (Operator o : op.operands) result.accumulate (o.dispatch (this), 1);
            return result;
        }

        public Affine multiply (Multiply op)
        {
            Affine result = null;
            double scale  = 1;
            for (Operator o : op.operands)
            {
                Affine a = o.dispatch (this);
                if (a.isConstant ())
                {
                    scale *= a.constant;
                }
                else
                {
                    if (result != null) throw new AnalysisException ("The equation " + equation.render () + " is not linear: product of " + op.render ());
                    result = a;
                }
            }
            if (result == null)
            {
                result = zero ();
                result.constant = scale;
                return result;
            }
            Affine scaled = zero ();
            scaled.accumulate (result, scale);
            return scaled;
        }

        public Affine equal (EQ op)
        {
            throw new AnalysisException ("Nested equality in equation " + equation.render ());
        }

        public Affine concatenate (Concatenate op)
        {
            throw new AnalysisException ("Bit concatenation can't take part in a linear equation: " + equation.render ());
        }

        public Affine arraySelect (ArraySelect op)
        {
            throw new AnalysisException ("Address-indexed array can't take part in a linear equation: " + equation.render ());
        }

        public Affine cases (Case op)
        {
            throw new AnalysisException ("Unresolved case table in equation " + equation.render ());
        }
    }
}
