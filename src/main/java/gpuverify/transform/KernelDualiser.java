// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package gpuverify.transform;

import static gpuverify.core.BoogieFile.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;
import gpuverify.core.UniformityAnalysis;
import gpuverify.core.VariableKind;
import gpuverify.util.AbstractStatementVisitor;
import gpuverify.util.Util;

/**
 * Turns a predicated kernel into a program executing two threads in
 * lockstep. Every thread-specific variable is split into two copies,
 * <code>x$1</code> and <code>x$2</code>, and every statement is applied to
 * both. For example, <code>x := x + _X;</code> becomes:
 *
 * <pre>
 * x$1, x$2 := x$1 + _X$1, x$2 + _X$2;
 * </pre>
 *
 * Assertions and assumptions must hold for both threads, and a loop continues
 * whilst either thread is still iterating. A procedure which is
 * <i>half-dualised</i> is given only the first thread's copy.
 */
public class KernelDualiser {
	private final Logger logger;
	private final Kernel kernel;
	private final KernelArrayInfo arrays;
	private final Set<String> halfDualisedProcedures = new LinkedHashSet<>();
	private final Set<String> halfDualisedVariables = new LinkedHashSet<>();
	private UniformityAnalysis uniformity = UniformityAnalysis.NONE;
	private boolean onlyIntraGroup;
	private boolean symmetry;
	private Set<String> constants = new LinkedHashSet<>();
	private final Map<String, Decl.Procedure> procedures = new HashMap<>();

	public KernelDualiser(Kernel kernel, Logger logger) {
		this.kernel = kernel;
		this.arrays = kernel.getArrays();
		this.logger = logger;
	}

	public KernelDualiser setUniformityAnalysis(UniformityAnalysis uniformity) {
		this.uniformity = uniformity;
		return this;
	}

	public KernelDualiser setOnlyIntraGroupRaceChecking(boolean flag) {
		this.onlyIntraGroup = flag;
		return this;
	}

	public KernelDualiser setSymmetry(boolean flag) {
		this.symmetry = flag;
		return this;
	}

	public KernelDualiser addHalfDualisedProcedure(String name) {
		halfDualisedProcedures.add(name);
		return this;
	}

	public KernelDualiser addHalfDualisedVariable(String name) {
		halfDualisedVariables.add(name);
		return this;
	}

	/**
	 * Construct a dualiser for a given thread within a given procedure (or
	 * <code>null</code> for none).
	 *
	 * @param id
	 * @param procedure
	 * @return
	 */
	public VariableDualiser getDualiser(int id, String procedure) {
		return new VariableDualiser(id, kernel, constants).setProcedure(procedure).setUniformityAnalysis(uniformity)
				.setOnlyIntraGroupRaceChecking(onlyIntraGroup);
	}

	public void apply(BoogieFile file) {
		constants = VariableDualiser.constantsOf(file);
		procedures.clear();
		for (Decl.Procedure p : file.getDeclarations(Decl.Procedure.class)) {
			procedures.put(p.getName(), p);
		}
		List<Decl> declarations = new ArrayList<>();
		for (Decl d : file.getDeclarations()) {
			declarations.addAll(dualise(d));
		}
		file.getDeclarations().clear();
		file.getDeclarations().addAll(declarations);
		logger.debug("dualised " + procedures.size() + " procedures");
	}

	public List<Decl> dualise(Decl d) {
		ArrayList<Decl> result = new ArrayList<>();
		if (d instanceof Decl.Procedure) {
			result.add(dualise((Decl.Procedure) d));
		} else if (d instanceof Decl.Implementation) {
			result.add(dualise((Decl.Implementation) d));
		} else if (d instanceof Decl.Variable) {
			dualise((Decl.Variable) d, result);
		} else if (d instanceof Decl.Constant) {
			Decl.Constant c = (Decl.Constant) d;
			VariableDualiser d1 = getDualiser(1, null);
			if (d1.isDualised(c.getName())) {
				result.add(c.withName(d1.dualise(c.getName())));
				if (!halfDualisedVariables.contains(c.getName())) {
					result.add(c.withName(getDualiser(2, null).dualise(c.getName())));
				}
			} else {
				result.add(c);
			}
		} else if (d instanceof Decl.Axiom) {
			Decl.Axiom a = (Decl.Axiom) d;
			Expr.Logical e = conjoin(a.getOperand(), getDualiser(1, null), getDualiser(2, null), false);
			result.add(e == a.getOperand() ? a : new Decl.Axiom(e, a.getAttributes()));
		} else {
			result.add(d);
		}
		return result;
	}

	private void dualise(Decl.Variable v, List<Decl> result) {
		String name = v.getName();
		if (arrays.isSingleCopy(name)) {
			// both threads see the same declaration, which is split per group
			// whenever accesses select through a group index
			if (!onlyIntraGroup && arrays.requiresGroupIndexing(name)) {
				result.add(v.withType(new Type.Dictionary(Type.Bool, v.getType())));
			} else {
				result.add(v);
			}
		} else if (arrays.kindOf(name) == VariableKind.CONSTANT || name.indexOf('$') >= 0) {
			result.add(v);
		} else {
			result.add(v.withName(Kernel.threadCopy(name, 1)));
			if (!halfDualisedVariables.contains(name)) {
				result.add(v.withName(Kernel.threadCopy(name, 2)));
			}
		}
	}

	private Decl.Procedure dualise(Decl.Procedure p) {
		boolean half = halfDualisedProcedures.contains(p.getName());
		VariableDualiser d1 = getDualiser(1, p.getName());
		VariableDualiser d2 = getDualiser(2, p.getName());
		Set<String> modifies = new LinkedHashSet<>();
		for (String m : p.getModifies()) {
			modifies.add(d1.dualise(m));
		}
		if (!half) {
			for (String m : p.getModifies()) {
				if (!symmetry || !halfDualisedVariables.contains(m)) {
					modifies.add(d2.dualise(m));
				}
			}
		}
		return p.withSignature(dualise(p.getParameters(), d1, d2, half), dualise(p.getReturns(), d1, d2, half))
				.withContract(conjoin(p.getRequires(), d1, d2, half), conjoin(p.getEnsures(), d1, d2, half))
				.withFreeContract(conjoin(p.getFreeRequires(), d1, d2, half), conjoin(p.getFreeEnsures(), d1, d2, half))
				.withModifies(new ArrayList<>(modifies));
	}

	private Decl.Implementation dualise(Decl.Implementation impl) {
		boolean half = halfDualisedProcedures.contains(impl.getName());
		VariableDualiser d1 = getDualiser(1, impl.getName());
		VariableDualiser d2 = getDualiser(2, impl.getName());
		Stmt body = new StatementDualiser(d1, d2, half).visitStatement(impl.getBody());
		return impl.withSignature(dualise(impl.getParameters(), d1, d2, half), dualise(impl.getReturns(), d1, d2, half))
				.withLocals(dualise(impl.getLocals(), d1, d2, half)).withBody(body);
	}

	/**
	 * Dualise a list of parameters or local variables. The first thread's
	 * copies come first, followed by the second thread's copies of those
	 * which are not uniform.
	 *
	 * @param <T>
	 * @param parameters
	 * @param d1
	 * @param d2
	 * @param half
	 * @return
	 */
	@SuppressWarnings("unchecked")
	private static <T extends Decl.Parameter> List<T> dualise(List<T> parameters, VariableDualiser d1,
			VariableDualiser d2, boolean half) {
		ArrayList<T> result = new ArrayList<>();
		for (T p : parameters) {
			result.add((T) rename(p, d1.dualise(p.getName())));
		}
		if (!half) {
			for (T p : parameters) {
				if (d2.isDualised(p.getName())) {
					result.add((T) rename(p, d2.dualise(p.getName())));
				}
			}
		}
		return result;
	}

	private static Decl.Parameter rename(Decl.Parameter p, String name) {
		if (name.equals(p.getName())) {
			return p;
		} else if (p instanceof Decl.Variable) {
			return ((Decl.Variable) p).withName(name);
		} else {
			return p.withName(name);
		}
	}

	private static List<Expr.Logical> conjoin(List<Expr.Logical> exprs, VariableDualiser d1, VariableDualiser d2,
			boolean half) {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		for (Expr.Logical e : exprs) {
			result.add(conjoin(e, d1, d2, half));
		}
		return result;
	}

	/**
	 * Construct the condition that an expression holds for both threads. An
	 * expression with no thread-specific variables is returned unchanged.
	 *
	 * @param e
	 * @param d1
	 * @param d2
	 * @param half
	 * @return
	 */
	private static Expr.Logical conjoin(Expr.Logical e, VariableDualiser d1, VariableDualiser d2, boolean half) {
		Expr.Logical e1 = d1.visitLogical(e);
		if (half) {
			return e1;
		}
		Expr.Logical e2 = d2.visitLogical(e);
		if (e1 == e && e2 == e) {
			return e;
		}
		return AND(e1, e2);
	}

	private class StatementDualiser extends AbstractStatementVisitor {
		private final VariableDualiser d1;
		private final VariableDualiser d2;
		private final boolean half;

		public StatementDualiser(VariableDualiser d1, VariableDualiser d2, boolean half) {
			this.d1 = d1;
			this.d2 = d2;
			this.half = half;
		}

		@Override
		protected Stmt constructAssignment(Stmt.Assignment s) {
			List<LVal> lhs1 = Util.map(s.getLeftHandSides(), d1::visitLVal);
			List<Expr> rhs1 = d1.visitExpressions(s.getRightHandSides());
			if (half) {
				return ASSIGN(lhs1, rhs1, s.getAttributes());
			}
			List<LVal> lhs2 = Util.map(s.getLeftHandSides(), d2::visitLVal);
			List<Expr> rhs2 = d2.visitExpressions(s.getRightHandSides());
			Set<String> assigned = new LinkedHashSet<>();
			for (LVal l : lhs1) {
				assigned.add(Util.rootOf(l).getVariable());
			}
			for (LVal l : lhs2) {
				if (assigned.contains(Util.rootOf(l).getVariable())) {
					// cannot assign the same variable twice in parallel
					return SEQUENCE(ASSIGN(lhs1, rhs1, s.getAttributes()), ASSIGN(lhs2, rhs2, s.getAttributes()));
				}
			}
			return ASSIGN(Util.append(lhs1, lhs2), Util.append(rhs1, rhs2), s.getAttributes());
		}

		@Override
		protected Stmt constructHavoc(Stmt.Havoc s) {
			Set<String> names = new LinkedHashSet<>();
			for (Expr.VariableAccess v : s.getVariables()) {
				names.add(d1.dualise(v.getVariable()));
			}
			if (!half) {
				for (Expr.VariableAccess v : s.getVariables()) {
					names.add(d2.dualise(v.getVariable()));
				}
			}
			return HAVOC(Util.map(new ArrayList<>(names), n -> VAR(n)), s.getAttributes());
		}

		@Override
		protected Stmt constructAssert(Stmt.Assert s) {
			return ASSERT(conjoin(s.getCondition(), d1, d2, half), s.getAttributes());
		}

		@Override
		protected Stmt constructAssume(Stmt.Assume s) {
			return ASSUME(conjoin(s.getCondition(), d1, d2, half), s.getAttributes());
		}

		@Override
		protected Stmt constructCall(Stmt.Call s) {
			Decl.Procedure callee = procedures.get(s.getName());
			boolean bothThreads = !half && !halfDualisedProcedures.contains(s.getName());
			List<Expr> arguments = new ArrayList<>(d1.visitExpressions(s.getArguments()));
			List<LVal> lvals = new ArrayList<>(Util.map(s.getLVals(), d1::visitLVal));
			if (bothThreads) {
				for (int i = 0; i != s.getArguments().size(); ++i) {
					if (callee == null || i >= callee.getParameters().size()
							|| !uniformity.isUniform(callee.getName(), callee.getParameters().get(i).getName())) {
						arguments.add(d2.visitExpression(s.getArguments().get(i)));
					}
				}
				for (int i = 0; i != s.getLVals().size(); ++i) {
					if (callee == null || i >= callee.getReturns().size()
							|| !uniformity.isUniform(callee.getName(), callee.getReturns().get(i).getName())) {
						lvals.add(d2.visitLVal(s.getLVals().get(i)));
					}
				}
			}
			return CALL(s.getName(), lvals, arguments, s.getAttributes());
		}

		@Override
		protected Stmt visitWhile(Stmt.While s) {
			Expr.Logical g1 = d1.visitLogical(s.getCondition());
			Expr.Logical guard = half ? g1 : DISJOIN(g1, d2.visitLogical(s.getCondition()));
			Stmt body = visitStatement(s.getBody());
			return WHILE(guard, conjoin(s.getInvariant(), d1, d2, half), body, s.getAttributes());
		}

		@Override
		protected Stmt visitIfElse(Stmt.IfElse s) {
			throw new IllegalStateException("if statement encountered during dualisation");
		}
	}
}
