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

import com.google.common.base.Preconditions;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.util.Util;

/**
 * Eliminates conditional control flow by predicating each statement on the
 * condition under which it executes. Every procedure other than the kernel
 * gains a leading parameter <code>_P</code> indicating whether the calling
 * thread is enabled, and every call passes its own predicate for this. Within
 * a body, consider:
 *
 * <pre>
 * if(x > 0) { y := 1; } else { y := 2; }
 * </pre>
 *
 * Under a predicate <code>P</code> this becomes:
 *
 * <pre>
 * _P0 := x > 0;
 * y := (if P &amp;&amp; _P0 then 1 else y);
 * y := (if P &amp;&amp; !_P0 then 2 else y);
 * </pre>
 *
 * Loops remain, but are controlled by a loop predicate <code>_LC&lt;n&gt;</code>
 * which remains true whilst the thread is still iterating. A
 * <code>break</code> simply disables the loop predicate.
 */
public class Predicator {
	public static final String PREDICATE = "_P";
	public static final String LOOP_PREDICATE = "_LC";
	public static final String HAVOC_PREFIX = "_HAVOC_";

	private final Logger logger;
	private final Kernel kernel;

	public Predicator(Kernel kernel, Logger logger) {
		this.kernel = kernel;
		this.logger = logger;
	}

	public void apply(BoogieFile file) {
		Map<String, Type> globals = new HashMap<>();
		for (Decl.Variable v : file.getDeclarations(Decl.Variable.class)) {
			globals.put(v.getName(), v.getType());
		}
		List<Decl> declarations = file.getDeclarations();
		for (int i = 0; i != declarations.size(); ++i) {
			Decl d = declarations.get(i);
			if (d instanceof Decl.Procedure && !isKernel(((Decl.Procedure) d).getName())) {
				Decl.Procedure p = (Decl.Procedure) d;
				declarations.set(i, p.withSignature(Util.append(predicateParameter(), p.getParameters()), p.getReturns()));
			} else if (d instanceof Decl.Implementation) {
				declarations.set(i, predicate((Decl.Implementation) d, globals));
			}
		}
	}

	/**
	 * Predicate a given implementation. Global variables are needed to
	 * determine the type of any havocked global.
	 *
	 * @param impl
	 * @param globals
	 * @return
	 */
	public Decl.Implementation predicate(Decl.Implementation impl, Map<String, Type> globals) {
		boolean isKernel = isKernel(impl.getName());
		List<Decl.Parameter> parameters = impl.getParameters();
		if (!isKernel) {
			parameters = Util.append(predicateParameter(), parameters);
		}
		Context context = new Context(impl, globals);
		Expr.Logical predicate = isKernel ? CONST(true) : VAR(PREDICATE);
		List<Stmt> body = context.predicate(impl.getBody(), predicate, null);
		logger.debug("predicated " + impl.getName() + " with " + context.ifs + " branch and " + context.loops
				+ " loop predicates");
		return impl.withSignature(parameters, impl.getReturns())
				.withLocals(Util.append(impl.getLocals(), context.getLocals())).withBody(SEQUENCE(body));
	}

	private boolean isKernel(String name) {
		return name.equals(kernel.getKernelName());
	}

	private static Decl.Parameter predicateParameter() {
		return PARAMETER(PREDICATE, Type.Bool);
	}

	/**
	 * The state of predication within a single implementation.
	 */
	private static class Context {
		private final Map<String, Type> environment = new HashMap<>();
		private final Set<Type> havocs = new LinkedHashSet<>();
		private int ifs;
		private int loops;

		public Context(Decl.Implementation impl, Map<String, Type> globals) {
			environment.putAll(globals);
			for (Decl.Parameter p : Util.append(Util.append(impl.getParameters(), impl.getReturns()), impl.getLocals())) {
				environment.put(p.getName(), p.getType());
			}
		}

		public List<Decl.Variable> getLocals() {
			ArrayList<Decl.Variable> locals = new ArrayList<>();
			for (int i = 0; i != ifs; ++i) {
				locals.add(VARIABLE(PREDICATE + i, Type.Bool));
			}
			for (int i = 0; i != loops; ++i) {
				locals.add(VARIABLE(LOOP_PREDICATE + i, Type.Bool));
			}
			for (Type t : havocs) {
				locals.add(VARIABLE(havocVariable(t), t));
			}
			return locals;
		}

		/**
		 * Predicate a statement under a given predicate, producing the
		 * resulting sequence of statements.
		 *
		 * @param s
		 * @param predicate           The condition under which the statement
		 *                            executes.
		 * @param enclosingLoopPredicate The predicate of the innermost enclosing
		 *                            loop, or <code>null</code> if none.
		 * @return
		 */
		public List<Stmt> predicate(Stmt s, Expr.Logical predicate, Expr.VariableAccess enclosingLoopPredicate) {
			ArrayList<Stmt> result = new ArrayList<>();
			if (s instanceof Stmt.Sequence) {
				for (Stmt child : ((Stmt.Sequence) s).getAll()) {
					result.addAll(predicate(child, predicate, enclosingLoopPredicate));
				}
			} else if (s instanceof Stmt.Call) {
				Stmt.Call c = (Stmt.Call) s;
				result.add(CALL(c.getName(), c.getLVals(), Util.append(predicate, c.getArguments()), c.getAttributes()));
			} else if (s instanceof Stmt.Label) {
				result.add(s);
			} else if (s instanceof Stmt.While) {
				predicateWhile((Stmt.While) s, predicate, result);
			} else if (s instanceof Stmt.IfElse) {
				predicateIfElse((Stmt.IfElse) s, predicate, enclosingLoopPredicate, result);
			} else if (s instanceof Stmt.Break) {
				Preconditions.checkState(enclosingLoopPredicate != null, "break encountered outside of loop");
				result.add(ASSIGN(enclosingLoopPredicate, ITE(predicate, CONST(false), enclosingLoopPredicate)));
			} else if (predicate.isTrue()) {
				result.add(s);
			} else if (s instanceof Stmt.Assignment) {
				Stmt.Assignment a = (Stmt.Assignment) s;
				Preconditions.checkState(a.size() == 1, "multiple assignment encountered during predication");
				LVal lhs = a.getLeftHandSide();
				result.add(ASSIGN(lhs, ITE(predicate, a.getRightHandSide(), lhs), a.getAttributes()));
			} else if (s instanceof Stmt.Havoc) {
				for (Expr.VariableAccess v : ((Stmt.Havoc) s).getVariables()) {
					Type type = environment.get(v.getVariable());
					Preconditions.checkState(type != null, "havoc of undeclared variable %s", v.getVariable());
					havocs.add(type);
					Expr.VariableAccess tmp = VAR(havocVariable(type));
					result.add(HAVOC(tmp, s.getAttributes()));
					result.add(ASSIGN(v, ITE(predicate, tmp, v)));
				}
			} else if (s instanceof Stmt.Assert) {
				Stmt.Assert a = (Stmt.Assert) s;
				result.add(ASSERT(IMPLIES(predicate, a.getCondition()), a.getAttributes()));
			} else if (s instanceof Stmt.Assume) {
				Stmt.Assume a = (Stmt.Assume) s;
				result.add(ASSUME(IMPLIES(predicate, a.getCondition()), a.getAttributes()));
			} else if (s instanceof Stmt.Return) {
				throw new IllegalStateException("return encountered under predicate " + predicate);
			} else {
				throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
			}
			return result;
		}

		private void predicateWhile(Stmt.While s, Expr.Logical predicate, List<Stmt> result) {
			String name = LOOP_PREDICATE + (loops++);
			Expr.VariableAccess lc = VAR(name);
			Expr.Logical guard = s.getCondition();
			result.add(ASSIGN(lc, CONJOIN(predicate, guard)));
			List<Stmt> body = predicate(s.getBody(), lc, lc);
			body.add(LABEL("update_" + name));
			body.add(ASSIGN(lc, CONJOIN(lc, guard)));
			result.add(WHILE(lc, s.getInvariant(), SEQUENCE(body), s.getAttributes()));
		}

		private void predicateIfElse(Stmt.IfElse s, Expr.Logical predicate, Expr.VariableAccess enclosingLoopPredicate,
				List<Stmt> result) {
			Preconditions.checkState(s.getElseIf() == null, "else-if encountered during predication");
			Expr.VariableAccess p = VAR(PREDICATE + (ifs++));
			result.add(ASSIGN(p, s.getCondition()));
			result.addAll(predicate(s.getTrueBranch(), CONJOIN(predicate, p), enclosingLoopPredicate));
			if (s.getFalseBranch() != null) {
				result.addAll(predicate(s.getFalseBranch(), CONJOIN(predicate, NOT(p)), enclosingLoopPredicate));
			}
		}
	}

	public static String havocVariable(Type type) {
		return HAVOC_PREFIX + Util.mangle(type);
	}
}
