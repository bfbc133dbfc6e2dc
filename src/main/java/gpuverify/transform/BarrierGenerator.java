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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;
import gpuverify.race.RaceInstrumenter;
import gpuverify.util.Util;

/**
 * Synthesises the implementation of the barrier procedure once the program
 * has been dualised. For a kernel with one shared array <code>A</code> this
 * looks something like:
 *
 * <pre>
 * implementation {:inline 1} barrier(_P$1 : bool, _P$2 : bool) {
 *   __BarrierImpl:
 *   assert {:barrier_divergence} _P$1 == _P$2;
 *   if(!_P$1 &amp;&amp; !_P$2) { return; }
 *   assert {:write_write_race} ...
 *   ...
 *   __HavocSharedState:
 *   havoc A$1, A$2;
 *   assume A$1 == A$2;
 * }
 * </pre>
 */
public class BarrierGenerator {
	public static final String BARRIER_LABEL = "__BarrierImpl";
	public static final String HAVOC_LABEL = "__HavocSharedState";

	private final Logger logger;
	private final Kernel kernel;
	private final KernelArrayInfo arrays;
	private final RaceInstrumenter races;
	private boolean onlyDivergence;
	private boolean fullAbstraction;

	public BarrierGenerator(Kernel kernel, RaceInstrumenter races, Logger logger) {
		this.kernel = kernel;
		this.arrays = kernel.getArrays();
		this.races = races;
		this.logger = logger;
	}

	public BarrierGenerator setOnlyDivergence(boolean flag) {
		this.onlyDivergence = flag;
		return this;
	}

	public BarrierGenerator setFullAbstraction(boolean flag) {
		this.fullAbstraction = flag;
		return this;
	}

	public void apply(BoogieFile file) {
		Decl.Procedure barrier = file.getProcedure(kernel.getBarrierName());
		Preconditions.checkState(barrier != null, "barrier procedure %s not found", kernel.getBarrierName());
		Preconditions.checkState(!barrier.getParameters().isEmpty(), "barrier procedure has not been predicated");
		Stmt body = generateBody(barrier, file);
		Set<String> modified = modifiedBy(body);
		// Add the implementation
		Decl.Implementation existing = file.getImplementation(barrier.getName());
		Decl.Implementation impl = IMPLEMENTATION(barrier.getName(), barrier.getParameters(), barrier.getReturns(),
				Collections.emptyList(), body, inline(barrier.getAttributes()));
		if (existing != null) {
			file.replace(existing, impl);
		} else {
			file.getDeclarations().add(impl);
		}
		file.replace(barrier,
				barrier.withModifies(union(barrier.getModifies(), modified)).withAttributes(inline(barrier.getAttributes())));
		// Callers of the barrier must be permitted to modify what it does
		for (Decl.Implementation caller : file.getDeclarations(Decl.Implementation.class)) {
			if (caller.getName().equals(barrier.getName()) || !callsDirectly(caller.getBody(), barrier.getName())) {
				continue;
			}
			Decl.Procedure p = file.getProcedure(caller.getName());
			if (p != null) {
				file.replace(p, p.withModifies(union(p.getModifies(), modified)));
			}
		}
		logger.debug("generated barrier implementation for " + barrier.getName());
	}

	private Stmt generateBody(Decl.Procedure barrier, BoogieFile file) {
		List<Decl.Parameter> parameters = barrier.getParameters();
		Expr.VariableAccess p1 = VAR(parameters.get(0).getName());
		Expr.VariableAccess p2 = VAR(parameters.get(parameters.size() > 1 ? 1 : 0).getName());
		ArrayList<Stmt> stmts = new ArrayList<>();
		stmts.add(LABEL(BARRIER_LABEL));
		stmts.add(ASSERT(EQ(p1, p2), ANNOTATION("barrier_divergence")));
		if (!onlyDivergence || !fullAbstraction) {
			stmts.add(IFELSE(AND(NOT(p1), NOT(p2)), RETURN(), null));
		}
		stmts.addAll(races.makeRaceCheckingStatements());
		if (!fullAbstraction) {
			ArrayList<Stmt> havocs = new ArrayList<>();
			for (String v : arrays.getSharedArrays(true)) {
				if (arrays.isSingleCopy(v)) {
					havocs.add(HAVOC(VAR(v)));
				} else if (isDeclared(file, Kernel.threadCopy(v, 1))) {
					Expr.VariableAccess v1 = VAR(Kernel.threadCopy(v, 1));
					Expr.VariableAccess v2 = VAR(Kernel.threadCopy(v, 2));
					if (isDeclared(file, v2.getVariable())) {
						havocs.add(HAVOC(List.of(v1, v2)));
						havocs.add(ASSUME(EQ(v1, v2)));
					} else {
						havocs.add(HAVOC(v1));
					}
				}
			}
			if (!havocs.isEmpty()) {
				stmts.add(LABEL(HAVOC_LABEL));
				stmts.addAll(havocs);
			}
		}
		return SEQUENCE(stmts);
	}

	private static boolean isDeclared(BoogieFile file, String name) {
		for (Decl.Variable v : file.getDeclarations(Decl.Variable.class)) {
			if (v.getName().equals(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Determine the global variables assigned or havocked by a barrier body.
	 *
	 * @param body
	 * @return
	 */
	private static Set<String> modifiedBy(Stmt body) {
		Set<String> result = new LinkedHashSet<>();
		for (Stmt s : Util.flatten(body)) {
			if (s instanceof Stmt.Assignment) {
				for (LVal lv : ((Stmt.Assignment) s).getLeftHandSides()) {
					result.add(Util.rootOf(lv).getVariable());
				}
			} else if (s instanceof Stmt.Havoc) {
				for (Expr.VariableAccess v : ((Stmt.Havoc) s).getVariables()) {
					result.add(v.getVariable());
				}
			}
		}
		return result;
	}

	/**
	 * Check whether a body calls a given procedure, either at the top level or
	 * within the body of a loop. Calls nested within conditionals are not
	 * considered, since predication has already removed them.
	 *
	 * @param body
	 * @param name
	 * @return
	 */
	private static boolean callsDirectly(Stmt body, String name) {
		for (Stmt s : Util.flatten(body)) {
			if (s instanceof Stmt.Call && ((Stmt.Call) s).getName().equals(name)) {
				return true;
			} else if (s instanceof Stmt.While && callsDirectly(((Stmt.While) s).getBody(), name)) {
				return true;
			}
		}
		return false;
	}

	private static Attribute[] inline(Attribute[] attributes) {
		for (Attribute a : attributes) {
			Annotation annotation = a.as(Annotation.class);
			if (annotation != null && annotation.getName().equals("inline")) {
				return attributes;
			}
		}
		return Util.append(attributes, ANNOTATION("inline", CONST(1)));
	}

	private static List<String> union(List<String> lhs, Set<String> rhs) {
		LinkedHashSet<String> result = new LinkedHashSet<>(lhs);
		result.addAll(rhs);
		return new ArrayList<>(result);
	}
}
