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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;
import gpuverify.race.RaceInstrumenter;
import gpuverify.util.AbstractStatementVisitor;

/**
 * Generates candidate loop invariants and procedure contracts for a dualised
 * kernel. Each candidate is guarded by a fresh existential constant, as in:
 *
 * <pre>
 * const {:existential true} _b0 : bool;
 * ...
 * while(_LC0$1 || _LC0$2)
 *   invariant _b0 ==> _LC0$1 == _LC0$2;
 *   invariant _b1 ==> i$1 == i$2;
 * { ... }
 * </pre>
 *
 * An external fixpoint solver then determines which of these constants can
 * be consistently assigned <code>true</code>. Candidates may also be supplied
 * by the user, one expression per line. Such candidates are admitted at a
 * given loop or procedure only when every name they use is in scope there
 * and they are well-typed booleans. A warning is issued for any candidate
 * admitted nowhere.
 */
public class CandidateInvariantGenerator {
	public static final String EXISTENTIAL_PREFIX = "_b";

	private final Logger logger;
	private final Kernel kernel;
	private final KernelArrayInfo arrays;
	private final RaceInstrumenter races;
	private boolean fullAbstraction;
	private boolean raceCheckingContract;
	private ExpressionParser parser;
	private String userSource = "";
	private List<String> userLines = Collections.emptyList();
	private final List<String> warnings = new ArrayList<>();
	private final List<Decl.Constant> existentials = new ArrayList<>();

	public CandidateInvariantGenerator(Kernel kernel, RaceInstrumenter races, Logger logger) {
		this.kernel = kernel;
		this.arrays = kernel.getArrays();
		this.races = races;
		this.logger = logger;
	}

	public CandidateInvariantGenerator setFullAbstraction(boolean flag) {
		this.fullAbstraction = flag;
		return this;
	}

	public CandidateInvariantGenerator setRaceCheckingContract(boolean flag) {
		this.raceCheckingContract = flag;
		return this;
	}

	public CandidateInvariantGenerator setExpressionParser(ExpressionParser parser) {
		this.parser = parser;
		return this;
	}

	/**
	 * Supply candidate invariants, one expression per line.
	 *
	 * @param source
	 *            Where the lines came from (e.g. a file name), for use in
	 *            diagnostics.
	 * @param lines
	 * @return
	 */
	public CandidateInvariantGenerator setUserSuppliedInvariants(String source, List<String> lines) {
		this.userSource = source;
		this.userLines = new ArrayList<>(lines);
		return this;
	}

	/**
	 * Get the warnings issued for badly formed user-supplied candidates during
	 * the last run.
	 *
	 * @return
	 */
	public List<String> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * Get the existential constants declared during the last run, in order.
	 *
	 * @return
	 */
	public List<Decl.Constant> getExistentials() {
		return Collections.unmodifiableList(existentials);
	}

	public void apply(BoogieFile file) {
		warnings.clear();
		existentials.clear();
		List<UserCandidate> user = parseUserCandidates();
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			if (impl.hasAnnotation("inline")) {
				continue;
			}
			Stmt body = new LoopCandidates(file, impl, user).visitStatement(impl.getBody());
			if (body != impl.getBody()) {
				file.replace(impl, impl.withBody(body));
			}
		}
		for (Decl.Procedure p : file.getDeclarations(Decl.Procedure.class)) {
			if (p.getName().equals(kernel.getKernelName()) || p.hasAnnotation("inline")
					|| file.getImplementation(p.getName()) == null) {
				continue;
			}
			file.replace(p, addContractCandidates(file, p, user));
		}
		for (UserCandidate u : user) {
			if (!u.admitted) {
				warn("Ignoring candidate invariant '" + u.text + "' at '" + userSource + "' line " + u.line
						+ ", which is not valid at any loop or procedure");
			}
		}
		file.getDeclarations().addAll(existentials);
		logger.debug("generated " + existentials.size() + " candidate invariants");
	}

	private List<UserCandidate> parseUserCandidates() {
		ArrayList<UserCandidate> result = new ArrayList<>();
		if (userLines.isEmpty()) {
			return result;
		}
		Preconditions.checkState(parser != null, "no expression parser for user-supplied invariants");
		for (int i = 0; i != userLines.size(); ++i) {
			String line = userLines.get(i).trim();
			if (line.isEmpty()) {
				continue;
			}
			try {
				result.add(new UserCandidate(line, i + 1, parser.parse(line)));
			} catch (ExpressionParser.SyntaxError e) {
				warn("Ignoring badly formed candidate invariant '" + line + "' at '" + userSource + "' line " + (i + 1));
			}
		}
		return result;
	}

	private void warn(String warning) {
		warnings.add(warning);
		logger.warn(warning);
	}

	private Decl.Procedure addContractCandidates(BoogieFile file, Decl.Procedure p, List<UserCandidate> user) {
		List<String> parameters = namesOf(p.getParameters());
		List<String> returns = namesOf(p.getReturns());
		String p1 = Kernel.threadCopy(Predicator.PREDICATE, 1);
		String p2 = Kernel.threadCopy(Predicator.PREDICATE, 2);
		boolean predicated = parameters.contains(p1) && parameters.contains(p2);
		//
		List<Expr.Logical> requires = new ArrayList<>(p.getRequires());
		for (String base : dualisedPairs(parameters)) {
			Expr.Logical eq = EQ(VAR(Kernel.threadCopy(base, 1)), VAR(Kernel.threadCopy(base, 2)));
			if (base.equals(Predicator.PREDICATE)) {
				requires.add(candidate(eq));
			} else if (!isPredicateOrTemp(base)) {
				if (predicated) {
					requires.add(candidate(IMPLIES(CONJOIN(VAR(p1), VAR(p2)), eq)));
				}
				requires.add(candidate(eq));
			}
		}
		List<Expr.Logical> ensures = new ArrayList<>(p.getEnsures());
		for (String base : dualisedPairs(returns)) {
			if (!isPredicateOrTemp(base)) {
				ensures.add(candidate(EQ(VAR(Kernel.threadCopy(base, 1)), VAR(Kernel.threadCopy(base, 2)))));
			}
		}
		if (raceCheckingContract) {
			for (Expr.Logical e : races.makeCandidateRequires(p)) {
				requires.add(candidate(e));
			}
			for (Expr.Logical e : races.makeCandidateEnsures(p)) {
				ensures.add(candidate(e));
			}
		}
		Map<String, Type> inputs = typesOf(p.getParameters());
		Map<String, Type> outputs = new LinkedHashMap<>(inputs);
		outputs.putAll(typesOf(p.getReturns()));
		for (UserCandidate u : user) {
			Expr.Logical e = u.expr;
			Decl.Procedure candidateDecl = p.withContract(append(p.getRequires(), e), p.getEnsures());
			if (admit(file, p, candidateDecl, u, inputs, "requires of " + p.getName())) {
				requires.add(candidate(e));
			}
			candidateDecl = p.withContract(p.getRequires(), append(p.getEnsures(), e));
			if (admit(file, p, candidateDecl, u, outputs, "ensures of " + p.getName())) {
				ensures.add(candidate(e));
			}
		}
		return p.withContract(requires, ensures);
	}

	/**
	 * Adds candidate invariants to every loop within an implementation.
	 */
	private class LoopCandidates extends AbstractStatementVisitor {
		private final BoogieFile file;
		private final Decl.Implementation impl;
		private final List<UserCandidate> user;
		private final Map<String, Type> scope = new LinkedHashMap<>();

		public LoopCandidates(BoogieFile file, Decl.Implementation impl, List<UserCandidate> user) {
			this.file = file;
			this.impl = impl;
			this.user = user;
			scope.putAll(typesOf(impl.getParameters()));
			scope.putAll(typesOf(impl.getReturns()));
			scope.putAll(typesOf(impl.getLocals()));
		}

		@Override
		protected Stmt constructWhile(Stmt.While s, Stmt body) {
			List<Expr.Logical> invariant = new ArrayList<>(s.getInvariant());
			for (Expr.Logical e : candidatesFor(s)) {
				invariant.add(candidate(e));
			}
			return WHILE(s.getCondition(), invariant, body, s.getAttributes());
		}

		private List<Expr.Logical> candidatesFor(Stmt.While s) {
			ArrayList<Expr.Logical> result = new ArrayList<>();
			List<Expr.VariableAccess> predicates = loopPredicatesOf(s.getCondition());
			if (predicates != null) {
				result.add(EQ(predicates.get(0), predicates.get(1)));
			}
			boolean isKernel = impl.getName().equals(kernel.getKernelName());
			for (String base : dualisedPairs(scope.keySet())) {
				if (isPredicateOrTemp(base)) {
					continue;
				}
				Expr.Logical eq = EQ(VAR(Kernel.threadCopy(base, 1)), VAR(Kernel.threadCopy(base, 2)));
				result.add(eq);
				if (!isKernel && predicates != null) {
					result.add(IMPLIES(CONJOIN(predicates.get(0), predicates.get(1)), eq));
				}
			}
			if (!fullAbstraction) {
				Set<String> globals = new LinkedHashSet<>(namesOf(file.getDeclarations(Decl.Variable.class)));
				for (String v : arrays.getSharedArrays(true)) {
					String v1 = Kernel.threadCopy(v, 1);
					String v2 = Kernel.threadCopy(v, 2);
					if (globals.contains(v1) && globals.contains(v2)) {
						result.add(EQ(VAR(v1), VAR(v2)));
					}
				}
			}
			result.addAll(races.makeCandidateInvariants());
			for (UserCandidate u : user) {
				Stmt candidateBody = SEQUENCE(ASSUME(u.expr), impl.getBody());
				if (admit(file, impl, impl.withBody(candidateBody), u, scope, "loop in " + impl.getName())) {
					result.add(u.expr);
				}
			}
			return result;
		}
	}

	/**
	 * Check whether a user-supplied candidate resolves and type checks at a
	 * given insertion point. This is done on a scratch copy of the program
	 * where the declaration being extended has been replaced by one using the
	 * candidate.
	 *
	 * @param file
	 * @param original
	 * @param candidateDecl
	 * @param candidate
	 * @param scope
	 *            Types of the parameters and locals at the insertion point.
	 * @param where
	 * @return
	 */
	private boolean admit(BoogieFile file, Decl original, Decl candidateDecl, UserCandidate candidate,
			Map<String, Type> scope, String where) {
		BoogieFile scratch = file.copy();
		scratch.replace(original, candidateDecl);
		Set<String> missing = new NameResolver(scratch).unresolved(candidate.expr, scope.keySet());
		if (!missing.isEmpty()) {
			logger.debug("rejected candidate '" + candidate.text + "' at " + where + " (unresolved " + missing + ")");
			return false;
		}
		try {
			new TypeChecker(scratch).checkLogical(candidate.expr, scope);
		} catch (TypeChecker.TypeError e) {
			logger.debug("rejected candidate '" + candidate.text + "' at " + where + " (" + e.getMessage() + ")");
			return false;
		}
		candidate.admitted = true;
		return true;
	}

	private Expr.Logical candidate(Expr.Logical e) {
		String name = EXISTENTIAL_PREFIX + existentials.size();
		existentials.add(CONSTANT(name, Type.Bool, ANNOTATION("existential", CONST(true))));
		return IMPLIES(VAR(name), e);
	}

	/**
	 * Extract the two loop predicates from a dualised loop guard of the form
	 * <code>_LC0$1 || _LC0$2</code>, or <code>null</code> if the guard has some
	 * other form.
	 *
	 * @param guard
	 * @return
	 */
	private static List<Expr.VariableAccess> loopPredicatesOf(Expr.Logical guard) {
		if (guard instanceof Expr.LogicalOr) {
			List<Expr.Logical> operands = ((Expr.LogicalOr) guard).getOperands();
			if (operands.size() == 2 && operands.get(0) instanceof Expr.VariableAccess
					&& operands.get(1) instanceof Expr.VariableAccess) {
				List<Expr.VariableAccess> result = new ArrayList<>();
				result.add((Expr.VariableAccess) operands.get(0));
				result.add((Expr.VariableAccess) operands.get(1));
				return result;
			}
		}
		return null;
	}

	/**
	 * Determine those names which have a copy for each thread, returning them
	 * without the thread suffix.
	 *
	 * @param names
	 * @return
	 */
	private static List<String> dualisedPairs(Collection<String> names) {
		Set<String> result = new LinkedHashSet<>();
		for (String n : names) {
			if (n.endsWith("$1")) {
				String base = n.substring(0, n.length() - 2);
				if (names.contains(Kernel.threadCopy(base, 2))) {
					result.add(base);
				}
			}
		}
		return new ArrayList<>(result);
	}

	/**
	 * Check whether a name follows the naming convention of predicates and
	 * temporaries introduced by earlier passes.
	 *
	 * @param name
	 * @return
	 */
	public static boolean isPredicateOrTemp(String name) {
		return name.startsWith(Predicator.PREDICATE)
				|| (name.startsWith(Predicator.LOOP_PREDICATE) && name.length() > Predicator.LOOP_PREDICATE.length())
				|| (name.startsWith(StructuralNormaliser.TEMP_PREFIX)
						&& name.length() > StructuralNormaliser.TEMP_PREFIX.length());
	}

	private static List<String> namesOf(List<? extends Decl.Parameter> parameters) {
		ArrayList<String> result = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			result.add(p.getName());
		}
		return result;
	}

	private static Map<String, Type> typesOf(List<? extends Decl.Parameter> parameters) {
		Map<String, Type> result = new LinkedHashMap<>();
		for (Decl.Parameter p : parameters) {
			result.put(p.getName(), p.getType());
		}
		return result;
	}

	private static <T> List<T> append(List<T> items, T item) {
		ArrayList<T> result = new ArrayList<>(items);
		result.add(item);
		return result;
	}

	/**
	 * A parsed line of user-supplied candidates, remembering where it came
	 * from and whether it was admitted anywhere.
	 */
	private static class UserCandidate {
		private final String text;
		private final int line;
		private final Expr.Logical expr;
		private boolean admitted;

		public UserCandidate(String text, int line, Expr.Logical expr) {
			this.text = text;
			this.line = line;
			this.expr = expr;
		}
	}
}
