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
package gpuverify.race;

import static gpuverify.core.BoogieFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;
import gpuverify.core.MalformedKernelException;
import gpuverify.core.VariableKind;
import gpuverify.transform.AccessCollector;
import gpuverify.util.AbstractStatementVisitor;
import gpuverify.util.Util;

/**
 * Instruments a kernel for race checking. For each shared array
 * <code>v</code> which is written somewhere in the kernel, this declares
 * flags <code>_READ_HAS_OCCURRED_v</code> and
 * <code>_WRITE_HAS_OCCURRED_v</code>, along with variables recording the
 * offset of the access for each dimension of <code>v</code>. Every read or
 * write of <code>v</code> is preceded by a call to a logging procedure which
 * may nondeterministically choose to record it. At each barrier, the two
 * threads' records are compared for conflicting accesses.
 */
public class StandardRaceInstrumenter implements RaceInstrumenter {
	private static final String READ = "READ";
	private static final String WRITE = "WRITE";
	private static final Kernel.Axis[] DIMENSIONS = Kernel.Axis.values();

	private final Logger logger;
	private final Kernel kernel;
	private final KernelArrayInfo arrays;
	private final AccessCollector accesses;
	/**
	 * The arrays being checked, mapped to the index type of each of their
	 * dimensions.
	 */
	private final Map<String, List<Type>> checked = new LinkedHashMap<>();
	private boolean onlyIntraGroup;

	public StandardRaceInstrumenter(Kernel kernel, Logger logger) {
		this.kernel = kernel;
		this.arrays = kernel.getArrays();
		this.accesses = new AccessCollector(arrays);
		this.logger = logger;
	}

	public StandardRaceInstrumenter setOnlyIntraGroupRaceChecking(boolean flag) {
		this.onlyIntraGroup = flag;
		return this;
	}

	/**
	 * Get the arrays being checked for races, in declaration order.
	 *
	 * @return
	 */
	public Set<String> getCheckedArrays() {
		return Collections.unmodifiableSet(checked.keySet());
	}

	@Override
	public void addRaceCheckingDeclarations(BoogieFile file) {
		Set<String> written = findWrittenVariables(file);
		for (String v : arrays.getSharedArrays(false)) {
			if (!written.contains(v)) {
				if (!arrays.isReadOnly(v)) {
					arrays.markReadOnly(v);
				}
				logger.debug("array " + v + " is read-only");
				continue;
			}
			checked.put(v, dimensionsOf(v));
		}
		List<String> modifies = new ArrayList<>();
		for (Map.Entry<String, List<Type>> e : checked.entrySet()) {
			String v = e.getKey();
			for (String kind : new String[] { READ, WRITE }) {
				file.getDeclarations().add(VARIABLE(hasOccurred(kind, v), Type.Bool));
				modifies.add(hasOccurred(kind, v));
			}
			for (int i = 0; i != e.getValue().size(); ++i) {
				for (String kind : new String[] { READ, WRITE }) {
					file.getDeclarations().add(VARIABLE(offset(kind, DIMENSIONS[i], v), e.getValue().get(i)));
					modifies.add(offset(kind, DIMENSIONS[i], v));
				}
			}
			addLogProcedure(file, READ, v);
			addLogProcedure(file, WRITE, v);
		}
		Decl.Procedure kp = file.getProcedure(kernel.getKernelName());
		file.replace(kp, kp.withModifies(union(kp.getModifies(), modifies)));
	}

	@Override
	public void addRaceCheckingInstrumentation(BoogieFile file) {
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			Instrumenter instrumenter = new Instrumenter();
			Stmt body = instrumenter.visitStatement(impl.getBody());
			if (body == impl.getBody()) {
				continue;
			}
			file.replace(impl, impl.withBody(body));
			// callers must be permitted to modify what the logging procedures do
			Decl.Procedure p = file.getProcedure(impl.getName());
			List<String> modifies = new ArrayList<>();
			for (String log : instrumenter.called) {
				modifies.addAll(file.getProcedure(log).getModifies());
			}
			if (p != null) {
				file.replace(p, p.withModifies(union(p.getModifies(), modifies)));
			}
		}
	}

	@Override
	public List<Stmt> makeRaceCheckingStatements() {
		ArrayList<Stmt> stmts = new ArrayList<>();
		for (String v : checked.keySet()) {
			stmts.addAll(makeRaceChecks(v));
		}
		for (String v : checked.keySet()) {
			for (String kind : new String[] { READ, WRITE }) {
				for (int thread = 1; thread <= 2; ++thread) {
					stmts.add(ASSIGN(VAR(Kernel.threadCopy(hasOccurred(kind, v), thread)), CONST(false)));
				}
			}
		}
		return stmts;
	}

	@Override
	public List<Expr.Logical> makeKernelPrecondition() {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		for (String v : checked.keySet()) {
			for (String kind : new String[] { READ, WRITE }) {
				for (int thread = 1; thread <= 2; ++thread) {
					result.add(NOT(VAR(Kernel.threadCopy(hasOccurred(kind, v), thread))));
				}
			}
		}
		return result;
	}

	@Override
	public List<Expr.Logical> makeCandidateInvariants() {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		Type idType = kernel.getThreadIdType();
		for (Map.Entry<String, List<Type>> e : checked.entrySet()) {
			String v = e.getKey();
			result.addAll(noAccessHasOccurred(v));
			if (!e.getValue().isEmpty() && e.getValue().get(0).equals(idType)) {
				for (String kind : new String[] { WRITE, READ }) {
					Expr.Logical flag = VAR(Kernel.threadCopy(hasOccurred(kind, v), 1));
					Expr.Logical offsetIsThreadId = EQ(VAR(Kernel.threadCopy(offset(kind, Kernel.Axis.X, v), 1)),
							VAR(Kernel.threadCopy(Kernel.Axis.X.localId(), 1)));
					result.add(IMPLIES(flag, offsetIsThreadId));
				}
			}
		}
		return result;
	}

	@Override
	public List<Expr.Logical> makeCandidateRequires(Decl.Procedure procedure) {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		for (String v : checked.keySet()) {
			result.addAll(noAccessHasOccurred(v));
		}
		return result;
	}

	@Override
	public List<Expr.Logical> makeCandidateEnsures(Decl.Procedure procedure) {
		return makeCandidateRequires(procedure);
	}

	@Override
	public void addEagerRaceChecking(BoogieFile file) {
		for (String v : checked.keySet()) {
			for (String kind : new String[] { READ, WRITE }) {
				Decl.Implementation impl = file.getImplementation(logProcedure(kind, v));
				List<Stmt> stmts = new ArrayList<>(Util.flatten(impl.getBody()));
				stmts.add(LABEL("__CheckForRaces"));
				stmts.addAll(makeRaceChecks(v));
				file.replace(impl, impl.withBody(SEQUENCE(stmts)));
			}
		}
	}

	private List<Stmt> makeRaceChecks(String v) {
		ArrayList<Stmt> stmts = new ArrayList<>();
		stmts.add(ASSERT(noConflict(v, WRITE, WRITE), ANNOTATION("write_write_race")));
		stmts.add(ASSERT(noConflict(v, WRITE, READ), ANNOTATION("write_read_race")));
		stmts.add(ASSERT(noConflict(v, READ, WRITE), ANNOTATION("read_write_race")));
		return stmts;
	}

	/**
	 * Construct the condition that the first thread's access of a given kind
	 * does not conflict with the second thread's access of another kind.
	 *
	 * @param v
	 * @param first
	 * @param second
	 * @return
	 */
	private Expr.Logical noConflict(String v, String first, String second) {
		ArrayList<Expr.Logical> clauses = new ArrayList<>();
		if (arrays.kindOf(v) == VariableKind.GROUP_SHARED && !onlyIntraGroup) {
			clauses.add(kernel.getSameGroupPredicate());
		}
		clauses.add(VAR(Kernel.threadCopy(hasOccurred(first, v), 1)));
		clauses.add(VAR(Kernel.threadCopy(hasOccurred(second, v), 2)));
		for (int i = 0; i != checked.get(v).size(); ++i) {
			clauses.add(EQ(VAR(Kernel.threadCopy(offset(first, DIMENSIONS[i], v), 1)),
					VAR(Kernel.threadCopy(offset(second, DIMENSIONS[i], v), 2))));
		}
		return NOT(CONJOIN(clauses));
	}

	private List<Expr.Logical> noAccessHasOccurred(String v) {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		result.add(NOT(VAR(Kernel.threadCopy(hasOccurred(READ, v), 1))));
		result.add(NOT(VAR(Kernel.threadCopy(hasOccurred(WRITE, v), 1))));
		return result;
	}

	/**
	 * Add a logging procedure, such as:
	 *
	 * <pre>
	 * procedure {:inline 1} _LOG_WRITE_A(_offset_X : int)
	 *   modifies _WRITE_HAS_OCCURRED_A, _WRITE_OFFSET_X_A;
	 * implementation {:inline 1} _LOG_WRITE_A(_offset_X : int) {
	 *   var _track : bool;
	 *   havoc _track;
	 *   if(_track) {
	 *     _WRITE_HAS_OCCURRED_A := true;
	 *     _WRITE_OFFSET_X_A := _offset_X;
	 *   }
	 * }
	 * </pre>
	 *
	 * @param file
	 * @param kind
	 * @param v
	 */
	private void addLogProcedure(BoogieFile file, String kind, String v) {
		String name = logProcedure(kind, v);
		List<Type> dimensions = checked.get(v);
		List<Decl.Parameter> parameters = new ArrayList<>();
		List<String> modifies = new ArrayList<>();
		List<Stmt> record = new ArrayList<>();
		modifies.add(hasOccurred(kind, v));
		record.add(ASSIGN(VAR(hasOccurred(kind, v)), CONST(true)));
		for (int i = 0; i != dimensions.size(); ++i) {
			String parameter = "_offset_" + DIMENSIONS[i].name();
			parameters.add(PARAMETER(parameter, dimensions.get(i)));
			modifies.add(offset(kind, DIMENSIONS[i], v));
			record.add(ASSIGN(VAR(offset(kind, DIMENSIONS[i], v)), VAR(parameter)));
		}
		Expr.VariableAccess track = VAR("_track");
		Stmt body = SEQUENCE(HAVOC(track), IFELSE(track, SEQUENCE(record), null));
		file.getDeclarations().add(PROCEDURE(name, parameters, Collections.emptyList(), inline()).withModifies(modifies));
		file.getDeclarations().add(IMPLEMENTATION(name, parameters, Collections.emptyList(),
				Collections.singletonList(VARIABLE("_track", Type.Bool)), body, inline()));
	}

	/**
	 * Determine the index type of each dimension of a shared array. Only
	 * nested maps of up to three dimensions, indexed by <code>int</code> or
	 * <code>bv32</code>, are supported.
	 *
	 * @param v
	 * @return
	 */
	private List<Type> dimensionsOf(String v) {
		ArrayList<Type> result = new ArrayList<>();
		Type type = arrays.getType(v);
		while (type instanceof Type.Dictionary) {
			Type.Dictionary map = (Type.Dictionary) type;
			if (result.size() == DIMENSIONS.length) {
				throw new MalformedKernelException("array '" + v + "' has more than " + DIMENSIONS.length + " dimensions");
			} else if (map.getKeys().size() != 1) {
				throw new MalformedKernelException("multidimensional maps not supported in kernels, use nested maps instead");
			}
			Type key = map.getKey();
			if (!key.equals(Type.Int) && !key.equals(Type.BitVector32)) {
				throw new MalformedKernelException("array '" + v + "' must be indexed by 'int' or 'bv32', not '" + key + "'");
			}
			result.add(key);
			type = map.getValue();
		}
		return result;
	}

	private Set<String> findWrittenVariables(BoogieFile file) {
		Set<String> written = new LinkedHashSet<>();
		AbstractStatementVisitor collector = new AbstractStatementVisitor() {
			@Override
			protected Stmt constructAssignment(Stmt.Assignment s) {
				for (LVal lhs : s.getLeftHandSides()) {
					written.add(Util.rootOf(lhs).getVariable());
				}
				return s;
			}

			@Override
			protected Stmt constructHavoc(Stmt.Havoc s) {
				for (Expr.VariableAccess v : s.getVariables()) {
					written.add(v.getVariable());
				}
				return s;
			}

			@Override
			protected Stmt constructCall(Stmt.Call s) {
				for (LVal lval : s.getLVals()) {
					written.add(Util.rootOf(lval).getVariable());
				}
				return s;
			}
		};
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			collector.visitStatement(impl.getBody());
		}
		return written;
	}

	private class Instrumenter extends AbstractStatementVisitor {
		private final Set<String> called = new LinkedHashSet<>();

		@Override
		protected Stmt constructAssignment(Stmt.Assignment s) {
			ArrayList<Stmt> stmts = new ArrayList<>();
			for (Expr rhs : s.getRightHandSides()) {
				for (Expr access : accesses.collect(rhs)) {
					logAccess(READ, access, stmts);
				}
			}
			for (LVal lhs : s.getLeftHandSides()) {
				logAccess(WRITE, lhs, stmts);
			}
			if (stmts.isEmpty()) {
				return s;
			}
			stmts.add(s);
			return SEQUENCE(stmts);
		}

		private void logAccess(String kind, Expr access, List<Stmt> stmts) {
			Expr.VariableAccess root = Util.rootOf(access);
			if (root == null || !checked.containsKey(root.getVariable())) {
				return;
			}
			String v = root.getVariable();
			List<Expr> indices = Util.indicesOf(access);
			if (indices.size() != checked.get(v).size()) {
				throw new MalformedKernelException("array '" + v + "' must be accessed at all of its "
						+ checked.get(v).size() + " dimensions");
			}
			String log = logProcedure(kind, v);
			called.add(log);
			stmts.add(CALL(log, indices));
		}
	}

	private static Attribute inline() {
		return ANNOTATION("inline", CONST(1));
	}

	private static List<String> union(List<String> lhs, List<String> rhs) {
		LinkedHashSet<String> result = new LinkedHashSet<>(lhs);
		result.addAll(rhs);
		return new ArrayList<>(result);
	}

	public static String logProcedure(String kind, String v) {
		return "_LOG_" + kind + "_" + v;
	}

	public static String hasOccurred(String kind, String v) {
		return "_" + kind + "_HAS_OCCURRED_" + v;
	}

	public static String offset(String kind, Kernel.Axis axis, String v) {
		return "_" + kind + "_OFFSET_" + axis.name() + "_" + v;
	}
}
