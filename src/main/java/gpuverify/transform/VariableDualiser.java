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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;
import gpuverify.core.UniformityAnalysis;
import gpuverify.core.VariableKind;
import gpuverify.util.AbstractExpressionTransform;
import gpuverify.util.Util;

/**
 * Renames the variables of an expression for one of the two threads, so that
 * <code>x + _X</code> becomes <code>x$1 + _X$1</code> for the first thread.
 * The following are left alone:
 * <ul>
 * <li>Constants other than the thread and group identifiers.</li>
 * <li>Arrays with shared storage (i.e. <code>{:global}</code> or
 * <code>{:group_shared}</code>), arrays marked
 * <code>{:atomic_group_shared}</code> and constant arrays.</li>
 * <li>Variables which are uniform in the enclosing procedure.</li>
 * <li>Variables bound by a quantifier.</li>
 * <li>Names which are already thread copies (i.e. contain <code>$</code>),
 * so dualising twice has no further effect.</li>
 * </ul>
 * Calls to the functions <code>__other_bool</code> (etc) are replaced by
 * their argument dualised for the other thread.
 */
public class VariableDualiser extends AbstractExpressionTransform {
	public static final Set<String> OTHER_FUNCTIONS = ImmutableSet.of("__other_bool", "__other_bv32",
			"__other_bv64", "__other_arrayId");
	/**
	 * Marks the select which picks the accessing thread's group, so that an
	 * access is never indexed through its group twice.
	 */
	private static final String GROUP_INDEX = "group_index";

	private final int id;
	private final Kernel kernel;
	private final KernelArrayInfo arrays;
	private final Set<String> constants;
	private final List<String> quantified = new ArrayList<>();
	private String procedure;
	private UniformityAnalysis uniformity = UniformityAnalysis.NONE;
	private boolean onlyIntraGroup;

	public VariableDualiser(int id, Kernel kernel, Set<String> constants) {
		Preconditions.checkArgument(id == 1 || id == 2, "invalid thread identifier %s", id);
		this.id = id;
		this.kernel = kernel;
		this.arrays = kernel.getArrays();
		this.constants = constants;
	}

	public VariableDualiser setProcedure(String procedure) {
		this.procedure = procedure;
		return this;
	}

	public VariableDualiser setUniformityAnalysis(UniformityAnalysis uniformity) {
		this.uniformity = uniformity;
		return this;
	}

	public VariableDualiser setOnlyIntraGroupRaceChecking(boolean flag) {
		this.onlyIntraGroup = flag;
		return this;
	}

	public int getThread() {
		return id;
	}

	/**
	 * Get a dualiser for the other thread, with the same configuration.
	 *
	 * @return
	 */
	public VariableDualiser other() {
		VariableDualiser r = new VariableDualiser(3 - id, kernel, constants);
		r.quantified.addAll(quantified);
		return r.setProcedure(procedure).setUniformityAnalysis(uniformity).setOnlyIntraGroupRaceChecking(onlyIntraGroup);
	}

	/**
	 * Determine whether a given name has separate copies for each thread.
	 *
	 * @param name
	 * @return
	 */
	public boolean isDualised(String name) {
		if (name.indexOf('$') >= 0 || name.contains("_NOT_ACCESSED_") || quantified.contains(name)) {
			return false;
		} else if (Kernel.isThreadLocalId(name)) {
			return true;
		} else if (Kernel.isGroupId(name)) {
			return !onlyIntraGroup;
		} else if (constants.contains(name)) {
			return false;
		} else if (arrays.contains(name)) {
			return arrays.kindOf(name) != VariableKind.CONSTANT && !arrays.isSingleCopy(name);
		} else {
			return procedure == null || !uniformity.isUniform(procedure, name);
		}
	}

	public String dualise(String name) {
		return isDualised(name) ? Kernel.threadCopy(name, id) : name;
	}

	public LVal visitLVal(LVal lval) {
		return (LVal) visitExpression(lval);
	}

	@Override
	protected Expr visitVariableAccess(Expr.VariableAccess expr) {
		if (isDualised(expr.getVariable())) {
			return VAR(Kernel.threadCopy(expr.getVariable(), id), expr.getAttributes());
		}
		return expr;
	}

	@Override
	protected Expr visitDictionaryAccess(Expr.DictionaryAccess expr) {
		Expr.VariableAccess root = Util.rootOf(expr);
		if (root != null && requiresGroupIndexing(root.getVariable()) && !isGroupIndexed(expr)) {
			return indexThroughGroup(expr);
		}
		return super.visitDictionaryAccess(expr);
	}

	@Override
	protected Expr visitInvoke(Expr.Invoke expr) {
		if (OTHER_FUNCTIONS.contains(expr.getName())) {
			Preconditions.checkArgument(expr.getArguments().size() == 1, "%s expects one argument", expr.getName());
			return other().visitExpression(expr.getArguments().get(0));
		}
		return super.visitInvoke(expr);
	}

	@Override
	protected Expr visitQuantifier(Expr.Quantifier expr) {
		for (Decl.Parameter p : expr.getParameters()) {
			quantified.add(p.getName());
		}
		try {
			return super.visitQuantifier(expr);
		} finally {
			for (Decl.Parameter p : expr.getParameters()) {
				quantified.remove(p.getName());
			}
		}
	}

	/**
	 * Check whether accesses to a given array must select the copy belonging
	 * to the accessing thread's group.
	 *
	 * @param name
	 * @return
	 */
	public boolean requiresGroupIndexing(String name) {
		return !onlyIntraGroup && arrays.requiresGroupIndexing(name);
	}

	/**
	 * The index selecting the accessing thread's group. The first thread
	 * always uses <code>true</code>, whilst the second uses the same copy only
	 * when it is in the same group.
	 *
	 * @return
	 */
	public Expr.Logical getGroupIndex() {
		return id == 1 ? CONST(true) : kernel.getSameGroupPredicate();
	}

	private Expr indexThroughGroup(Expr e) {
		if (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			return GET(indexThroughGroup(a.getSource()), visitExpressions(a.getIndices()), a.getAttributes());
		}
		return GET(visitExpression(e), getGroupIndex(), ANNOTATION(GROUP_INDEX));
	}

	/**
	 * Check whether the innermost select of an access chain was introduced by
	 * {@link #indexThroughGroup(Expr)}.
	 *
	 * @param e
	 * @return
	 */
	private static boolean isGroupIndexed(Expr.DictionaryAccess e) {
		while (e.getSource() instanceof Expr.DictionaryAccess) {
			e = (Expr.DictionaryAccess) e.getSource();
		}
		return e.hasAnnotation(GROUP_INDEX);
	}

	/**
	 * Get the names of all constants in a program which are not thread or
	 * group identifiers.
	 *
	 * @param file
	 * @return
	 */
	public static Set<String> constantsOf(BoogieFile file) {
		Set<String> result = new LinkedHashSet<>();
		for (Decl.Constant c : file.getDeclarations(Decl.Constant.class)) {
			if (!Kernel.isThreadLocalId(c.getName()) && !Kernel.isGroupId(c.getName())) {
				result.add(c.getName());
			}
		}
		return result;
	}
}
