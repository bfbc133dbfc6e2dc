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

import java.util.ArrayList;
import java.util.List;

import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Type;
import gpuverify.core.KernelArrayInfo;
import gpuverify.core.MalformedKernelException;
import gpuverify.util.Util;

/**
 * Finds the accesses an expression makes to non-local (i.e. global or
 * group-shared) state. A non-local access is either a maximal chain of map
 * selects rooted at a shared variable, such as <code>A[i][j]</code>, or a bare
 * reference to a shared variable. Quantified and <code>old</code>
 * subexpressions are not searched, since the accesses they contain cannot be
 * evaluated on their own.
 */
public class AccessCollector {
	private final KernelArrayInfo arrays;

	public AccessCollector(KernelArrayInfo arrays) {
		this.arrays = arrays;
	}

	public boolean containsNonLocalAccess(Expr e) {
		return findFirst(e) != null;
	}

	/**
	 * Check whether an expression is itself exactly one non-local access, with
	 * no further non-local access in its indices.
	 *
	 * @param e
	 * @return
	 */
	public boolean isNonLocalAccess(Expr e) {
		Expr.VariableAccess root = Util.rootOf(e);
		if (root == null || !arrays.isShared(root.getVariable())) {
			return false;
		}
		for (Expr index : Util.indicesOf(e)) {
			if (containsNonLocalAccess(index)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Find the leftmost innermost non-local access in an expression, or
	 * <code>null</code> if there is none. For <code>A[B[i]] + C[j]</code> this
	 * is <code>B[i]</code>.
	 *
	 * @param e
	 * @return
	 */
	public Expr findFirst(Expr e) {
		if (e instanceof Expr.VariableAccess) {
			return arrays.isShared(((Expr.VariableAccess) e).getVariable()) ? e : null;
		} else if (e instanceof Expr.DictionaryAccess) {
			Expr.VariableAccess root = Util.rootOf(e);
			if (root != null && arrays.isShared(root.getVariable())) {
				Expr inner = findFirst(Util.indicesOf(e));
				return inner != null ? inner : e;
			}
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			Expr r = findFirst(a.getSource());
			return r != null ? r : findFirst(a.getIndices());
		} else if (e instanceof Expr.DictionaryUpdate) {
			Expr.DictionaryUpdate u = (Expr.DictionaryUpdate) e;
			Expr r = findFirst(u.getSource());
			r = r != null ? r : findFirst(u.getIndices());
			return r != null ? r : findFirst(u.getValue());
		} else if (e instanceof Expr.Invoke) {
			return findFirst(((Expr.Invoke) e).getArguments());
		} else if (e instanceof Expr.IfThenElse) {
			Expr.IfThenElse ite = (Expr.IfThenElse) e;
			Expr r = findFirst(ite.getCondition());
			r = r != null ? r : findFirst(ite.getTrueBranch());
			return r != null ? r : findFirst(ite.getFalseBranch());
		} else if (e instanceof Expr.NaryOperator) {
			return findFirst(((Expr.NaryOperator) e).getOperands());
		} else if (e instanceof Expr.Old || e instanceof Expr.Quantifier) {
			return null;
		} else if (e instanceof Expr.UnaryOperator) {
			return findFirst(((Expr.UnaryOperator) e).getOperand());
		} else if (e instanceof Expr.BinaryOperator) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			Expr r = findFirst(b.getLeftHandSide());
			return r != null ? r : findFirst(b.getRightHandSide());
		} else {
			return null;
		}
	}

	private Expr findFirst(List<? extends Expr> exprs) {
		for (Expr e : exprs) {
			Expr r = findFirst(e);
			if (r != null) {
				return r;
			}
		}
		return null;
	}

	/**
	 * Collect every non-local access in an expression, innermost first.
	 *
	 * @param e
	 * @return
	 */
	public List<Expr> collect(Expr e) {
		ArrayList<Expr> result = new ArrayList<>();
		collect(e, result);
		return result;
	}

	private void collect(Expr e, List<Expr> result) {
		if (e instanceof Expr.DictionaryAccess || e instanceof Expr.VariableAccess) {
			Expr.VariableAccess root = Util.rootOf(e);
			if (root != null && arrays.isShared(root.getVariable())) {
				for (Expr index : Util.indicesOf(e)) {
					collect(index, result);
				}
				result.add(e);
				return;
			}
		}
		if (e instanceof Expr.Old || e instanceof Expr.Quantifier) {
			return;
		}
		for (Expr child : children(e)) {
			collect(child, result);
		}
	}

	private static List<Expr> children(Expr e) {
		ArrayList<Expr> result = new ArrayList<>();
		if (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			result.add(a.getSource());
			result.addAll(a.getIndices());
		} else if (e instanceof Expr.DictionaryUpdate) {
			Expr.DictionaryUpdate u = (Expr.DictionaryUpdate) e;
			result.add(u.getSource());
			result.addAll(u.getIndices());
			result.add(u.getValue());
		} else if (e instanceof Expr.Invoke) {
			result.addAll(((Expr.Invoke) e).getArguments());
		} else if (e instanceof Expr.IfThenElse) {
			Expr.IfThenElse ite = (Expr.IfThenElse) e;
			result.add(ite.getCondition());
			result.add(ite.getTrueBranch());
			result.add(ite.getFalseBranch());
		} else if (e instanceof Expr.NaryOperator) {
			result.addAll(((Expr.NaryOperator) e).getOperands());
		} else if (e instanceof Expr.UnaryOperator) {
			result.add(((Expr.UnaryOperator) e).getOperand());
		} else if (e instanceof Expr.BinaryOperator) {
			result.add(((Expr.BinaryOperator) e).getLeftHandSide());
			result.add(((Expr.BinaryOperator) e).getRightHandSide());
		}
		return result;
	}

	/**
	 * Determine the type of value produced by a non-local access. Shared maps
	 * must be nested maps of a single key each.
	 *
	 * @param access
	 * @return
	 */
	public Type typeOf(Expr access) {
		Expr e = access;
		while (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			if (a.getIndices().size() != 1) {
				throw new MalformedKernelException(
						"multidimensional maps not supported in kernels, use nested maps instead");
			}
			e = a.getSource();
		}
		Expr.VariableAccess root = (Expr.VariableAccess) e;
		return Util.elementType(arrays.getType(root.getVariable()), Util.indicesOf(access).size());
	}
}
