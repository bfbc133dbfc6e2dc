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
package gpuverify.util;

import java.util.List;

import gpuverify.core.BoogieFile.Expr;

/**
 * Folds an expression into a summary value, e.g. the set of variables it
 * reads. Leaves produce {@link #BOTTOM()} unless overridden, and the values of
 * children are combined with {@link #join(Object, Object)}.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> {

	public abstract E BOTTOM();

	public abstract E join(E lhs, E rhs);

	public E visitExpression(Expr expr) {
		if (expr instanceof Expr.Integer || expr instanceof Expr.BitVectorConstant || expr instanceof Expr.Boolean) {
			return BOTTOM();
		} else if (expr instanceof Expr.VariableAccess) {
			return constructVariableAccess((Expr.VariableAccess) expr);
		} else if (expr instanceof Expr.DictionaryAccess) {
			return visitDictionaryAccess((Expr.DictionaryAccess) expr);
		} else if (expr instanceof Expr.DictionaryUpdate) {
			Expr.DictionaryUpdate e = (Expr.DictionaryUpdate) expr;
			E r = join(visitExpression(e.getSource()), visitExpressions(e.getIndices()));
			return join(r, visitExpression(e.getValue()));
		} else if (expr instanceof Expr.Invoke) {
			return visitInvoke((Expr.Invoke) expr);
		} else if (expr instanceof Expr.IfThenElse) {
			Expr.IfThenElse e = (Expr.IfThenElse) expr;
			E r = join(visitExpression(e.getCondition()), visitExpression(e.getTrueBranch()));
			return join(r, visitExpression(e.getFalseBranch()));
		} else if (expr instanceof Expr.NaryOperator) {
			return visitExpressions(((Expr.NaryOperator) expr).getOperands());
		} else if (expr instanceof Expr.UnaryOperator) {
			return visitExpression(((Expr.UnaryOperator) expr).getOperand());
		} else if (expr instanceof Expr.Quantifier) {
			return visitQuantifier((Expr.Quantifier) expr);
		} else if (expr instanceof Expr.BinaryOperator) {
			Expr.BinaryOperator e = (Expr.BinaryOperator) expr;
			return join(visitExpression(e.getLeftHandSide()), visitExpression(e.getRightHandSide()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	public E visitExpressions(List<? extends Expr> exprs) {
		E result = BOTTOM();
		for (int i = 0; i != exprs.size(); ++i) {
			result = join(result, visitExpression(exprs.get(i)));
		}
		return result;
	}

	protected E constructVariableAccess(Expr.VariableAccess expr) {
		return BOTTOM();
	}

	protected E visitDictionaryAccess(Expr.DictionaryAccess expr) {
		return join(visitExpression(expr.getSource()), visitExpressions(expr.getIndices()));
	}

	protected E visitInvoke(Expr.Invoke expr) {
		return visitExpressions(expr.getArguments());
	}

	protected E visitQuantifier(Expr.Quantifier expr) {
		return visitExpression(expr.getBody());
	}
}
