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

import java.util.ArrayList;
import java.util.List;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;

/**
 * Rewrites expressions bottom-up. Each node is rebuilt only when one of its
 * children actually changed, so an expression which a transform leaves alone
 * comes back as the very same object. Attributes of rebuilt nodes are
 * preserved.
 */
public abstract class AbstractExpressionTransform {

	public Expr visitExpression(Expr expr) {
		if (expr instanceof Expr.Integer || expr instanceof Expr.BitVectorConstant || expr instanceof Expr.Boolean) {
			return expr;
		} else if (expr instanceof Expr.VariableAccess) {
			return visitVariableAccess((Expr.VariableAccess) expr);
		} else if (expr instanceof Expr.DictionaryAccess) {
			return visitDictionaryAccess((Expr.DictionaryAccess) expr);
		} else if (expr instanceof Expr.DictionaryUpdate) {
			return visitDictionaryUpdate((Expr.DictionaryUpdate) expr);
		} else if (expr instanceof Expr.Invoke) {
			return visitInvoke((Expr.Invoke) expr);
		} else if (expr instanceof Expr.IfThenElse) {
			return visitIfThenElse((Expr.IfThenElse) expr);
		} else if (expr instanceof Expr.LogicalAnd) {
			return visitLogicalAnd((Expr.LogicalAnd) expr);
		} else if (expr instanceof Expr.LogicalOr) {
			return visitLogicalOr((Expr.LogicalOr) expr);
		} else if (expr instanceof Expr.LogicalNot) {
			Expr.LogicalNot e = (Expr.LogicalNot) expr;
			Expr.Logical operand = visitLogical(e.getOperand());
			return operand == e.getOperand() ? e : BoogieFile.NOT(operand, e.getAttributes());
		} else if (expr instanceof Expr.Negation) {
			Expr.Negation e = (Expr.Negation) expr;
			Expr operand = visitExpression(e.getOperand());
			return operand == e.getOperand() ? e : BoogieFile.NEG(operand, e.getAttributes());
		} else if (expr instanceof Expr.Old) {
			Expr.Old e = (Expr.Old) expr;
			Expr operand = visitExpression(e.getOperand());
			return operand == e.getOperand() ? e : BoogieFile.OLD(operand, e.getAttributes());
		} else if (expr instanceof Expr.Quantifier) {
			return visitQuantifier((Expr.Quantifier) expr);
		} else if (expr instanceof Expr.BinaryOperator) {
			return visitBinaryOperator(expr);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	public Expr.Logical visitLogical(Expr.Logical expr) {
		return (Expr.Logical) visitExpression(expr);
	}

	public List<Expr> visitExpressions(List<Expr> exprs) {
		List<Expr> result = exprs;
		for (int i = 0; i != exprs.size(); ++i) {
			Expr o = exprs.get(i);
			Expr n = visitExpression(o);
			if (o != n) {
				if (result == exprs) {
					result = new ArrayList<>(exprs);
				}
				result.set(i, n);
			}
		}
		return result;
	}

	public List<Expr.Logical> visitLogicals(List<Expr.Logical> exprs) {
		List<Expr.Logical> result = exprs;
		for (int i = 0; i != exprs.size(); ++i) {
			Expr.Logical o = exprs.get(i);
			Expr.Logical n = visitLogical(o);
			if (o != n) {
				if (result == exprs) {
					result = new ArrayList<>(exprs);
				}
				result.set(i, n);
			}
		}
		return result;
	}

	protected Expr visitVariableAccess(Expr.VariableAccess expr) {
		return expr;
	}

	protected Expr visitDictionaryAccess(Expr.DictionaryAccess expr) {
		Expr source = visitExpression(expr.getSource());
		List<Expr> indices = visitExpressions(expr.getIndices());
		if (source == expr.getSource() && indices == expr.getIndices()) {
			return expr;
		}
		return BoogieFile.GET(source, indices, expr.getAttributes());
	}

	protected Expr visitDictionaryUpdate(Expr.DictionaryUpdate expr) {
		Expr source = visitExpression(expr.getSource());
		List<Expr> indices = visitExpressions(expr.getIndices());
		Expr value = visitExpression(expr.getValue());
		if (source == expr.getSource() && indices == expr.getIndices() && value == expr.getValue()) {
			return expr;
		}
		return BoogieFile.PUT(source, indices, value, expr.getAttributes());
	}

	protected Expr visitInvoke(Expr.Invoke expr) {
		List<Expr> arguments = visitExpressions(expr.getArguments());
		if (arguments == expr.getArguments()) {
			return expr;
		}
		return BoogieFile.INVOKE(expr.getName(), arguments, expr.getAttributes());
	}

	protected Expr visitIfThenElse(Expr.IfThenElse expr) {
		Expr.Logical condition = visitLogical(expr.getCondition());
		Expr trueBranch = visitExpression(expr.getTrueBranch());
		Expr falseBranch = visitExpression(expr.getFalseBranch());
		if (condition == expr.getCondition() && trueBranch == expr.getTrueBranch()
				&& falseBranch == expr.getFalseBranch()) {
			return expr;
		}
		return BoogieFile.ITE(condition, trueBranch, falseBranch, expr.getAttributes());
	}

	protected Expr visitLogicalAnd(Expr.LogicalAnd expr) {
		List<Expr.Logical> operands = visitLogicals(expr.getOperands());
		if (operands == expr.getOperands()) {
			return expr;
		}
		return BoogieFile.CONJOIN(operands, expr.getAttributes());
	}

	protected Expr visitLogicalOr(Expr.LogicalOr expr) {
		List<Expr.Logical> operands = visitLogicals(expr.getOperands());
		if (operands == expr.getOperands()) {
			return expr;
		}
		return BoogieFile.DISJOIN(operands, expr.getAttributes());
	}

	protected Expr visitQuantifier(Expr.Quantifier expr) {
		Expr.Logical body = visitLogical(expr.getBody());
		if (body == expr.getBody()) {
			return expr;
		}
		List<Decl.Parameter> parameters = expr.getParameters();
		if (expr instanceof Expr.UniversalQuantifier) {
			return BoogieFile.FORALL(parameters, body, expr.getAttributes());
		} else {
			return BoogieFile.EXISTS(parameters, body, expr.getAttributes());
		}
	}

	protected Expr visitBinaryOperator(Expr expr) {
		Expr.BinaryOperator op = (Expr.BinaryOperator) expr;
		Expr lhs = visitExpression(op.getLeftHandSide());
		Expr rhs = visitExpression(op.getRightHandSide());
		if (lhs == op.getLeftHandSide() && rhs == op.getRightHandSide()) {
			return expr;
		}
		BoogieFile.Attribute[] attributes = expr.getAttributes();
		if (expr instanceof Expr.Equals) {
			return BoogieFile.EQ(lhs, rhs, attributes);
		} else if (expr instanceof Expr.NotEquals) {
			return BoogieFile.NEQ(lhs, rhs, attributes);
		} else if (expr instanceof Expr.LessThan) {
			return BoogieFile.LT(lhs, rhs, attributes);
		} else if (expr instanceof Expr.LessThanOrEqual) {
			return BoogieFile.LTEQ(lhs, rhs, attributes);
		} else if (expr instanceof Expr.GreaterThan) {
			return BoogieFile.GT(lhs, rhs, attributes);
		} else if (expr instanceof Expr.GreaterThanOrEqual) {
			return BoogieFile.GTEQ(lhs, rhs, attributes);
		} else if (expr instanceof Expr.Iff) {
			return BoogieFile.IFF((Expr.Logical) lhs, (Expr.Logical) rhs, attributes);
		} else if (expr instanceof Expr.Implies) {
			return BoogieFile.IMPLIES((Expr.Logical) lhs, (Expr.Logical) rhs, attributes);
		} else if (expr instanceof Expr.Addition) {
			return BoogieFile.ADD(lhs, rhs, attributes);
		} else if (expr instanceof Expr.Subtraction) {
			return BoogieFile.SUB(lhs, rhs, attributes);
		} else if (expr instanceof Expr.Multiplication) {
			return BoogieFile.MUL(lhs, rhs, attributes);
		} else if (expr instanceof Expr.Division) {
			return BoogieFile.DIV(lhs, rhs, attributes);
		} else if (expr instanceof Expr.IntegerDivision) {
			return BoogieFile.IDIV(lhs, rhs, attributes);
		} else if (expr instanceof Expr.Remainder) {
			return BoogieFile.REM(lhs, rhs, attributes);
		} else {
			throw new IllegalArgumentException("unknown binary operator encountered (" + expr.getClass().getName() + ")");
		}
	}
}
