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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Type;

/**
 * Determines the types of expressions against the declarations of a given
 * program. Variables are looked up first in a supplied local scope, and then
 * amongst the globals and constants. Type synonyms are expanded before types
 * are compared.
 */
public class TypeChecker {
	private final Map<String, Type> globals = new HashMap<>();
	private final Map<String, Decl.Function> functions = new HashMap<>();
	private final Map<String, Type> synonyms = new HashMap<>();

	public TypeChecker(BoogieFile file) {
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Variable) {
				globals.put(((Decl.Variable) d).getName(), ((Decl.Variable) d).getType());
			} else if (d instanceof Decl.Constant) {
				globals.put(((Decl.Constant) d).getName(), ((Decl.Constant) d).getType());
			} else if (d instanceof Decl.Function) {
				functions.put(((Decl.Function) d).getName(), (Decl.Function) d);
			} else if (d instanceof Decl.TypeSynonym) {
				synonyms.put(((Decl.TypeSynonym) d).getName(), ((Decl.TypeSynonym) d).getSynonym());
			}
		}
	}

	/**
	 * Check that a given expression is a well-typed boolean.
	 *
	 * @param e
	 * @param scope
	 *            Types of the parameters and locals in scope.
	 * @throws TypeError
	 */
	public void checkLogical(Expr e, Map<String, Type> scope) throws TypeError {
		expect(Type.Bool, typeOf(e, scope));
	}

	public Type typeOf(Expr e, Map<String, Type> scope) throws TypeError {
		if (e instanceof Expr.Boolean) {
			return Type.Bool;
		} else if (e instanceof Expr.Integer) {
			return Type.Int;
		} else if (e instanceof Expr.BitVectorConstant) {
			return new Type.BitVector(((Expr.BitVectorConstant) e).getWidth());
		} else if (e instanceof Expr.VariableAccess) {
			String name = ((Expr.VariableAccess) e).getVariable();
			Type type = scope.containsKey(name) ? scope.get(name) : globals.get(name);
			if (type == null) {
				throw new TypeError("unknown variable " + name);
			}
			return expand(type);
		} else if (e instanceof Expr.Equals || e instanceof Expr.NotEquals) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			expect(typeOf(b.getLeftHandSide(), scope), typeOf(b.getRightHandSide(), scope));
			return Type.Bool;
		} else if (e instanceof Expr.LessThan || e instanceof Expr.LessThanOrEqual || e instanceof Expr.GreaterThan
				|| e instanceof Expr.GreaterThanOrEqual) {
			arithmetic((Expr.BinaryOperator) e, scope);
			return Type.Bool;
		} else if (e instanceof Expr.Iff || e instanceof Expr.Implies) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			expect(Type.Bool, typeOf(b.getLeftHandSide(), scope));
			expect(Type.Bool, typeOf(b.getRightHandSide(), scope));
			return Type.Bool;
		} else if (e instanceof Expr.Addition || e instanceof Expr.Subtraction || e instanceof Expr.Multiplication) {
			return arithmetic((Expr.BinaryOperator) e, scope);
		} else if (e instanceof Expr.Division) {
			arithmetic((Expr.BinaryOperator) e, scope);
			return Type.Real;
		} else if (e instanceof Expr.IntegerDivision || e instanceof Expr.Remainder) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			expect(Type.Int, typeOf(b.getLeftHandSide(), scope));
			expect(Type.Int, typeOf(b.getRightHandSide(), scope));
			return Type.Int;
		} else if (e instanceof Expr.Negation) {
			Type t = typeOf(((Expr.Negation) e).getOperand(), scope);
			if (!t.equals(Type.Int) && !t.equals(Type.Real)) {
				throw new TypeError("expected int or real, found " + t);
			}
			return t;
		} else if (e instanceof Expr.Old) {
			return typeOf(((Expr.Old) e).getOperand(), scope);
		} else if (e instanceof Expr.LogicalNot) {
			expect(Type.Bool, typeOf(((Expr.LogicalNot) e).getOperand(), scope));
			return Type.Bool;
		} else if (e instanceof Expr.NaryOperator) {
			for (Expr operand : ((Expr.NaryOperator) e).getOperands()) {
				expect(Type.Bool, typeOf(operand, scope));
			}
			return Type.Bool;
		} else if (e instanceof Expr.IfThenElse) {
			Expr.IfThenElse ite = (Expr.IfThenElse) e;
			expect(Type.Bool, typeOf(ite.getCondition(), scope));
			Type t = typeOf(ite.getTrueBranch(), scope);
			expect(t, typeOf(ite.getFalseBranch(), scope));
			return t;
		} else if (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			return select(typeOf(a.getSource(), scope), a.getIndices(), scope);
		} else if (e instanceof Expr.DictionaryUpdate) {
			Expr.DictionaryUpdate u = (Expr.DictionaryUpdate) e;
			Type source = typeOf(u.getSource(), scope);
			expect(select(source, u.getIndices(), scope), typeOf(u.getValue(), scope));
			return source;
		} else if (e instanceof Expr.Invoke) {
			return invoke((Expr.Invoke) e, scope);
		} else if (e instanceof Expr.Quantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			Map<String, Type> inner = new HashMap<>(scope);
			for (Decl.Parameter p : q.getParameters()) {
				inner.put(p.getName(), p.getType());
			}
			expect(Type.Bool, typeOf(q.getBody(), inner));
			return Type.Bool;
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private Type arithmetic(Expr.BinaryOperator b, Map<String, Type> scope) throws TypeError {
		Type lhs = typeOf(b.getLeftHandSide(), scope);
		Type rhs = typeOf(b.getRightHandSide(), scope);
		if (!lhs.equals(Type.Int) && !lhs.equals(Type.Real)) {
			throw new TypeError("expected int or real, found " + lhs);
		}
		expect(lhs, rhs);
		return lhs;
	}

	private Type select(Type source, List<Expr> indices, Map<String, Type> scope) throws TypeError {
		if (!(source instanceof Type.Dictionary)) {
			throw new TypeError("expected map, found " + source);
		}
		Type.Dictionary map = (Type.Dictionary) source;
		if (map.getKeys().size() != indices.size()) {
			throw new TypeError("expected " + map.getKeys().size() + " indices, found " + indices.size());
		}
		for (int i = 0; i != indices.size(); ++i) {
			expect(expand(map.getKeys().get(i)), typeOf(indices.get(i), scope));
		}
		return expand(map.getValue());
	}

	private Type invoke(Expr.Invoke e, Map<String, Type> scope) throws TypeError {
		Decl.Function f = functions.get(e.getName());
		if (f == null) {
			throw new TypeError("unknown function " + e.getName());
		} else if (f.getParameters().size() != e.getArguments().size()) {
			throw new TypeError(e.getName() + " expects " + f.getParameters().size() + " arguments");
		}
		for (int i = 0; i != e.getArguments().size(); ++i) {
			expect(expand(f.getParameters().get(i).getType()), typeOf(e.getArguments().get(i), scope));
		}
		return expand(f.getReturns());
	}

	private Type expand(Type t) {
		while (t instanceof Type.Synonym && synonyms.containsKey(((Type.Synonym) t).getSynonym())) {
			t = synonyms.get(((Type.Synonym) t).getSynonym());
		}
		if (t instanceof Type.Dictionary) {
			Type.Dictionary d = (Type.Dictionary) t;
			List<Type> keys = new ArrayList<>();
			for (Type k : d.getKeys()) {
				keys.add(expand(k));
			}
			return new Type.Dictionary(keys, expand(d.getValue()));
		}
		return t;
	}

	private void expect(Type expected, Type actual) throws TypeError {
		if (!expand(expected).equals(expand(actual))) {
			throw new TypeError("expected " + expected + ", found " + actual);
		}
	}

	/**
	 * Signals an expression which is not well typed.
	 */
	public static class TypeError extends Exception {
		private static final long serialVersionUID = 1L;

		public TypeError(String message) {
			super(message);
		}
	}
}
