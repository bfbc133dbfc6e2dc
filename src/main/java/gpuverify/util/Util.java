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
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import gpuverify.core.BoogieFile.Attribute;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Stmt;
import gpuverify.core.BoogieFile.Type;

public class Util {

	/**
	 * Flatten a given list of elements where some or all elements are
	 * "compound" containing subelements to be extracted.
	 *
	 * @param items
	 * @param fn
	 * @param <S>
	 * @param <T>
	 * @return
	 */
	public static <S, T> List<T> flatten(List<S> items, Function<S, List<T>> fn) {
		ArrayList<T> result = new ArrayList<>();
		for (int i = 0; i != items.size(); ++i) {
			result.addAll(fn.apply(items.get(i)));
		}
		return result;
	}

	/**
	 * Map a given list of elements from one kind to another.
	 *
	 * @param items
	 * @param fn
	 * @param <T>
	 * @return
	 */
	public static <S, T> List<T> map(List<S> items, Function<S, T> fn) {
		ArrayList<T> rs = new ArrayList<>();
		for (int i = 0; i != items.size(); ++i) {
			rs.add(fn.apply(items.get(i)));
		}
		return rs;
	}

	/**
	 * Functional list append. This creates a fresh list containing both
	 * <code>left</code> and <code>right</code> operands.
	 *
	 * @param left
	 * @param right
	 * @param <T>
	 * @return
	 */
	public static <T> List<T> append(T left, List<? extends T> right) {
		ArrayList<T> result = new ArrayList<>();
		result.add(left);
		result.addAll(right);
		return result;
	}

	public static <T> List<T> append(List<? extends T> left, T right) {
		ArrayList<T> result = new ArrayList<>(left);
		result.add(right);
		return result;
	}

	public static <T> List<T> append(List<? extends T> left, List<? extends T> right) {
		ArrayList<T> result = new ArrayList<>(left);
		result.addAll(right);
		return result;
	}

	public static Attribute[] append(Attribute[] attributes, Attribute attribute) {
		Attribute[] result = Arrays.copyOf(attributes, attributes.length + 1);
		result[attributes.length] = attribute;
		return result;
	}

	/**
	 * Flatten a statement into the list of statements it sequences. Nested
	 * sequences are flattened recursively.
	 *
	 * @param stmt
	 * @return
	 */
	public static List<Stmt> flatten(Stmt stmt) {
		ArrayList<Stmt> result = new ArrayList<>();
		flatten(stmt, result);
		return result;
	}

	private static void flatten(Stmt stmt, List<Stmt> result) {
		if (stmt instanceof Stmt.Sequence) {
			for (Stmt s : ((Stmt.Sequence) stmt).getAll()) {
				flatten(s, result);
			}
		} else {
			result.add(stmt);
		}
	}

	/**
	 * Get the variable at the root of an access chain such as
	 * <code>A[i][j]</code>, or <code>null</code> if the expression is not an
	 * access chain.
	 *
	 * @param e
	 * @return
	 */
	public static Expr.VariableAccess rootOf(Expr e) {
		while (e instanceof Expr.DictionaryAccess) {
			e = ((Expr.DictionaryAccess) e).getSource();
		}
		return (e instanceof Expr.VariableAccess) ? (Expr.VariableAccess) e : null;
	}

	/**
	 * Get the indices of an access chain, ordered from the root outwards. For
	 * example, <code>A[i][j]</code> gives <code>[i, j]</code>.
	 *
	 * @param e
	 * @return
	 */
	public static List<Expr> indicesOf(Expr e) {
		ArrayList<Expr> result = new ArrayList<>();
		while (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess a = (Expr.DictionaryAccess) e;
			result.addAll(0, a.getIndices());
			e = a.getSource();
		}
		return result;
	}

	/**
	 * Peel a given number of map layers off a type. For example, peeling two
	 * layers off <code>[bv32][bv32]bv8</code> gives <code>bv8</code>.
	 *
	 * @param type
	 * @param levels
	 * @return
	 */
	public static Type elementType(Type type, int levels) {
		for (int i = 0; i != levels; ++i) {
			if (!(type instanceof Type.Dictionary)) {
				throw new IllegalArgumentException("type " + type + " has fewer than " + levels + " map levels");
			}
			type = ((Type.Dictionary) type).getValue();
		}
		return type;
	}

	/**
	 * Determine the names of all variables read by an expression, excluding
	 * those bound by quantifiers within it.
	 *
	 * @param e
	 * @return
	 */
	public static Set<String> variablesOf(Expr e) {
		return new AbstractExpressionFold<Set<String>>() {
			@Override
			public Set<String> BOTTOM() {
				return new LinkedHashSet<>();
			}

			@Override
			public Set<String> join(Set<String> lhs, Set<String> rhs) {
				lhs.addAll(rhs);
				return lhs;
			}

			@Override
			protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
				Set<String> r = BOTTOM();
				r.add(expr.getVariable());
				return r;
			}

			@Override
			protected Set<String> visitQuantifier(Expr.Quantifier expr) {
				Set<String> r = visitExpression(expr.getBody());
				for (Decl.Parameter p : expr.getParameters()) {
					r.remove(p.getName());
				}
				return r;
			}
		}.visitExpression(e);
	}

	/**
	 * Produce a name usable as part of an identifier from a given type, e.g.
	 * <code>[bv32]bv8</code> becomes <code>_bv32_bv8</code>.
	 *
	 * @param type
	 * @return
	 */
	public static String mangle(Type type) {
		return type.toString().replaceAll("[\\[\\],]", "_");
	}
}
